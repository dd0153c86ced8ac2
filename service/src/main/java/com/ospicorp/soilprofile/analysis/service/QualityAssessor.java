package com.ospicorp.soilprofile.analysis.service;

import com.ospicorp.soilprofile.analysis.model.DataQuality;

/**
 * Maps source availability and field validity to a {@link DataQuality}.
 *
 * <ul>
 *   <li>no source answered: {@code INSUFFICIENT}</li>
 *   <li>all sources answered, every environmental field and the composition valid: {@code HIGH}</li>
 *   <li>temperature and composition valid: {@code MEDIUM}</li>
 *   <li>otherwise: {@code LOW}</li>
 * </ul>
 *
 * More sources or more valid fields never lower the verdict.
 */
public final class QualityAssessor {
  private QualityAssessor() {
  }

  public static DataQuality assess(boolean weatherOk, boolean atmosphericOk, boolean soilOk,
      boolean environmentValid, boolean temperatureValid, boolean compositionValid) {
    if (!weatherOk && !atmosphericOk && !soilOk) {
      return DataQuality.INSUFFICIENT;
    }
    if (weatherOk && atmosphericOk && soilOk && environmentValid && compositionValid) {
      return DataQuality.HIGH;
    }
    if (temperatureValid && compositionValid) {
      return DataQuality.MEDIUM;
    }
    return DataQuality.LOW;
  }
}
