package com.ospicorp.soilprofile.analysis.service;

import com.ospicorp.soilprofile.analysis.model.SoilType;

/**
 * Simplified texture-triangle decision tree. Rules are evaluated in order and the first match
 * wins, so every finite triple maps to exactly one class.
 */
public final class SoilClassifier {
  private SoilClassifier() {
  }

  public static SoilType classify(double clay, double sand, double silt) {
    if (!Double.isFinite(clay) || !Double.isFinite(sand) || !Double.isFinite(silt)) {
      return SoilType.UNKNOWN;
    }
    if (sand >= 85d) {
      return SoilType.SANDY;
    }
    if (clay >= 40d) {
      return SoilType.CLAY;
    }
    if (silt >= 80d) {
      return SoilType.SILTY;
    }
    if (sand >= 70d) {
      return SoilType.SANDY_LOAM;
    }
    if (clay >= 27d && silt >= 28d && sand <= 45d) {
      return SoilType.CLAY_LOAM;
    }
    return SoilType.LOAM;
  }
}
