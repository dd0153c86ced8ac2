package com.ospicorp.soilprofile.analysis.service;

import com.ospicorp.soilprofile.analysis.model.EnvironmentalConditions;
import com.ospicorp.soilprofile.analysis.model.RangeSpec;
import com.ospicorp.soilprofile.analysis.model.SoilComposition;
import com.ospicorp.soilprofile.analysis.model.ValidatedValue;

/**
 * Rough volumetric moisture estimate: a texture-based field capacity scaled by recent weather.
 */
public final class MoistureEstimator {
  private MoistureEstimator() {
  }

  public static ValidatedValue estimate(SoilComposition composition,
      EnvironmentalConditions environment) {
    double clay = composition.clay();
    double sand = composition.sand();
    double fieldCapacity = (0.3d * clay + 0.2d * (100d - sand - clay)) / 100d;

    double moistureFactor = (environment.precipitationMm().value() * 0.4d
        + environment.humidityPct().value() * 0.4d
        - environment.temperatureC().value() * 0.2d) / 100d;

    double estimate = fieldCapacity * (1d + moistureFactor) * 100d;
    ValidatedValue moisture = RangeValidator.validate(estimate, RangeSpec.MOISTURE_PCT);
    boolean inputsValid = composition.valid() && environment.isAllValid();
    return new ValidatedValue(moisture.value(), moisture.valid() && inputsValid);
  }
}
