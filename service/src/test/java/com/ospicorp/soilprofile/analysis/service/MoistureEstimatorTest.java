package com.ospicorp.soilprofile.analysis.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.ospicorp.soilprofile.analysis.model.EnvironmentalConditions;
import com.ospicorp.soilprofile.analysis.model.SoilComposition;
import com.ospicorp.soilprofile.analysis.model.ValidatedValue;
import org.junit.jupiter.api.Test;

class MoistureEstimatorTest {

  private static EnvironmentalConditions environment(double temp, double humidity,
      double precipitation, boolean valid) {
    return new EnvironmentalConditions(
        new ValidatedValue(temp, valid),
        new ValidatedValue(humidity, true),
        new ValidatedValue(precipitation, true));
  }

  @Test
  void loamUnderMildWeather() {
    var composition = new SoilComposition(20d, 40d, 40d, true);

    var moisture = MoistureEstimator.estimate(composition, environment(20d, 60d, 2d, true));

    assertThat(moisture.value()).isCloseTo(16.912d, within(1e-9));
    assertThat(moisture.valid()).isTrue();
  }

  @Test
  void invalidInputsMarkEstimateInvalid() {
    var composition = new SoilComposition(20d, 40d, 40d, true);

    var moisture = MoistureEstimator.estimate(composition, environment(20d, 60d, 2d, false));

    assertThat(moisture.value()).isCloseTo(16.912d, within(1e-9));
    assertThat(moisture.valid()).isFalse();

    var fromInvalidSoil = MoistureEstimator.estimate(
        new SoilComposition(20d, 40d, 40d, false), environment(20d, 60d, 2d, true));
    assertThat(fromInvalidSoil.valid()).isFalse();
  }

  @Test
  void estimateIsClampedToRange() {
    var composition = new SoilComposition(100d, 0d, 0d, true);
    var wet = new EnvironmentalConditions(
        new ValidatedValue(-50d, true),
        new ValidatedValue(100d, true),
        new ValidatedValue(500d, true));

    var moisture = MoistureEstimator.estimate(composition, wet);

    assertThat(moisture).isEqualTo(new ValidatedValue(100d, false));
  }

  @Test
  void degenerateCompositionIsNeverValid() {
    var moisture = MoistureEstimator.estimate(SoilComposition.EMPTY,
        environment(20d, 60d, 2d, true));

    assertThat(moisture.value()).isCloseTo(20d * (1d + 0.208d), within(1e-9));
    assertThat(moisture.valid()).isFalse();
  }
}
