package com.ospicorp.soilprofile.analysis.source;

import static com.ospicorp.soilprofile.analysis.source.PayloadFixtures.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class PayloadReadersTest {

  @Test
  void weatherReadsMainSection() {
    var reading = WeatherReading.from(PayloadFixtures.weather());

    assertThat(reading.temperatureC()).isEqualTo(27.4d);
    assertThat(reading.humidityPct()).isEqualTo(62d);
  }

  @Test
  void weatherToleratesMissingAndTextualFields() {
    assertThat(WeatherReading.from(json("{}"))).isEqualTo(WeatherReading.EMPTY);

    var reading = WeatherReading.from(json("{\"main\": {\"temp\": \"21.5\", \"humidity\": \"n/a\"}}"));
    assertThat(reading.temperatureC()).isEqualTo(21.5d);
    assertThat(reading.humidityPct()).isNull();
  }

  @Test
  void weatherIgnoresWrongTypes() {
    var reading = WeatherReading.from(json("{\"main\": {\"temp\": [1], \"humidity\": true}}"));

    assertThat(reading).isEqualTo(WeatherReading.EMPTY);
  }

  @Test
  void atmosphericAveragesSkippingFillValuesAndNulls() {
    var summary = AtmosphericSummary.from(PayloadFixtures.atmospheric());

    assertThat(summary.meanTemperatureC()).isCloseTo(27.0d, within(1e-9));
    assertThat(summary.meanHumidityPct()).isCloseTo(66.0d, within(1e-9));
    assertThat(summary.meanPrecipitationMm()).isCloseTo(7.0d / 6.0d, within(1e-9));
  }

  @Test
  void atmosphericSeriesWithoutUsableValuesIsAbsent() {
    var summary = AtmosphericSummary.from(json("""
        {"properties": {"parameter": {
          "T2M": {"20261012": -999, "20261013": null},
          "RH2M": [55, 60],
          "PRECTOTCORR": {"20261012": "1.5", "20261013": "x"}
        }}}
        """));

    assertThat(summary.meanTemperatureC()).isNull();
    assertThat(summary.meanHumidityPct()).isNull();
    assertThat(summary.meanPrecipitationMm()).isEqualTo(1.5d);
  }

  @Test
  void atmosphericEmptyDocumentGivesEmptySummary() {
    assertThat(AtmosphericSummary.from(json("{}"))).isEqualTo(AtmosphericSummary.EMPTY);
  }

  @Test
  void soilGridsPicksShallowestDepthAndAppliesConversionFactor() {
    var layers = SoilGridLayers.from(PayloadFixtures.soil());

    assertThat(layers.clayPct()).isEqualTo(30d);
    assertThat(layers.sandPct()).isEqualTo(40d);
    assertThat(layers.siltPct()).isEqualTo(30d);
    assertThat(layers.ph()).isEqualTo(6.5d);
    assertThat(layers.organicCarbon()).isEqualTo(25d);
  }

  @Test
  void soilGridsWithoutFactorUsesRawMean() {
    var layers = SoilGridLayers.from(json("""
        {"properties": {"layers": [
          {"name": "clay", "depths": [{"range": {"top_depth": 0}, "values": {"mean": 22}}]}
        ]}}
        """));

    assertThat(layers.clayPct()).isEqualTo(22d);
    assertThat(layers.sandPct()).isNull();
    assertThat(layers.sandOrZero()).isZero();
  }

  @Test
  void soilGridsNullOrMalformedMeansAreAbsent() {
    var layers = SoilGridLayers.from(json("""
        {"properties": {"layers": [
          {"name": "clay", "unit_measure": {"d_factor": 10},
           "depths": [{"range": {"top_depth": 0}, "values": {"mean": null}}]},
          {"name": "sand", "unit_measure": {"d_factor": 10},
           "depths": [{"range": {"top_depth": 0}, "values": {"mean": "abc"}}]},
          {"name": "silt", "unit_measure": {"d_factor": 10}, "depths": []}
        ]}}
        """));

    assertThat(layers.clayPct()).isNull();
    assertThat(layers.sandPct()).isNull();
    assertThat(layers.siltPct()).isNull();
    assertThat(layers.phOrZero()).isZero();
  }

  @Test
  void soilGridsLayersOfWrongTypeGiveEmpty() {
    assertThat(SoilGridLayers.from(json("{\"properties\": {\"layers\": {}}}")))
        .isEqualTo(SoilGridLayers.EMPTY);
    assertThat(SoilGridLayers.from(json("[]"))).isEqualTo(SoilGridLayers.EMPTY);
  }
}
