package com.ospicorp.soilprofile.analysis.service;

import com.ospicorp.soilprofile.analysis.fetch.FetchResult;
import com.ospicorp.soilprofile.analysis.model.DataQuality;
import com.ospicorp.soilprofile.analysis.model.EnvironmentalConditions;
import com.ospicorp.soilprofile.analysis.model.ProfileCore;
import com.ospicorp.soilprofile.analysis.model.RangeSpec;
import com.ospicorp.soilprofile.analysis.model.SoilComposition;
import com.ospicorp.soilprofile.analysis.model.SoilProfile;
import com.ospicorp.soilprofile.analysis.model.SoilType;
import com.ospicorp.soilprofile.analysis.model.SourceStatus;
import com.ospicorp.soilprofile.analysis.model.ValidatedValue;
import com.ospicorp.soilprofile.analysis.source.AtmosphericSummary;
import com.ospicorp.soilprofile.analysis.source.SoilGridLayers;
import com.ospicorp.soilprofile.analysis.source.SourceKind;
import com.ospicorp.soilprofile.analysis.source.WeatherReading;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Merges the three source payloads into a validated profile. Stateless: identical inputs give
 * equal outputs.
 */
@Component
public class ProfileBuilder {

  static final double ORGANIC_MATTER_PER_CARBON = 0.058d;
  static final double NITROGEN_PER_ORGANIC_MATTER = 0.05d;
  static final double NEUTRAL_PH = 7.0d;

  public ProfileCore build(FetchResult weather, FetchResult atmospheric, FetchResult soil) {
    WeatherReading reading = weather.ok() ? WeatherReading.from(weather.payload())
        : WeatherReading.EMPTY;
    AtmosphericSummary summary = atmospheric.ok() ? AtmosphericSummary.from(atmospheric.payload())
        : AtmosphericSummary.EMPTY;
    SoilGridLayers layers = soil.ok() ? SoilGridLayers.from(soil.payload())
        : SoilGridLayers.EMPTY;

    EnvironmentalConditions environment = new EnvironmentalConditions(
        RangeValidator.validate(
            preferred(reading.temperatureC(), summary.meanTemperatureC()),
            RangeSpec.TEMPERATURE_C),
        RangeValidator.validate(
            preferred(reading.humidityPct(), summary.meanHumidityPct()),
            RangeSpec.HUMIDITY_PCT),
        RangeValidator.validate(summary.meanPrecipitationMm(), RangeSpec.PRECIPITATION_MM));

    SoilComposition composition = RangeValidator.validateComposition(
        layers.clayOrZero(), layers.sandOrZero(), layers.siltOrZero());
    SoilType soilType = composition.isDegenerate()
        ? SoilType.UNKNOWN
        : SoilClassifier.classify(composition.clay(), composition.sand(), composition.silt());

    ValidatedValue organicMatter = organicMatter(layers.organicCarbon());
    SoilProfile profile = new SoilProfile(
        composition,
        ph(layers.phOrZero()),
        organicMatter,
        nitrogen(organicMatter),
        MoistureEstimator.estimate(composition, environment),
        soilType);

    DataQuality quality = QualityAssessor.assess(
        weather.ok(), atmospheric.ok(), soil.ok(),
        environment.isAllValid(), environment.temperatureC().valid(), composition.valid());

    List<SourceStatus> sources = List.of(
        new SourceStatus(SourceKind.WEATHER.id(), weather.ok()),
        new SourceStatus(SourceKind.ATMOSPHERIC.id(), atmospheric.ok()),
        new SourceStatus(SourceKind.SOIL.id(), soil.ok()));

    return new ProfileCore(environment, profile, quality, sources);
  }

  private static Double preferred(Double primary, Double fallback) {
    return primary != null ? primary : fallback;
  }

  // zero means the source had no reading; a real reading outside [3, 10] is clamped instead
  private static ValidatedValue ph(double raw) {
    if (raw == 0d) {
      return ValidatedValue.synthesized(NEUTRAL_PH);
    }
    return RangeValidator.validate(raw, RangeSpec.PH);
  }

  private static ValidatedValue organicMatter(Double organicCarbon) {
    Double organicMatter = organicCarbon == null ? null
        : organicCarbon * ORGANIC_MATTER_PER_CARBON;
    return RangeValidator.validate(organicMatter, RangeSpec.ORGANIC_MATTER_PCT);
  }

  private static ValidatedValue nitrogen(ValidatedValue organicMatter) {
    ValidatedValue nitrogen = RangeValidator.validate(
        organicMatter.value() * NITROGEN_PER_ORGANIC_MATTER, RangeSpec.NITROGEN_PCT);
    return new ValidatedValue(nitrogen.value(), nitrogen.valid() && organicMatter.valid());
  }
}
