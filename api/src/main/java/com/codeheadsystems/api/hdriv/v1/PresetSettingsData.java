package com.codeheadsystems.api.hdriv.v1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import org.immutables.value.Value;

/**
 * Visibility parameters carried by a preset file.
 */
@Value.Immutable
@JsonSerialize(as = ImmutablePresetSettingsData.class)
@JsonDeserialize(builder = ImmutablePresetSettingsData.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface PresetSettingsData {

  @JsonProperty("spheresVisible")
  boolean spheresVisible();

  @JsonProperty("groundVisible")
  boolean groundVisible();

  @JsonProperty("shadowsVisible")
  boolean shadowsVisible();

  @JsonProperty("colorCheckerVisible")
  boolean colorCheckerVisible();

  @JsonProperty("colorCheckerRows")
  List<Integer> colorCheckerRows();

}
