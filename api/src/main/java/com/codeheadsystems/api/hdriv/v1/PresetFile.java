package com.codeheadsystems.api.hdriv.v1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * The interface Preset file.
 * <p>
 * A stand-alone, unencrypted document holding only visibility and material parameters.
 * Its version tag is fixed.
 */
@Value.Immutable
@JsonSerialize(as = ImmutablePresetFile.class)
@JsonDeserialize(builder = ImmutablePresetFile.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface PresetFile {

  /**
   * The only preset file version.
   */
  String VERSION = "1.0";

  /**
   * Version string.
   *
   * @return the string
   */
  @JsonProperty("version")
  @Value.Default
  default String version() {
    return VERSION;
  }

  /**
   * Display name of the preset.
   *
   * @return the name
   */
  @JsonProperty("name")
  String name();

  @JsonProperty("settings")
  PresetSettingsData settings();

  @JsonProperty("materials")
  PresetMaterialsData materials();

}
