package com.codeheadsystems.api.hdriv.v1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * A custom preset that was applied to the project, embedded under {@code loadedPreset}.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableLoadedPresetData.class)
@JsonDeserialize(builder = ImmutableLoadedPresetData.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface LoadedPresetData {

  @JsonProperty("name")
  String name();

  @JsonProperty("data")
  PresetFile data();

}
