package com.codeheadsystems.api.hdriv.v1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Material parameters carried by a preset file. Presets never carry textures.
 */
@Value.Immutable
@JsonSerialize(as = ImmutablePresetMaterialsData.class)
@JsonDeserialize(builder = ImmutablePresetMaterialsData.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface PresetMaterialsData {

  @JsonProperty("floorTiling")
  double floorTiling();

  @JsonProperty("glass")
  GlassData glass();

  @JsonProperty("matte")
  SurfaceData matte();

  @JsonProperty("chrome")
  SurfaceData chrome();

  @JsonProperty("plastic")
  SurfaceData plastic();

}
