package com.codeheadsystems.api.hdriv.v1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Parameters shared by the matte, chrome and plastic spheres.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableSurfaceData.class)
@JsonDeserialize(builder = ImmutableSurfaceData.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface SurfaceData {

  @JsonProperty("color")
  String color();

  @JsonProperty("roughness")
  double roughness();

  @JsonProperty("metalness")
  double metalness();

  @JsonProperty("roughnessTexture")
  @JsonInclude(JsonInclude.Include.NON_ABSENT)
  Optional<TextureEntry> roughnessTexture();

}
