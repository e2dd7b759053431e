package com.codeheadsystems.api.hdriv.v1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Glass sphere parameters.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableGlassData.class)
@JsonDeserialize(builder = ImmutableGlassData.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface GlassData {

  @JsonProperty("color")
  String color();

  @JsonProperty("roughness")
  double roughness();

  @JsonProperty("ior")
  double ior();

  @JsonProperty("transmission")
  double transmission();

  @JsonProperty("roughnessTexture")
  @JsonInclude(JsonInclude.Include.NON_ABSENT)
  Optional<TextureEntry> roughnessTexture();

}
