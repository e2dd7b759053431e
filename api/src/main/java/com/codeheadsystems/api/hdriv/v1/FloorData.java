package com.codeheadsystems.api.hdriv.v1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Floor material parameters.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableFloorData.class)
@JsonDeserialize(builder = ImmutableFloorData.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface FloorData {

  @JsonProperty("tiling")
  double tiling();

  @JsonProperty("texture")
  @JsonInclude(JsonInclude.Include.NON_ABSENT)
  Optional<TextureEntry> texture();

}
