package com.codeheadsystems.api.hdriv.v1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Unit vector towards the key light.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableDirectionData.class)
@JsonDeserialize(builder = ImmutableDirectionData.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface DirectionData {

  @JsonProperty("x")
  double x();

  @JsonProperty("y")
  double y();

  @JsonProperty("z")
  double z();

}
