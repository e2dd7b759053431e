package com.codeheadsystems.api.hdriv.v1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Key light annotation stored next to an HDRI.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableLightsData.class)
@JsonDeserialize(builder = ImmutableLightsData.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface LightsData {

  /**
   * Direction towards the key light.
   *
   * @return the direction
   */
  @JsonProperty("direction")
  DirectionData direction();

  /**
   * Directional light intensity.
   *
   * @return the intensity
   */
  @JsonProperty("intensity")
  double intensity();

  /**
   * Ambient light intensity.
   *
   * @return the ambient intensity
   */
  @JsonProperty("ambientIntensity")
  double ambientIntensity();

  /**
   * Shadow blur radius.
   *
   * @return the shadow radius
   */
  @JsonProperty("shadowRadius")
  double shadowRadius();

}
