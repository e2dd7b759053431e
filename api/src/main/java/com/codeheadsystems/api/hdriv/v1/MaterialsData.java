package com.codeheadsystems.api.hdriv.v1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * The {@code materials} block of a 1.7 document.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableMaterialsData.class)
@JsonDeserialize(builder = ImmutableMaterialsData.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface MaterialsData {

  @JsonProperty("floor")
  FloorData floor();

  @JsonProperty("glass")
  GlassData glass();

  @JsonProperty("matte")
  SurfaceData matte();

  @JsonProperty("chrome")
  SurfaceData chrome();

  @JsonProperty("plastic")
  SurfaceData plastic();

}
