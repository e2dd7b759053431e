package com.codeheadsystems.hdriv.model;

import java.util.Optional;
import org.immutables.value.Value;

/**
 * The interface Glass material.
 */
@Value.Immutable
public interface GlassMaterial {

  @Value.Default
  default String color() {
    return "#ffffff";
  }

  @Value.Default
  default double roughness() {
    return 0;
  }

  @Value.Default
  default double ior() {
    return 1.5;
  }

  @Value.Default
  default double transmission() {
    return 1;
  }

  Optional<Asset> roughnessTexture();

}
