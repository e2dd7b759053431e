package com.codeheadsystems.hdriv.model;

import java.util.Optional;
import org.immutables.value.Value;

/**
 * The interface Floor material.
 */
@Value.Immutable
public interface FloorMaterial {

  @Value.Default
  default double tiling() {
    return 40;
  }

  /**
   * Custom floor texture. The renderer's built-in texture is used when empty.
   *
   * @return the texture
   */
  Optional<Asset> texture();

}
