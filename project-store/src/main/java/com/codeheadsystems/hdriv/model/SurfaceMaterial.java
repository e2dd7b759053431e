package com.codeheadsystems.hdriv.model;

import java.util.Optional;
import org.immutables.value.Value;

/**
 * Material of the matte, chrome and plastic spheres. Each sphere has its own defaults.
 */
@Value.Immutable
public interface SurfaceMaterial {

  /**
   * Default matte sphere.
   *
   * @return the surface material
   */
  static SurfaceMaterial matte() {
    return of("#ffffff", 1, 0);
  }

  /**
   * Default chrome sphere.
   *
   * @return the surface material
   */
  static SurfaceMaterial chrome() {
    return of("#ffffff", 0, 1);
  }

  /**
   * Default plastic sphere.
   *
   * @return the surface material
   */
  static SurfaceMaterial plastic() {
    return of("#00bcd4", 0.1, 0.05);
  }

  /**
   * Of surface material.
   *
   * @param color     the color
   * @param roughness the roughness
   * @param metalness the metalness
   * @return the surface material
   */
  static SurfaceMaterial of(final String color, final double roughness, final double metalness) {
    return ImmutableSurfaceMaterial.builder().color(color).roughness(roughness).metalness(metalness).build();
  }

  String color();

  double roughness();

  double metalness();

  Optional<Asset> roughnessTexture();

}
