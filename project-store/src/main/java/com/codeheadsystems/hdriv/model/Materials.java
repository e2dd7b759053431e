package com.codeheadsystems.hdriv.model;

import org.immutables.value.Value;

/**
 * Floor and sphere materials.
 */
@Value.Immutable
public interface Materials {

  /**
   * Materials of a new project.
   *
   * @return the materials
   */
  static Materials defaults() {
    return ImmutableMaterials.builder().build();
  }

  @Value.Default
  default FloorMaterial floor() {
    return ImmutableFloorMaterial.builder().build();
  }

  @Value.Default
  default GlassMaterial glass() {
    return ImmutableGlassMaterial.builder().build();
  }

  @Value.Default
  default SurfaceMaterial matte() {
    return SurfaceMaterial.matte();
  }

  @Value.Default
  default SurfaceMaterial chrome() {
    return SurfaceMaterial.chrome();
  }

  @Value.Default
  default SurfaceMaterial plastic() {
    return SurfaceMaterial.plastic();
  }

}
