package com.codeheadsystems.hdriv.migration;

import com.codeheadsystems.hdriv.model.AssetSlot;
import com.codeheadsystems.hdriv.model.ImmutableFloorMaterial;
import com.codeheadsystems.hdriv.model.ImmutableGlassMaterial;
import com.codeheadsystems.hdriv.model.ImmutableMaterials;
import com.codeheadsystems.hdriv.model.ImmutableProjectSettings;
import com.codeheadsystems.hdriv.model.ImmutableStoredProject;
import com.codeheadsystems.hdriv.model.ImmutableSurfaceMaterial;
import com.codeheadsystems.hdriv.model.SchemaVersion;
import com.codeheadsystems.hdriv.model.SurfaceMaterial;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Optional;

/**
 * Version 1.1 adds the visibility flags, the materials block, the floor texture and the chrome
 * roughness texture.
 */
public class V11Extractor extends V10Extractor {

  @Override
  public SchemaVersion version() {
    return SchemaVersion.V1_1;
  }

  @Override
  protected void readSettings(final ObjectNode settings, final ImmutableProjectSettings.Builder builder) {
    super.readSettings(settings, builder);
    JsonFields.bool(settings, "spheresVisible").ifPresent(builder::spheresVisible);
    JsonFields.bool(settings, "groundVisible").ifPresent(builder::groundVisible);
    JsonFields.bool(settings, "shadowsVisible").ifPresent(builder::shadowsVisible);
    JsonFields.bool(settings, "colorCheckerVisible").ifPresent(builder::colorCheckerVisible);
  }

  @Override
  protected void readMaterials(final ObjectNode root, final ImmutableStoredProject.Builder builder) {
    final Optional<ObjectNode> materials = JsonFields.object(root, "materials");
    if (materials.isEmpty()) {
      super.readMaterials(root, builder);
      return;
    }
    final ObjectNode node = materials.get();

    final ImmutableFloorMaterial.Builder floor = ImmutableFloorMaterial.builder();
    final ImmutableGlassMaterial.Builder glass = ImmutableGlassMaterial.builder();
    final ImmutableSurfaceMaterial.Builder matte = ImmutableSurfaceMaterial.builder().from(SurfaceMaterial.matte());
    final ImmutableSurfaceMaterial.Builder chrome = ImmutableSurfaceMaterial.builder().from(SurfaceMaterial.chrome());
    final ImmutableSurfaceMaterial.Builder plastic = ImmutableSurfaceMaterial.builder().from(SurfaceMaterial.plastic());
    JsonFields.object(node, "floor").ifPresent(n -> readFloor(n, floor));
    JsonFields.object(node, "glass").ifPresent(n -> readGlass(n, glass));
    JsonFields.object(node, "matte").ifPresent(n -> readSurface(n, matte));
    JsonFields.object(node, "chrome").ifPresent(n -> readSurface(n, chrome));
    JsonFields.object(node, "plastic").ifPresent(n -> readSurface(n, plastic));
    builder.materials(ImmutableMaterials.builder()
        .floor(floor.build())
        .glass(glass.build())
        .matte(matte.build())
        .chrome(chrome.build())
        .plastic(plastic.build())
        .build());
    readTextures(node, builder);
  }

  /**
   * Floor values.
   *
   * @param floor   the floor node
   * @param builder the builder
   */
  protected void readFloor(final ObjectNode floor, final ImmutableFloorMaterial.Builder builder) {
    JsonFields.number(floor, "tiling").ifPresent(builder::tiling);
  }

  /**
   * Glass values. 1.1 only stored roughness and ior.
   *
   * @param glass   the glass node
   * @param builder the builder
   */
  protected void readGlass(final ObjectNode glass, final ImmutableGlassMaterial.Builder builder) {
    JsonFields.number(glass, "roughness").ifPresent(builder::roughness);
    JsonFields.number(glass, "ior").ifPresent(builder::ior);
  }

  /**
   * Matte, chrome and plastic values.
   *
   * @param surface the surface node
   * @param builder the builder
   */
  protected void readSurface(final ObjectNode surface, final ImmutableSurfaceMaterial.Builder builder) {
    JsonFields.text(surface, "color").ifPresent(builder::color);
    JsonFields.number(surface, "roughness").ifPresent(builder::roughness);
    JsonFields.number(surface, "metalness").ifPresent(builder::metalness);
  }

  /**
   * Texture entries of the materials block.
   *
   * @param materials the materials node
   * @param builder   the builder
   */
  protected void readTextures(final ObjectNode materials, final ImmutableStoredProject.Builder builder) {
    readTexture(materials, "floor", "texture", AssetSlot.FLOOR_TEXTURE, builder);
    readTexture(materials, "chrome", "roughnessTexture", AssetSlot.CHROME_ROUGHNESS, builder);
  }

  /**
   * Read one texture entry, if the material and the entry are present.
   *
   * @param materials the materials node
   * @param material  the material field
   * @param field     the texture field
   * @param slot      the slot
   * @param builder   the builder
   */
  protected void readTexture(final ObjectNode materials,
                             final String material,
                             final String field,
                             final AssetSlot slot,
                             final ImmutableStoredProject.Builder builder) {
    JsonFields.object(materials, material)
        .flatMap(node -> JsonFields.object(node, field))
        .ifPresent(node -> builder.putTextures(slot, readAsset(node, slot)));
  }

}
