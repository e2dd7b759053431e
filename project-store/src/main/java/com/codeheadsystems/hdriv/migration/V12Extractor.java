package com.codeheadsystems.hdriv.migration;

import com.codeheadsystems.hdriv.model.AssetSlot;
import com.codeheadsystems.hdriv.model.ImmutableStoredProject;
import com.codeheadsystems.hdriv.model.SchemaVersion;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Version 1.2 adds roughness textures to the glass, matte and plastic spheres.
 */
public class V12Extractor extends V11Extractor {

  @Override
  public SchemaVersion version() {
    return SchemaVersion.V1_2;
  }

  @Override
  protected void readTextures(final ObjectNode materials, final ImmutableStoredProject.Builder builder) {
    super.readTextures(materials, builder);
    readTexture(materials, "glass", "roughnessTexture", AssetSlot.GLASS_ROUGHNESS, builder);
    readTexture(materials, "matte", "roughnessTexture", AssetSlot.MATTE_ROUGHNESS, builder);
    readTexture(materials, "plastic", "roughnessTexture", AssetSlot.PLASTIC_ROUGHNESS, builder);
  }

}
