package com.codeheadsystems.hdriv.migration;

import com.codeheadsystems.hdriv.model.ImmutableGlassMaterial;
import com.codeheadsystems.hdriv.model.ImmutableProjectSettings;
import com.codeheadsystems.hdriv.model.Preset;
import com.codeheadsystems.hdriv.model.SchemaVersion;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Version 1.3 adds glass color and transmission, and the selected built-in preset.
 */
public class V13Extractor extends V12Extractor {

  @Override
  public SchemaVersion version() {
    return SchemaVersion.V1_3;
  }

  @Override
  protected void readSettings(final ObjectNode settings, final ImmutableProjectSettings.Builder builder) {
    super.readSettings(settings, builder);
    JsonFields.text(settings, "preset").map(Preset::fromLabel).ifPresent(builder::preset);
  }

  @Override
  protected void readGlass(final ObjectNode glass, final ImmutableGlassMaterial.Builder builder) {
    super.readGlass(glass, builder);
    JsonFields.text(glass, "color").ifPresent(builder::color);
    JsonFields.number(glass, "transmission").ifPresent(builder::transmission);
  }

}
