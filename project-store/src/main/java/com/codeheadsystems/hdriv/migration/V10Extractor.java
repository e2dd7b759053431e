package com.codeheadsystems.hdriv.migration;

import com.codeheadsystems.hdriv.exception.InvalidFormatException;
import com.codeheadsystems.hdriv.model.AssetEncoding;
import com.codeheadsystems.hdriv.model.AssetSlot;
import com.codeheadsystems.hdriv.model.ImmutableProjectSettings;
import com.codeheadsystems.hdriv.model.ImmutableStoredAsset;
import com.codeheadsystems.hdriv.model.ImmutableStoredProject;
import com.codeheadsystems.hdriv.model.Materials;
import com.codeheadsystems.hdriv.model.SchemaVersion;
import com.codeheadsystems.hdriv.model.StoredAsset;
import com.codeheadsystems.hdriv.model.StoredProject;
import com.codeheadsystems.hdriv.model.ToneMapping;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Version 1.0: rotation, exposure, blur, tone mapping, the selection, and HDRIs stored as data
 * urls. Later extractors extend this one and add what their version introduced.
 */
public class V10Extractor implements VersionExtractor {

  @Override
  public SchemaVersion version() {
    return SchemaVersion.V1_0;
  }

  @Override
  public StoredProject extract(final ObjectNode root) {
    final ObjectNode settings = JsonFields.requireObject(root, "settings");
    final ImmutableProjectSettings.Builder settingsBuilder = ImmutableProjectSettings.builder();
    readSettings(settings, settingsBuilder);

    final ImmutableStoredProject.Builder builder = ImmutableStoredProject.builder()
        .version(version())
        .settings(settingsBuilder.build())
        .selectedHdriName(JsonFields.text(settings, "selectedHdriName"));
    for (JsonNode hdri : JsonFields.requireArray(root, "hdris")) {
      builder.addHdris(readHdri(hdri));
    }
    readMaterials(root, builder);
    readExtras(root, builder);
    return builder.build();
  }

  /**
   * Read settings fields into the builder. Fields left unset keep their defaults.
   *
   * @param settings the settings node
   * @param builder  the builder
   */
  protected void readSettings(final ObjectNode settings, final ImmutableProjectSettings.Builder builder) {
    JsonFields.number(settings, "rotation").ifPresent(builder::rotation);
    JsonFields.number(settings, "exposure").ifPresent(builder::exposure);
    JsonFields.number(settings, "blur").ifPresent(builder::blur);
    builder.toneMapping(ToneMapping.fromLabel(JsonFields.text(settings, "toneMapping").orElse(null)));
  }

  /**
   * 1.0 has no materials block.
   *
   * @param root    the root
   * @param builder the builder
   */
  protected void readMaterials(final ObjectNode root, final ImmutableStoredProject.Builder builder) {
    builder.materials(Materials.defaults());
  }

  /**
   * Top level fields other than settings, materials and hdris.
   *
   * @param root    the root
   * @param builder the builder
   */
  protected void readExtras(final ObjectNode root, final ImmutableStoredProject.Builder builder) {
    // none before 1.5
  }

  /**
   * Read hdri stored asset.
   *
   * @param node the node
   * @return the stored asset
   */
  protected StoredAsset readHdri(final JsonNode node) {
    return readAsset(node, AssetSlot.HDRI);
  }

  /**
   * Read one asset entry.
   *
   * @param node the node
   * @param slot the slot the asset is for
   * @return the stored asset
   */
  protected StoredAsset readAsset(final JsonNode node, final AssetSlot slot) {
    if (!node.isObject()) {
      throw new InvalidFormatException("Asset entry for " + slot + " must be an object");
    }
    if (JsonFields.bool(node, "encrypted").orElse(false)) {
      throw new InvalidFormatException("Encrypted asset in a " + version().tag() + " document");
    }
    return ImmutableStoredAsset.builder()
        .name(JsonFields.requireText(node, "name"))
        .encoding(AssetEncoding.PLAIN)
        .data(JsonFields.requireText(node, "data"))
        .build();
  }

}
