package com.codeheadsystems.hdriv.migration;

import com.codeheadsystems.api.hdriv.v1.PresetFile;
import com.codeheadsystems.hdriv.converter.PresetCodec;
import com.codeheadsystems.hdriv.exception.InvalidFormatException;
import com.codeheadsystems.hdriv.model.CustomPreset;
import com.codeheadsystems.hdriv.model.ImmutableProjectSettings;
import com.codeheadsystems.hdriv.model.ImmutableStoredProject;
import com.codeheadsystems.hdriv.model.SchemaVersion;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Version 1.5 adds the visible color checker rows and the embedded custom preset.
 */
public class V15Extractor extends V14Extractor {

  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new V15 extractor.
   *
   * @param objectMapper used to read the embedded preset
   */
  public V15Extractor(final ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  @Override
  public SchemaVersion version() {
    return SchemaVersion.V1_5;
  }

  @Override
  protected void readSettings(final ObjectNode settings, final ImmutableProjectSettings.Builder builder) {
    super.readSettings(settings, builder);
    JsonFields.integers(settings, "colorCheckerRows").ifPresent(builder::colorCheckerRows);
  }

  @Override
  protected void readExtras(final ObjectNode root, final ImmutableStoredProject.Builder builder) {
    super.readExtras(root, builder);
    JsonFields.object(root, "loadedPreset").ifPresent(node ->
        builder.loadedPreset(CustomPreset.of(JsonFields.requireText(node, "name"),
            readPreset(JsonFields.requireObject(node, "data")))));
  }

  private PresetFile readPreset(final ObjectNode data) {
    try {
      return PresetCodec.requireSupportedVersion(objectMapper.treeToValue(data, PresetFile.class));
    } catch (JsonProcessingException | IllegalArgumentException | IllegalStateException e) {
      throw new InvalidFormatException("Embedded preset is not valid", e);
    }
  }

}
