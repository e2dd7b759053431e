package com.codeheadsystems.hdriv.migration;

import com.codeheadsystems.hdriv.model.AssetEncoding;
import com.codeheadsystems.hdriv.model.AssetSlot;
import com.codeheadsystems.hdriv.model.ImmutableStoredAsset;
import com.codeheadsystems.hdriv.model.SchemaVersion;
import com.codeheadsystems.hdriv.model.StoredAsset;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Version 1.6 encrypted assets directly under a single key, without a wrapped data key. Those
 * assets are read as {@link AssetEncoding#RETIRED} so the loader can report them.
 */
public class V16Extractor extends V15Extractor {

  /**
   * Scheme name written by 1.6.
   */
  public static final String DIRECT_SCHEME = "aes-gcm-direct";

  public V16Extractor(final ObjectMapper objectMapper) {
    super(objectMapper);
  }

  @Override
  public SchemaVersion version() {
    return SchemaVersion.V1_6;
  }

  @Override
  protected StoredAsset readAsset(final JsonNode node, final AssetSlot slot) {
    if (node.isObject() && JsonFields.bool(node, "encrypted").orElse(false)) {
      return ImmutableStoredAsset.builder()
          .name(JsonFields.requireText(node, "name"))
          .encoding(AssetEncoding.RETIRED)
          .data(JsonFields.text(node, "data").orElse(""))
          .scheme(JsonFields.text(node, "scheme").orElse(DIRECT_SCHEME))
          .build();
    }
    return super.readAsset(node, slot);
  }

}
