package com.codeheadsystems.hdriv.migration;

import com.codeheadsystems.api.hdriv.v1.ImmutableEncryptedPacket;
import com.codeheadsystems.hdriv.exception.InvalidFormatException;
import com.codeheadsystems.hdriv.model.AssetEncoding;
import com.codeheadsystems.hdriv.model.AssetSlot;
import com.codeheadsystems.hdriv.model.ImmutableStoredAsset;
import com.codeheadsystems.hdriv.model.SchemaVersion;
import com.codeheadsystems.hdriv.model.StoredAsset;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;

/**
 * Version 1.7 stores every encrypted asset as an envelope: ciphertext, content nonce, wrapped
 * data key and key-wrap nonce.
 */
public class V17Extractor extends V16Extractor {

  /**
   * Scheme name of envelope encrypted entries. Writers may omit it.
   */
  public static final String ENVELOPE_SCHEME = "envelope";

  public V17Extractor(final ObjectMapper objectMapper) {
    super(objectMapper);
  }

  @Override
  public SchemaVersion version() {
    return SchemaVersion.V1_7;
  }

  @Override
  protected StoredAsset readAsset(final JsonNode node, final AssetSlot slot) {
    if (!node.isObject() || !JsonFields.bool(node, "encrypted").orElse(false)) {
      return super.readAsset(node, slot);
    }
    final Optional<String> scheme = JsonFields.text(node, "scheme");
    if (scheme.isPresent() && !ENVELOPE_SCHEME.equals(scheme.get())) {
      return super.readAsset(node, slot);
    }
    final String name = JsonFields.requireText(node, "name");
    final String data = JsonFields.requireText(node, "data");
    return ImmutableStoredAsset.builder()
        .name(name)
        .encoding(AssetEncoding.ENVELOPE)
        .data(data)
        .packet(ImmutableEncryptedPacket.builder()
            .data(data)
            .iv(envelopeField(node, name, "iv"))
            .wrappedKey(envelopeField(node, name, "wrappedKey"))
            .keyIv(envelopeField(node, name, "keyIv"))
            .build())
        .build();
  }

  private String envelopeField(final JsonNode node, final String name, final String field) {
    return JsonFields.text(node, field)
        .orElseThrow(() -> new InvalidFormatException("Encrypted asset " + name + " is missing '" + field + "'"));
  }

}
