package com.codeheadsystems.api.hdriv.v1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * A material texture in a 1.7 document.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableTextureEntry.class)
@JsonDeserialize(builder = ImmutableTextureEntry.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface TextureEntry extends EncryptedEntry {

  /**
   * Of texture entry.
   *
   * @param name   the name
   * @param packet the encrypted packet
   * @return the texture entry
   */
  static TextureEntry of(final String name, final EncryptedPacket packet) {
    return ImmutableTextureEntry.builder()
        .name(name)
        .data(packet.data())
        .iv(packet.iv())
        .wrappedKey(packet.wrappedKey())
        .keyIv(packet.keyIv())
        .build();
  }

}
