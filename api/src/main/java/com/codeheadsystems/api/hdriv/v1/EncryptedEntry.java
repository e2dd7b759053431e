package com.codeheadsystems.api.hdriv.v1;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.immutables.value.Value;

/**
 * Shared shape of every asset entry in a 1.7 document: the asset name followed by the
 * flattened fields of its {@link EncryptedPacket}.
 */
public interface EncryptedEntry {

  /**
   * Asset name, usually the original file name.
   *
   * @return the name
   */
  @JsonProperty("name")
  String name();

  /**
   * Ciphertext.
   *
   * @return the data
   */
  @JsonProperty("data")
  String data();

  /**
   * Always true for entries written by the current serializer.
   *
   * @return the boolean
   */
  @JsonProperty("encrypted")
  @Value.Default
  default boolean encrypted() {
    return true;
  }

  /**
   * Content nonce.
   *
   * @return the iv
   */
  @JsonProperty("iv")
  String iv();

  /**
   * Wrapped DEK.
   *
   * @return the wrapped key
   */
  @JsonProperty("wrappedKey")
  String wrappedKey();

  /**
   * Key-wrap nonce.
   *
   * @return the key iv
   */
  @JsonProperty("keyIv")
  String keyIv();

}
