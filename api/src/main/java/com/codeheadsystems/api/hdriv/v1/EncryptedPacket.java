package com.codeheadsystems.api.hdriv.v1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * The interface Encrypted packet.
 * <p>
 * Represents one envelope-encrypted asset: the ciphertext, the data encryption key (DEK)
 * wrapped under the application key, and the two nonces needed to reverse both steps.
 * Every value is radix-64 text.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableEncryptedPacket.class)
@JsonDeserialize(builder = ImmutableEncryptedPacket.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface EncryptedPacket {

  /**
   * The encrypted content (AES-GCM ciphertext followed by its tag).
   *
   * @return the ciphertext
   */
  @JsonProperty("data")
  String data();

  /**
   * Nonce used to encrypt the content with the DEK.
   *
   * @return the content nonce
   */
  @JsonProperty("iv")
  String iv();

  /**
   * The DEK encrypted with the application key.
   *
   * @return the wrapped DEK
   */
  @JsonProperty("wrappedKey")
  String wrappedKey();

  /**
   * Nonce used to wrap the DEK with the application key.
   *
   * @return the key-wrap nonce
   */
  @JsonProperty("keyIv")
  String keyIv();

}
