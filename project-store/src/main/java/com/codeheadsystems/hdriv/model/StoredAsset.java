package com.codeheadsystems.hdriv.model;

import com.codeheadsystems.api.hdriv.v1.EncryptedPacket;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * An asset as read from a document, before decoding or decryption.
 */
@Value.Immutable
public interface StoredAsset {

  String name();

  AssetEncoding encoding();

  /**
   * Data field: plain encoded bytes, or ciphertext.
   *
   * @return the data
   */
  @Value.Redacted
  String data();

  /**
   * Packet, set for {@link AssetEncoding#ENVELOPE}.
   *
   * @return the packet
   */
  Optional<EncryptedPacket> packet();

  /**
   * Declared encryption scheme, if any.
   *
   * @return the scheme
   */
  Optional<String> scheme();

  Optional<LightAnnotation> lights();

}
