package com.codeheadsystems.hdriv.model;

import java.util.Optional;
import org.immutables.value.Value;

/**
 * One binary the project carries: an HDRI or a material texture.
 */
@Value.Immutable
public interface Asset {

  /**
   * Of asset.
   *
   * @param name  the name
   * @param bytes the bytes
   * @return the asset
   */
  static Asset of(final String name, final byte[] bytes) {
    return ImmutableAsset.builder().name(name).bytes(bytes).build();
  }

  /**
   * Name, usually the original file name.
   *
   * @return the name
   */
  String name();

  /**
   * Raw file content.
   *
   * @return the bytes
   */
  @Value.Redacted
  byte[] bytes();

  /**
   * Content type. Only known for assets read from a data url or a file on disk.
   *
   * @return the content type
   */
  Optional<String> contentType();

  /**
   * Light annotation. HDRIs only.
   *
   * @return the light annotation
   */
  Optional<LightAnnotation> lights();

}
