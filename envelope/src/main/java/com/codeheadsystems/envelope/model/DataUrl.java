package com.codeheadsystems.envelope.model;

import org.immutables.value.Value;

/**
 * A decoded {@code data:<type>;base64,<payload>} string.
 */
@Value.Immutable
public interface DataUrl {

  /**
   * Content type, e.g. "image/vnd.radiance". May be empty if the url omitted it.
   *
   * @return the content type
   */
  String contentType();

  /**
   * Decoded payload.
   *
   * @return the bytes
   */
  @Value.Redacted
  byte[] bytes();

}
