package com.codeheadsystems.envelope.exception;

/**
 * Thrown when the application key cannot be produced: the key source has no material,
 * the material is the wrong size, or the platform lacks AES-GCM.
 */
public class KeyUnavailableException extends EncryptionException {

  /**
   * Instantiates a new Key unavailable exception.
   *
   * @param message the message
   */
  public KeyUnavailableException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Key unavailable exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public KeyUnavailableException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
