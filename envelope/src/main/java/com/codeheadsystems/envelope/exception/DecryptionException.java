package com.codeheadsystems.envelope.exception;

/**
 * Thrown when an encrypted packet cannot be opened. The message is always the same and no
 * cause is attached, so callers cannot tell which step failed.
 */
public class DecryptionException extends EncryptionException {

  /**
   * The only message this exception carries.
   */
  public static final String MESSAGE = "Decryption failed: key mismatch or corrupted data";

  /**
   * Instantiates a new Decryption exception.
   */
  public DecryptionException() {
    super(MESSAGE);
  }
}
