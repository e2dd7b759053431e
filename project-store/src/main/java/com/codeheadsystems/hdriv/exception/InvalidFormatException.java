package com.codeheadsystems.hdriv.exception;

/**
 * The document cannot be read at all: bad JSON, unknown version, missing required structure,
 * or a field that does not match its version.
 */
public class InvalidFormatException extends RuntimeException {

  /**
   * Instantiates a new Invalid format exception.
   *
   * @param message the message
   */
  public InvalidFormatException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Invalid format exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public InvalidFormatException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
