package com.codeheadsystems.hdriv.model;

/**
 * Why an asset was left out of a loaded project.
 */
public enum WarningReason {
  KEY_MISMATCH_OR_CORRUPTION("asset skipped: key mismatch or corruption"),
  UNSUPPORTED_LEGACY_ENCRYPTION("asset skipped: unsupported legacy encryption"),
  INVALID_ENCODING("asset skipped: invalid encoding");

  private final String message;

  WarningReason(final String message) {
    this.message = message;
  }

  public String message() {
    return message;
  }
}
