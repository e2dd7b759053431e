package com.codeheadsystems.hdriv.exception;

/**
 * The asset was written with an encryption scheme this release no longer reads.
 */
public class UnsupportedLegacySchemeException extends RuntimeException {

  /**
   * Instantiates a new Unsupported legacy scheme exception.
   *
   * @param assetName the asset name
   * @param scheme    the scheme, may be null
   */
  public UnsupportedLegacySchemeException(final String assetName, final String scheme) {
    super("Unsupported legacy encryption for " + assetName + ": " + (scheme == null ? "unknown" : scheme));
  }
}
