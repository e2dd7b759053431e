package com.codeheadsystems.envelope.key;

/**
 * Supplies the raw material of the application key.
 */
@FunctionalInterface
public interface KeySource {

  /**
   * Key length in bytes (AES-256).
   */
  int KEY_LENGTH = 32;

  /**
   * Load key material. The caller owns the returned array and zeroes it once the key is
   * imported.
   *
   * @return the key material
   * @throws com.codeheadsystems.envelope.exception.KeyUnavailableException if no material is available
   */
  byte[] loadKeyMaterial();

}
