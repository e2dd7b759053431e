package com.codeheadsystems.envelope.model;

/**
 * Where the application key material comes from.
 */
public enum KeySourceType {
  /**
   * A secret supplied directly in the configuration.
   */
  STATIC,
  /**
   * Base64 key material read from an environment variable.
   */
  ENVIRONMENT,
  /**
   * PBKDF2 derivation from a passphrase.
   */
  PASSPHRASE,
  /**
   * A secret key entry in a PKCS12 key store.
   */
  KEYSTORE
}
