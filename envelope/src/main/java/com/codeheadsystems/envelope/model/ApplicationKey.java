package com.codeheadsystems.envelope.model;

import java.util.Objects;
import javax.crypto.SecretKey;

/**
 * The process-wide key encryption key. Only the key manager creates these, and the key never
 * leaves the process.
 */
public final class ApplicationKey {

  private final SecretKey secretKey;

  /**
   * Instantiates a new Application key.
   *
   * @param secretKey the secret key
   */
  public ApplicationKey(final SecretKey secretKey) {
    this.secretKey = Objects.requireNonNull(secretKey, "secretKey");
  }

  /**
   * Secret key used to wrap and unwrap data keys.
   *
   * @return the secret key
   */
  public SecretKey secretKey() {
    return secretKey;
  }

  @Override
  public String toString() {
    return "ApplicationKey{" + secretKey.getAlgorithm() + ", ****}";
  }
}
