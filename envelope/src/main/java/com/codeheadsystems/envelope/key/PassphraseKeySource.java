package com.codeheadsystems.envelope.key;

import com.codeheadsystems.envelope.exception.KeyUnavailableException;
import java.security.GeneralSecurityException;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives key material from a passphrase with PBKDF2-HMAC-SHA256.
 */
public class PassphraseKeySource implements KeySource {

  private static final Logger log = LoggerFactory.getLogger(PassphraseKeySource.class);
  private static final String ALGORITHM = "PBKDF2WithHmacSHA256";

  private final char[] passphrase;
  private final byte[] salt;
  private final int iterations;

  /**
   * Instantiates a new Passphrase key source.
   *
   * @param passphrase the passphrase
   * @param salt       the salt
   * @param iterations the iterations
   */
  public PassphraseKeySource(final char[] passphrase, final byte[] salt, final int iterations) {
    log.info("PassphraseKeySource({} iterations)", iterations);
    if (passphrase.length == 0) {
      throw new IllegalArgumentException("Passphrase must not be empty");
    }
    if (salt.length == 0) {
      throw new IllegalArgumentException("Salt must not be empty");
    }
    if (iterations < 1) {
      throw new IllegalArgumentException("Iterations must be positive");
    }
    this.passphrase = passphrase.clone();
    this.salt = salt.clone();
    this.iterations = iterations;
  }

  @Override
  public byte[] loadKeyMaterial() {
    log.trace("loadKeyMaterial()");
    final PBEKeySpec spec = new PBEKeySpec(passphrase, salt, iterations, KEY_LENGTH * 8);
    try {
      final SecretKeyFactory factory = SecretKeyFactory.getInstance(ALGORITHM);
      return factory.generateSecret(spec).getEncoded();
    } catch (GeneralSecurityException e) {
      throw new KeyUnavailableException("Unable to derive key from passphrase", e);
    } finally {
      spec.clearPassword();
    }
  }

}
