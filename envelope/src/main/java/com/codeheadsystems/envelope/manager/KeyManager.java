package com.codeheadsystems.envelope.manager;

import com.codeheadsystems.envelope.exception.KeyUnavailableException;
import com.codeheadsystems.envelope.key.KeySource;
import com.codeheadsystems.envelope.model.ApplicationKey;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import javax.crypto.Cipher;
import javax.crypto.spec.SecretKeySpec;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The type Key manager.
 * <p>
 * Owns the application key. The key is created from the key source on first use and the same
 * instance is returned afterwards, including to callers racing on the first call.
 */
@Singleton
public class KeyManager {

  /**
   * Cipher every key produced here must support.
   */
  public static final String TRANSFORMATION = "AES/GCM/NoPadding";
  private static final Logger log = LoggerFactory.getLogger(KeyManager.class);
  private static final String ALGORITHM = "AES";

  private final KeySource keySource;
  private final Object lock = new Object();
  private volatile ApplicationKey applicationKey;

  /**
   * Instantiates a new Key manager.
   *
   * @param keySource the key source
   */
  @Inject
  public KeyManager(final KeySource keySource) {
    log.info("KeyManager({})", keySource);
    this.keySource = keySource;
  }

  /**
   * Gets application key.
   *
   * @return the application key
   * @throws KeyUnavailableException if the key cannot be created
   */
  public ApplicationKey getApplicationKey() {
    log.trace("getApplicationKey()");
    ApplicationKey result = applicationKey;
    if (result == null) {
      synchronized (lock) {
        result = applicationKey;
        if (result == null) {
          result = createApplicationKey();
          applicationKey = result;
        }
      }
    }
    return result;
  }

  private ApplicationKey createApplicationKey() {
    log.info("createApplicationKey()");
    try {
      Cipher.getInstance(TRANSFORMATION);
    } catch (GeneralSecurityException e) {
      throw new KeyUnavailableException("AES-GCM is not available", e);
    }
    final byte[] material = keySource.loadKeyMaterial();
    try {
      if (material == null || material.length != KeySource.KEY_LENGTH) {
        throw new KeyUnavailableException("Key material must be 32 bytes");
      }
      return new ApplicationKey(new SecretKeySpec(material, ALGORITHM));
    } finally {
      if (material != null) {
        Arrays.fill(material, (byte) 0);
      }
    }
  }

}
