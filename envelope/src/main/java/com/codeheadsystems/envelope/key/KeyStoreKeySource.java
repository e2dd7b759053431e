package com.codeheadsystems.envelope.key;

import com.codeheadsystems.envelope.exception.KeyUnavailableException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the key from an AES secret key entry of a PKCS12 key store.
 */
public class KeyStoreKeySource implements KeySource {

  /**
   * Key store type.
   */
  public static final String KEY_STORE_TYPE = "PKCS12";

  private static final Logger log = LoggerFactory.getLogger(KeyStoreKeySource.class);

  private final Path path;
  private final char[] password;
  private final String alias;

  /**
   * Instantiates a new Key store key source.
   *
   * @param path     the key store file
   * @param password the key store and entry password
   * @param alias    the entry alias
   */
  public KeyStoreKeySource(final Path path, final char[] password, final String alias) {
    log.info("KeyStoreKeySource({}, {})", path, alias);
    this.path = path;
    this.password = password.clone();
    this.alias = alias;
  }

  @Override
  public byte[] loadKeyMaterial() {
    log.trace("loadKeyMaterial()");
    try (InputStream in = Files.newInputStream(path)) {
      final KeyStore keyStore = KeyStore.getInstance(KEY_STORE_TYPE);
      keyStore.load(in, password);
      final KeyStore.Entry entry = keyStore.getEntry(alias, new KeyStore.PasswordProtection(password));
      if (!(entry instanceof KeyStore.SecretKeyEntry)) {
        throw new KeyUnavailableException("No secret key entry named " + alias + " in " + path);
      }
      final byte[] material = ((KeyStore.SecretKeyEntry) entry).getSecretKey().getEncoded();
      if (material == null || material.length != KEY_LENGTH) {
        throw new KeyUnavailableException("Key store entry " + alias + " is not a 256 bit key");
      }
      return material;
    } catch (IOException | GeneralSecurityException e) {
      throw new KeyUnavailableException("Unable to read key store " + path, e);
    }
  }
}
