package com.codeheadsystems.envelope.encryption;

import com.codeheadsystems.api.hdriv.v1.EncryptedPacket;
import com.codeheadsystems.api.hdriv.v1.ImmutableEncryptedPacket;
import com.codeheadsystems.envelope.codec.BinaryTextCodec;
import com.codeheadsystems.envelope.exception.DecryptionException;
import com.codeheadsystems.envelope.exception.EncryptionException;
import com.codeheadsystems.envelope.exception.KeyUnavailableException;
import com.codeheadsystems.envelope.key.KeySource;
import com.codeheadsystems.envelope.manager.KeyManager;
import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Arrays;
import javax.crypto.Cipher;
import javax.crypto.NoSuchPaddingException;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Envelope encryption of binary payloads.
 *
 * <p>Each payload gets its own random AES-256 data key (DEK). The payload is encrypted with the
 * DEK, then the DEK is encrypted ("wrapped") with the application key. Both steps use AES-GCM
 * with a fresh 96 bit nonce and a 128 bit tag.</p>
 *
 * <p>Decryption failures are reported as a single {@link DecryptionException} whatever the
 * failing step was.</p>
 */
@Singleton
public class EnvelopeCipher {

  private static final Logger log = LoggerFactory.getLogger(EnvelopeCipher.class);

  private static final String ALGORITHM = "AES";
  private static final int GCM_IV_LENGTH = 12; // 96 bits
  private static final int GCM_TAG_LENGTH = 128; // 128 bits

  private final KeyManager keyManager;
  private final BinaryTextCodec codec;
  private final SecureRandom secureRandom;

  /**
   * Instantiates a new Envelope cipher.
   *
   * @param keyManager   the key manager
   * @param codec        the codec
   * @param secureRandom the secure random
   */
  @Inject
  public EnvelopeCipher(final KeyManager keyManager,
                        final BinaryTextCodec codec,
                        final SecureRandom secureRandom) {
    log.info("EnvelopeCipher({}, {})", keyManager, codec);
    this.keyManager = keyManager;
    this.codec = codec;
    this.secureRandom = secureRandom;
  }

  /**
   * Encrypt payload.
   *
   * @param plaintext the plaintext
   * @return the encrypted packet
   */
  public EncryptedPacket encryptPayload(final byte[] plaintext) {
    log.trace("encryptPayload({} bytes)", plaintext.length);
    final Key applicationKey = keyManager.getApplicationKey().secretKey();
    final byte[] dataKey = new byte[KeySource.KEY_LENGTH];
    secureRandom.nextBytes(dataKey);
    try {
      final byte[] iv = nonce();
      final byte[] data = gcm(Cipher.ENCRYPT_MODE, new SecretKeySpec(dataKey, ALGORITHM), iv, plaintext);
      final byte[] keyIv = nonce();
      final byte[] wrappedKey = gcm(Cipher.ENCRYPT_MODE, applicationKey, keyIv, dataKey);
      return ImmutableEncryptedPacket.builder()
          .data(codec.encode(data))
          .iv(codec.encode(iv))
          .wrappedKey(codec.encode(wrappedKey))
          .keyIv(codec.encode(keyIv))
          .build();
    } catch (NoSuchAlgorithmException | NoSuchPaddingException e) {
      throw new KeyUnavailableException("AES-GCM is not available", e);
    } catch (GeneralSecurityException e) {
      log.error("Encryption failed", e);
      throw new EncryptionException("Failed to encrypt payload", e);
    } finally {
      Arrays.fill(dataKey, (byte) 0);
    }
  }

  /**
   * Decrypt payload.
   *
   * @param packet the packet
   * @return the plaintext
   * @throws DecryptionException if the packet was not produced under the current key or was altered
   */
  public byte[] decryptPayload(final EncryptedPacket packet) {
    log.trace("decryptPayload()");
    final Key applicationKey = keyManager.getApplicationKey().secretKey();
    byte[] dataKey = null;
    try {
      final byte[] keyIv = requireNonce(codec.decode(packet.keyIv()));
      dataKey = gcm(Cipher.DECRYPT_MODE, applicationKey, keyIv, codec.decode(packet.wrappedKey()));
      if (dataKey.length != KeySource.KEY_LENGTH) {
        throw new DecryptionException();
      }
      final byte[] iv = requireNonce(codec.decode(packet.iv()));
      return gcm(Cipher.DECRYPT_MODE, new SecretKeySpec(dataKey, ALGORITHM), iv, codec.decode(packet.data()));
    } catch (NoSuchAlgorithmException | NoSuchPaddingException e) {
      throw new KeyUnavailableException("AES-GCM is not available", e);
    } catch (GeneralSecurityException | IllegalArgumentException e) {
      log.debug("decryptPayload failed");
      throw new DecryptionException();
    } finally {
      if (dataKey != null) {
        Arrays.fill(dataKey, (byte) 0);
      }
    }
  }

  private byte[] nonce() {
    final byte[] iv = new byte[GCM_IV_LENGTH];
    secureRandom.nextBytes(iv);
    return iv;
  }

  private byte[] requireNonce(final byte[] iv) {
    if (iv.length != GCM_IV_LENGTH) {
      throw new DecryptionException();
    }
    return iv;
  }

  private byte[] gcm(final int mode, final Key key, final byte[] iv, final byte[] input)
      throws GeneralSecurityException {
    final Cipher cipher = Cipher.getInstance(KeyManager.TRANSFORMATION);
    cipher.init(mode, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
    return cipher.doFinal(input);
  }

}
