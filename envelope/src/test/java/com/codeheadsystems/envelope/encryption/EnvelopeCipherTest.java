package com.codeheadsystems.envelope.encryption;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import com.codeheadsystems.api.hdriv.v1.EncryptedPacket;
import com.codeheadsystems.api.hdriv.v1.ImmutableEncryptedPacket;
import com.codeheadsystems.envelope.codec.BinaryTextCodec;
import com.codeheadsystems.envelope.exception.DecryptionException;
import com.codeheadsystems.envelope.exception.KeyUnavailableException;
import com.codeheadsystems.envelope.key.KeySource;
import com.codeheadsystems.envelope.manager.KeyManager;
import java.security.SecureRandom;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EnvelopeCipherTest {

  private BinaryTextCodec codec;
  private SecureRandom secureRandom;
  private EnvelopeCipher cipher;

  private static KeySource fixedKey(final int seed) {
    return () -> {
      final byte[] material = new byte[KeySource.KEY_LENGTH];
      new Random(seed).nextBytes(material);
      return material;
    };
  }

  private static byte[] payload(final int size) {
    final byte[] bytes = new byte[size];
    new Random(size).nextBytes(bytes);
    return bytes;
  }

  @BeforeEach
  void setup() {
    codec = new BinaryTextCodec();
    secureRandom = new SecureRandom();
    cipher = new EnvelopeCipher(new KeyManager(fixedKey(1)), codec, secureRandom);
  }

  @Test
  void roundTrip() {
    final byte[] plaintext = payload(1024);

    final EncryptedPacket packet = cipher.encryptPayload(plaintext);

    assertThat(cipher.decryptPayload(packet)).isEqualTo(plaintext);
  }

  @Test
  void roundTrip_empty() {
    final EncryptedPacket packet = cipher.encryptPayload(new byte[0]);

    assertThat(cipher.decryptPayload(packet)).isEmpty();
  }

  @Test
  void encryptPayload_packetShape() {
    final EncryptedPacket packet = cipher.encryptPayload(payload(100));

    assertThat(codec.decode(packet.iv())).hasSize(12);
    assertThat(codec.decode(packet.keyIv())).hasSize(12);
    assertThat(codec.decode(packet.wrappedKey())).hasSize(32 + 16);
    assertThat(codec.decode(packet.data())).hasSize(100 + 16);
  }

  @Test
  void encryptPayload_nonDeterministic() {
    final byte[] plaintext = payload(64);

    final EncryptedPacket first = cipher.encryptPayload(plaintext);
    final EncryptedPacket second = cipher.encryptPayload(plaintext);

    assertThat(first.data()).isNotEqualTo(second.data());
    assertThat(first.iv()).isNotEqualTo(second.iv());
    assertThat(first.wrappedKey()).isNotEqualTo(second.wrappedKey());
    assertThat(first.keyIv()).isNotEqualTo(second.keyIv());
  }

  @Test
  void decryptPayload_otherApplicationKey() {
    final EncryptedPacket packet = cipher.encryptPayload(payload(64));
    final EnvelopeCipher other = new EnvelopeCipher(new KeyManager(fixedKey(2)), codec, secureRandom);

    assertThatExceptionOfType(DecryptionException.class)
        .isThrownBy(() -> other.decryptPayload(packet))
        .withMessage(DecryptionException.MESSAGE)
        .withNoCause();
  }

  @Test
  void decryptPayload_tamperedData() {
    final EncryptedPacket packet = cipher.encryptPayload(payload(64));
    final byte[] data = codec.decode(packet.data());
    data[0] ^= 1;
    final EncryptedPacket tampered = ImmutableEncryptedPacket.copyOf(packet).withData(codec.encode(data));

    assertThatExceptionOfType(DecryptionException.class)
        .isThrownBy(() -> cipher.decryptPayload(tampered))
        .withMessage(DecryptionException.MESSAGE);
  }

  @Test
  void decryptPayload_swappedWrappedKey() {
    final EncryptedPacket first = cipher.encryptPayload(payload(64));
    final EncryptedPacket second = cipher.encryptPayload(payload(64));
    final EncryptedPacket mixed = ImmutableEncryptedPacket.copyOf(first).withWrappedKey(second.wrappedKey());

    assertThatExceptionOfType(DecryptionException.class)
        .isThrownBy(() -> cipher.decryptPayload(mixed))
        .withMessage(DecryptionException.MESSAGE);
  }

  @Test
  void decryptPayload_malformedText() {
    final EncryptedPacket packet = cipher.encryptPayload(payload(64));
    final EncryptedPacket broken = ImmutableEncryptedPacket.copyOf(packet).withData("not base64!");

    assertThatExceptionOfType(DecryptionException.class)
        .isThrownBy(() -> cipher.decryptPayload(broken))
        .withMessage(DecryptionException.MESSAGE)
        .withNoCause();
  }

  @Test
  void decryptPayload_wrongNonceLength() {
    final EncryptedPacket packet = cipher.encryptPayload(payload(64));
    final EncryptedPacket broken = ImmutableEncryptedPacket.copyOf(packet).withIv(codec.encode(new byte[8]));

    assertThatExceptionOfType(DecryptionException.class)
        .isThrownBy(() -> cipher.decryptPayload(broken))
        .withMessage(DecryptionException.MESSAGE);
  }

  @Test
  void encryptPayload_keyUnavailable() {
    final EnvelopeCipher noKey = new EnvelopeCipher(new KeyManager(() -> {
      throw new KeyUnavailableException("no key");
    }), codec, secureRandom);

    assertThatExceptionOfType(KeyUnavailableException.class)
        .isThrownBy(() -> noKey.encryptPayload(payload(8)));
  }

}
