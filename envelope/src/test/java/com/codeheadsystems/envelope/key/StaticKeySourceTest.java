package com.codeheadsystems.envelope.key;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import com.codeheadsystems.envelope.codec.BinaryTextCodec;
import com.codeheadsystems.envelope.exception.KeyUnavailableException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StaticKeySourceTest {

  private static final String TEXT_SECRET = "0123456789abcdef0123456789ABCDEF";

  private BinaryTextCodec codec;

  @BeforeEach
  void setup() {
    codec = new BinaryTextCodec();
  }

  @Test
  void loadKeyMaterial_base64() {
    final byte[] material = new byte[32];
    material[0] = 7;
    material[31] = 9;

    final byte[] result = new StaticKeySource(codec.encode(material), codec).loadKeyMaterial();

    assertThat(result).isEqualTo(material);
  }

  @Test
  void loadKeyMaterial_text() {
    final byte[] result = new StaticKeySource(TEXT_SECRET, codec).loadKeyMaterial();

    assertThat(result).isEqualTo(TEXT_SECRET.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void loadKeyMaterial_returnsFreshArray() {
    final StaticKeySource source = new StaticKeySource(TEXT_SECRET, codec);

    assertThat(source.loadKeyMaterial()).isNotSameAs(source.loadKeyMaterial());
  }

  @Test
  void loadKeyMaterial_wrongSize() {
    final StaticKeySource source = new StaticKeySource("too short", codec);
    assertThatExceptionOfType(KeyUnavailableException.class)
        .isThrownBy(source::loadKeyMaterial);
  }

  @Test
  void loadKeyMaterial_empty() {
    final StaticKeySource source = new StaticKeySource("", codec);
    assertThatExceptionOfType(KeyUnavailableException.class)
        .isThrownBy(source::loadKeyMaterial);
  }

}
