package com.codeheadsystems.envelope.key;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import com.codeheadsystems.envelope.codec.BinaryTextCodec;
import com.codeheadsystems.envelope.exception.KeyUnavailableException;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EnvironmentKeySourceTest {

  private static final String VARIABLE = "HDRIV_APPLICATION_KEY";

  private final BinaryTextCodec codec = new BinaryTextCodec();

  private EnvironmentKeySource source(final Map<String, String> environment) {
    return new EnvironmentKeySource(VARIABLE, environment::get, codec);
  }

  @Test
  void loadKeyMaterial() {
    final byte[] material = new byte[32];
    material[5] = 42;

    final byte[] result = source(Map.of(VARIABLE, codec.encode(material))).loadKeyMaterial();

    assertThat(result).isEqualTo(material);
  }

  @Test
  void loadKeyMaterial_trimsWhitespace() {
    final byte[] material = new byte[32];

    final byte[] result = source(Map.of(VARIABLE, " " + codec.encode(material) + "\n")).loadKeyMaterial();

    assertThat(result).isEqualTo(material);
  }

  @Test
  void loadKeyMaterial_missing() {
    assertThatExceptionOfType(KeyUnavailableException.class)
        .isThrownBy(() -> source(Map.of()).loadKeyMaterial())
        .withMessageContaining(VARIABLE);
  }

  @Test
  void loadKeyMaterial_notBase64() {
    assertThatExceptionOfType(KeyUnavailableException.class)
        .isThrownBy(() -> source(Map.of(VARIABLE, "not-base64!")).loadKeyMaterial());
  }

  @Test
  void loadKeyMaterial_wrongSize() {
    assertThatExceptionOfType(KeyUnavailableException.class)
        .isThrownBy(() -> source(Map.of(VARIABLE, codec.encode(new byte[16]))).loadKeyMaterial());
  }

}
