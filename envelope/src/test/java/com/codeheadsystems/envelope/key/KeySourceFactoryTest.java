package com.codeheadsystems.envelope.key;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import com.codeheadsystems.envelope.codec.BinaryTextCodec;
import com.codeheadsystems.envelope.exception.KeyUnavailableException;
import com.codeheadsystems.envelope.model.ImmutableKeySourceConfiguration;
import com.codeheadsystems.envelope.model.KeySourceConfiguration;
import com.codeheadsystems.envelope.model.KeySourceType;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class KeySourceFactoryTest {

  private BinaryTextCodec codec;
  private KeySourceFactory factory;

  @BeforeEach
  void setup() {
    codec = new BinaryTextCodec();
    factory = new KeySourceFactory(codec,
        Map.of(KeySourceConfiguration.DEFAULT_ENVIRONMENT_VARIABLE, codec.encode(new byte[32]))::get);
  }

  @Test
  void create_static() {
    final KeySource source = factory.create(ImmutableKeySourceConfiguration.builder()
        .type(KeySourceType.STATIC)
        .secret("0123456789abcdef0123456789abcdef")
        .build());

    assertThat(source).isInstanceOf(StaticKeySource.class);
    assertThat(source.loadKeyMaterial()).hasSize(32);
  }

  @Test
  void create_environment_defaultVariable() {
    final KeySource source = factory.create(ImmutableKeySourceConfiguration.builder()
        .type(KeySourceType.ENVIRONMENT)
        .build());

    assertThat(source).isInstanceOf(EnvironmentKeySource.class);
    assertThat(source.loadKeyMaterial()).isEqualTo(new byte[32]);
  }

  @Test
  void create_passphrase() {
    final KeySource source = factory.create(ImmutableKeySourceConfiguration.builder()
        .type(KeySourceType.PASSPHRASE)
        .passphrase("correct horse")
        .salt("hdriv")
        .iterations(1000)
        .build());

    assertThat(source).isInstanceOf(PassphraseKeySource.class);
    assertThat(source.loadKeyMaterial()).hasSize(32);
  }

  @Test
  void create_keyStore() {
    final KeySource source = factory.create(ImmutableKeySourceConfiguration.builder()
        .type(KeySourceType.KEYSTORE)
        .keyStorePath("/tmp/does-not-matter.p12")
        .keyStorePassword("changeit")
        .keyAlias("hdriv")
        .build());

    assertThat(source).isInstanceOf(KeyStoreKeySource.class);
  }

  @Test
  void create_staticWithoutSecret() {
    final KeySourceConfiguration configuration = ImmutableKeySourceConfiguration.builder()
        .type(KeySourceType.STATIC)
        .build();
    assertThatExceptionOfType(KeyUnavailableException.class)
        .isThrownBy(() -> factory.create(configuration))
        .withMessageContaining("secret");
  }

  @Test
  void configuration_toStringRedactsSecrets() {
    final KeySourceConfiguration configuration = ImmutableKeySourceConfiguration.builder()
        .type(KeySourceType.PASSPHRASE)
        .passphrase("correct horse")
        .salt("hdriv")
        .build();

    assertThat(configuration.toString()).doesNotContain("correct horse");
  }

}
