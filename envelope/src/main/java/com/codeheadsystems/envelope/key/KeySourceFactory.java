package com.codeheadsystems.envelope.key;

import com.codeheadsystems.envelope.codec.BinaryTextCodec;
import com.codeheadsystems.envelope.exception.KeyUnavailableException;
import com.codeheadsystems.envelope.model.KeySourceConfiguration;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.function.Function;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the configured key source.
 */
@Singleton
public class KeySourceFactory {

  private static final Logger log = LoggerFactory.getLogger(KeySourceFactory.class);

  private final BinaryTextCodec codec;
  private final Function<String, String> environment;

  /**
   * Instantiates a new Key source factory reading the process environment.
   *
   * @param codec the codec
   */
  @Inject
  public KeySourceFactory(final BinaryTextCodec codec) {
    this(codec, System::getenv);
  }

  /**
   * Instantiates a new Key source factory.
   *
   * @param codec       the codec
   * @param environment the environment lookup
   */
  public KeySourceFactory(final BinaryTextCodec codec,
                          final Function<String, String> environment) {
    log.info("KeySourceFactory({})", codec);
    this.codec = codec;
    this.environment = environment;
  }

  /**
   * Create key source.
   *
   * @param configuration the configuration
   * @return the key source
   */
  public KeySource create(final KeySourceConfiguration configuration) {
    log.trace("create({})", configuration);
    return switch (configuration.type()) {
      case STATIC -> new StaticKeySource(require(configuration.secret().orElse(null), "secret"), codec);
      case ENVIRONMENT -> new EnvironmentKeySource(configuration.environmentVariable(), environment, codec);
      case PASSPHRASE -> new PassphraseKeySource(
          require(configuration.passphrase().orElse(null), "passphrase").toCharArray(),
          require(configuration.salt().orElse(null), "salt").getBytes(StandardCharsets.UTF_8),
          configuration.iterations());
      case KEYSTORE -> new KeyStoreKeySource(
          Path.of(require(configuration.keyStorePath().orElse(null), "keyStorePath")),
          require(configuration.keyStorePassword().orElse(null), "keyStorePassword").toCharArray(),
          require(configuration.keyAlias().orElse(null), "keyAlias"));
    };
  }

  private String require(final String value, final String field) {
    if (value == null || value.isEmpty()) {
      throw new KeyUnavailableException("Key source configuration is missing " + field);
    }
    return value;
  }
}
