package com.codeheadsystems.envelope.key;

import com.codeheadsystems.envelope.codec.BinaryTextCodec;
import com.codeheadsystems.envelope.exception.KeyUnavailableException;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base64 key material from an environment variable.
 */
public class EnvironmentKeySource implements KeySource {

  private static final Logger log = LoggerFactory.getLogger(EnvironmentKeySource.class);

  private final String variable;
  private final Function<String, String> environment;
  private final BinaryTextCodec codec;

  /**
   * Instantiates a new Environment key source.
   *
   * @param variable    the variable name
   * @param environment lookup of environment variables, normally System::getenv
   * @param codec       the codec
   */
  public EnvironmentKeySource(final String variable,
                              final Function<String, String> environment,
                              final BinaryTextCodec codec) {
    log.info("EnvironmentKeySource({})", variable);
    this.variable = variable;
    this.environment = environment;
    this.codec = codec;
  }

  @Override
  public byte[] loadKeyMaterial() {
    log.trace("loadKeyMaterial()");
    final String value = environment.apply(variable);
    if (value == null || value.isBlank()) {
      throw new KeyUnavailableException("Environment variable not set: " + variable);
    }
    final byte[] material;
    try {
      material = codec.decode(value.trim());
    } catch (IllegalArgumentException e) {
      throw new KeyUnavailableException("Environment variable is not base64: " + variable, e);
    }
    if (material.length != KEY_LENGTH) {
      throw new KeyUnavailableException("Environment variable " + variable + " must hold 32 bytes");
    }
    return material;
  }
}
