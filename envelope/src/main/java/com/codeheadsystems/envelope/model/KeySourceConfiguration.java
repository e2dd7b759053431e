package com.codeheadsystems.envelope.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * The interface Key source configuration. Only the fields the selected type needs have to be
 * set.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableKeySourceConfiguration.class)
@JsonDeserialize(builder = ImmutableKeySourceConfiguration.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface KeySourceConfiguration {

  /**
   * Default environment variable for {@link KeySourceType#ENVIRONMENT}.
   */
  String DEFAULT_ENVIRONMENT_VARIABLE = "HDRIV_APPLICATION_KEY";
  /**
   * Default PBKDF2 iteration count.
   */
  int DEFAULT_ITERATIONS = 210_000;

  /**
   * Type key source type.
   *
   * @return the key source type
   */
  KeySourceType type();

  /**
   * Secret for STATIC: base64 of 32 bytes, or a 32 byte UTF-8 string.
   *
   * @return the secret
   */
  @Value.Redacted
  Optional<String> secret();

  /**
   * Environment variable.
   *
   * @return the string
   */
  @Value.Default
  default String environmentVariable() {
    return DEFAULT_ENVIRONMENT_VARIABLE;
  }

  @Value.Redacted
  Optional<String> passphrase();

  Optional<String> salt();

  @Value.Default
  default int iterations() {
    return DEFAULT_ITERATIONS;
  }

  Optional<String> keyStorePath();

  @Value.Redacted
  Optional<String> keyStorePassword();

  Optional<String> keyAlias();

}
