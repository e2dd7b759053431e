package com.codeheadsystems.hdriv.model;

import com.codeheadsystems.envelope.model.KeySourceConfiguration;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * The interface Hdriv configuration.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableConfiguration.class)
@JsonDeserialize(builder = ImmutableConfiguration.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface Configuration {

  /**
   * Where the application key comes from.
   *
   * @return the key source configuration
   */
  KeySourceConfiguration keySource();

  /**
   * Threads used to encrypt assets during a save.
   *
   * @return the int
   */
  @Value.Default
  default int assetThreads() {
    return Math.max(2, Runtime.getRuntime().availableProcessors());
  }

}
