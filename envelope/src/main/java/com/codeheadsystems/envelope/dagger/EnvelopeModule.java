package com.codeheadsystems.envelope.dagger;

import com.codeheadsystems.envelope.key.KeySource;
import com.codeheadsystems.envelope.key.KeySourceFactory;
import com.codeheadsystems.envelope.model.KeySourceConfiguration;
import dagger.Module;
import dagger.Provides;
import java.security.SecureRandom;
import javax.inject.Singleton;

/**
 * The type Envelope module. Needs a {@link KeySourceConfiguration} from the including component.
 */
@Module
public class EnvelopeModule {

  /**
   * Instantiates a new Envelope module.
   */
  public EnvelopeModule() {
    // Default constructor
  }

  /**
   * Secure random.
   *
   * @return the secure random
   */
  @Provides
  @Singleton
  public SecureRandom secureRandom() {
    return new SecureRandom();
  }

  /**
   * Key source.
   *
   * @param factory       the factory
   * @param configuration the configuration
   * @return the key source
   */
  @Provides
  @Singleton
  public KeySource keySource(final KeySourceFactory factory,
                             final KeySourceConfiguration configuration) {
    return factory.create(configuration);
  }

}
