package com.codeheadsystems.hdriv.dagger;

import com.codeheadsystems.envelope.dagger.EnvelopeModule;
import com.codeheadsystems.envelope.manager.KeyManager;
import com.codeheadsystems.hdriv.converter.PresetCodec;
import com.codeheadsystems.hdriv.manager.ProjectFileManager;
import com.codeheadsystems.hdriv.manager.ProjectLoader;
import com.codeheadsystems.hdriv.manager.ProjectSerializer;
import com.codeheadsystems.hdriv.model.Configuration;
import dagger.Component;
import java.util.concurrent.ExecutorService;
import javax.inject.Named;
import javax.inject.Singleton;

/**
 * The interface Hdriv component. One per process; it owns the application key.
 */
@Singleton
@Component(modules = {HdrivModule.class, ConfigurationModule.class, EnvelopeModule.class})
public interface HdrivComponent extends AutoCloseable {

  /**
   * Instance hdriv component.
   *
   * @param configuration the configuration
   * @return the hdriv component
   */
  static HdrivComponent instance(final Configuration configuration) {
    return DaggerHdrivComponent.builder().configurationModule(new ConfigurationModule(configuration)).build();
  }

  /**
   * Key manager.
   *
   * @return the key manager
   */
  KeyManager keyManager();

  /**
   * Project serializer.
   *
   * @return the project serializer
   */
  ProjectSerializer projectSerializer();

  /**
   * Project loader.
   *
   * @return the project loader
   */
  ProjectLoader projectLoader();

  /**
   * Preset codec.
   *
   * @return the preset codec
   */
  PresetCodec presetCodec();

  /**
   * Project file manager.
   *
   * @return the project file manager
   */
  ProjectFileManager projectFileManager();

  /**
   * Pool the serializer encrypts assets on.
   *
   * @return the executor service
   */
  @Named(HdrivModule.ASSET_EXECUTOR)
  ExecutorService assetExecutor();

  /**
   * Stops the asset pool. Saves after close are rejected.
   */
  @Override
  default void close() {
    assetExecutor().shutdown();
  }

}
