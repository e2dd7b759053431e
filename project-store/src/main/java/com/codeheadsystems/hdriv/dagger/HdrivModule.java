package com.codeheadsystems.hdriv.dagger;

import com.codeheadsystems.hdriv.model.Configuration;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import dagger.Module;
import dagger.Provides;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import javax.inject.Named;
import javax.inject.Singleton;

/**
 * The type Hdriv module.
 */
@Module
public class HdrivModule {

  /**
   * Name of the executor assets are encrypted on.
   */
  public static final String ASSET_EXECUTOR = "assetExecutor";

  /**
   * Instantiates a new Hdriv module.
   */
  public HdrivModule() {
    // Default constructor
  }

  /**
   * Object mapper for JSON serialization.
   *
   * @return the object mapper
   */
  @Provides
  @Singleton
  public ObjectMapper objectMapper() {
    return new ObjectMapper().registerModule(new Jdk8Module());
  }

  /**
   * Asset executor pool. Daemon threads, so an idle pool never keeps the process alive; the
   * component shuts it down on close.
   *
   * @param configuration the configuration
   * @return the executor service
   */
  @Provides
  @Singleton
  @Named(ASSET_EXECUTOR)
  public ExecutorService assetExecutorService(final Configuration configuration) {
    final AtomicInteger counter = new AtomicInteger();
    return Executors.newFixedThreadPool(configuration.assetThreads(), r -> {
      final Thread thread = new Thread(r, "hdriv-asset-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
  }

  /**
   * Asset executor as seen by the serializer.
   *
   * @param executorService the executor service
   * @return the executor
   */
  @Provides
  @Singleton
  @Named(ASSET_EXECUTOR)
  public Executor assetExecutor(@Named(ASSET_EXECUTOR) final ExecutorService executorService) {
    return executorService;
  }

}
