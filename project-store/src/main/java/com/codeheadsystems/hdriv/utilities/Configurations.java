package com.codeheadsystems.hdriv.utilities;

import com.codeheadsystems.hdriv.model.Configuration;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import java.io.IOException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the JSON configuration file. Used before the component exists, so it keeps its own
 * object mapper.
 */
public class Configurations {

  private static final Logger LOGGER = LoggerFactory.getLogger(Configurations.class);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper().registerModule(new Jdk8Module());

  private Configurations() {
  }

  /**
   * Read configuration.
   *
   * @param path the path
   * @return the configuration
   * @throws IOException if the file cannot be read or parsed
   */
  public static Configuration read(final Path path) throws IOException {
    LOGGER.info("read({})", path);
    return OBJECT_MAPPER.readValue(path.toFile(), Configuration.class);
  }

}
