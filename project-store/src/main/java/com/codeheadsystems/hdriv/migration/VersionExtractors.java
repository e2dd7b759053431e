package com.codeheadsystems.hdriv.migration;

import com.codeheadsystems.hdriv.model.SchemaVersion;
import com.fasterxml.jackson.databind.ObjectMapper;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the extractor for a document version.
 */
@Singleton
public class VersionExtractors {

  private static final Logger log = LoggerFactory.getLogger(VersionExtractors.class);

  private final VersionExtractor v10;
  private final VersionExtractor v11;
  private final VersionExtractor v12;
  private final VersionExtractor v13;
  private final VersionExtractor v14;
  private final VersionExtractor v15;
  private final VersionExtractor v16;
  private final VersionExtractor v17;

  /**
   * Instantiates a new Version extractors.
   *
   * @param objectMapper the object mapper
   */
  @Inject
  public VersionExtractors(final ObjectMapper objectMapper) {
    log.info("VersionExtractors({})", objectMapper);
    this.v10 = new V10Extractor();
    this.v11 = new V11Extractor();
    this.v12 = new V12Extractor();
    this.v13 = new V13Extractor();
    this.v14 = new V14Extractor();
    this.v15 = new V15Extractor(objectMapper);
    this.v16 = new V16Extractor(objectMapper);
    this.v17 = new V17Extractor(objectMapper);
  }

  /**
   * For version version extractor.
   *
   * @param version the version
   * @return the version extractor
   */
  public VersionExtractor forVersion(final SchemaVersion version) {
    log.trace("forVersion({})", version);
    return switch (version) {
      case V1_0 -> v10;
      case V1_1 -> v11;
      case V1_2 -> v12;
      case V1_3 -> v13;
      case V1_4 -> v14;
      case V1_5 -> v15;
      case V1_6 -> v16;
      case V1_7 -> v17;
    };
  }

}
