package com.codeheadsystems.hdriv.migration;

import com.codeheadsystems.hdriv.model.SchemaVersion;
import com.codeheadsystems.hdriv.model.StoredProject;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Reads the fields one document version defines.
 */
public interface VersionExtractor {

  /**
   * Version this extractor reads.
   *
   * @return the schema version
   */
  SchemaVersion version();

  /**
   * Extract stored project.
   *
   * @param root the document root
   * @return the stored project
   * @throws com.codeheadsystems.hdriv.exception.InvalidFormatException if the document does not match its version
   */
  StoredProject extract(ObjectNode root);

}
