package com.codeheadsystems.hdriv.model;

/**
 * How a stored asset's bytes are held in the document.
 */
public enum AssetEncoding {
  /**
   * Data url or bare base64, pre-encryption documents.
   */
  PLAIN,
  /**
   * Envelope encrypted packet.
   */
  ENVELOPE,
  /**
   * A retired encryption scheme that can no longer be read.
   */
  RETIRED
}
