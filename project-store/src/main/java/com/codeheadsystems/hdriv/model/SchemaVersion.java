package com.codeheadsystems.hdriv.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Every project document version ever written. The version tag alone decides how a document
 * is read.
 */
public enum SchemaVersion {
  V1_0("1.0"),
  V1_1("1.1"),
  V1_2("1.2"),
  V1_3("1.3"),
  V1_4("1.4"),
  V1_5("1.5"),
  V1_6("1.6"),
  V1_7("1.7");

  /**
   * The version written by the serializer.
   */
  public static final SchemaVersion CURRENT = V1_7;

  private final String tag;

  SchemaVersion(final String tag) {
    this.tag = tag;
  }

  /**
   * From tag.
   *
   * @param tag the tag
   * @return the version, empty if the tag is unknown
   */
  public static Optional<SchemaVersion> fromTag(final String tag) {
    return Arrays.stream(values())
        .filter(value -> value.tag.equals(tag))
        .findFirst();
  }

  public String tag() {
    return tag;
  }
}
