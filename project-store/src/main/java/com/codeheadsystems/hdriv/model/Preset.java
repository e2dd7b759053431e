package com.codeheadsystems.hdriv.model;

import java.util.Arrays;

/**
 * Built-in color checker presets.
 */
public enum Preset {
  SHV("SHV"),
  POLYHAVEN("Polyhaven"),
  GRAYSCALE("Grayscale"),
  SKIN_TONE("SkinTone");

  private final String label;

  Preset(final String label) {
    this.label = label;
  }

  /**
   * Resolve a stored label, falling back to {@link #SHV}.
   *
   * @param label the label, may be null
   * @return the preset
   */
  public static Preset fromLabel(final String label) {
    return Arrays.stream(values())
        .filter(value -> value.label.equals(label))
        .findFirst()
        .orElse(SHV);
  }

  public String label() {
    return label;
  }
}
