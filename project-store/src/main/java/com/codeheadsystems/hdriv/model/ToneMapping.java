package com.codeheadsystems.hdriv.model;

import java.util.Arrays;

/**
 * Tone mapping operator applied by the renderer.
 */
public enum ToneMapping {
  ACES_FILMIC("ACES Filmic"),
  REINHARD("Reinhard"),
  CINEON("Cineon"),
  NONE("None");

  private final String label;

  ToneMapping(final String label) {
    this.label = label;
  }

  /**
   * Resolve a stored label. "Linear" and "None (sRGB)" are older names for {@link #NONE};
   * anything unknown, or no label at all, is {@link #ACES_FILMIC}.
   *
   * @param label the label, may be null
   * @return the tone mapping
   */
  public static ToneMapping fromLabel(final String label) {
    if ("Linear".equals(label) || "None (sRGB)".equals(label)) {
      return NONE;
    }
    return Arrays.stream(values())
        .filter(value -> value.label.equals(label))
        .findFirst()
        .orElse(ACES_FILMIC);
  }

  /**
   * Label written to documents.
   *
   * @return the label
   */
  public String label() {
    return label;
  }
}
