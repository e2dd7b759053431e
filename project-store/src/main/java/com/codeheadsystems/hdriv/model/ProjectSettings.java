package com.codeheadsystems.hdriv.model;

import java.util.List;
import org.immutables.value.Value;

/**
 * Global view settings. Every attribute has the default a new project starts with.
 */
@Value.Immutable
public interface ProjectSettings {

  /**
   * Color checker rows shown by default.
   */
  List<Integer> DEFAULT_COLOR_CHECKER_ROWS = List.of(0, 1, 2, 3);

  /**
   * Environment rotation.
   *
   * @return the rotation
   */
  @Value.Default
  default double rotation() {
    return 0;
  }

  @Value.Default
  default double exposure() {
    return 1;
  }

  @Value.Default
  default double blur() {
    return 0;
  }

  @Value.Default
  default ToneMapping toneMapping() {
    return ToneMapping.ACES_FILMIC;
  }

  @Value.Default
  default boolean spheresVisible() {
    return true;
  }

  @Value.Default
  default boolean groundVisible() {
    return true;
  }

  @Value.Default
  default boolean shadowsVisible() {
    return true;
  }

  @Value.Default
  default boolean colorCheckerVisible() {
    return true;
  }

  @Value.Default
  default Preset preset() {
    return Preset.SHV;
  }

  /**
   * Indexes of the visible color checker rows.
   *
   * @return the list
   */
  @Value.Default
  default List<Integer> colorCheckerRows() {
    return DEFAULT_COLOR_CHECKER_ROWS;
  }

}
