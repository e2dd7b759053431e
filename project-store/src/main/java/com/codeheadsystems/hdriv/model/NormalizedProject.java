package com.codeheadsystems.hdriv.model;

import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * The interface Normalized project.
 * <p>
 * The one in-memory shape every document version is read into, and the only input of the
 * serializer.
 */
@Value.Immutable
public interface NormalizedProject {

  /**
   * Settings project settings.
   *
   * @return the project settings
   */
  @Value.Default
  default ProjectSettings settings() {
    return ImmutableProjectSettings.builder().build();
  }

  /**
   * Materials materials.
   *
   * @return the materials
   */
  @Value.Default
  default Materials materials() {
    return Materials.defaults();
  }

  /**
   * HDRIs in document order.
   *
   * @return the list
   */
  List<Asset> hdris();

  /**
   * Name of the selected HDRI.
   *
   * @return the optional
   */
  Optional<String> selectedHdriName();

  /**
   * Loaded preset optional.
   *
   * @return the optional
   */
  Optional<CustomPreset> loadedPreset();

}
