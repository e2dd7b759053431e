package com.codeheadsystems.api.hdriv.v1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * The interface Project file.
 * <p>
 * The newest project document shape. Older versions are read through the migrator and
 * never through this type.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableProjectFile.class)
@JsonDeserialize(builder = ImmutableProjectFile.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface ProjectFile {

  /**
   * The version tag written by this release.
   */
  String VERSION = "1.7";

  /**
   * Version string.
   *
   * @return the string
   */
  @JsonProperty("version")
  @Value.Default
  default String version() {
    return VERSION;
  }

  @JsonProperty("settings")
  SettingsData settings();

  @JsonProperty("materials")
  MaterialsData materials();

  @JsonProperty("hdris")
  List<HdriEntry> hdris();

  @JsonProperty("loadedPreset")
  @JsonInclude(JsonInclude.Include.NON_ABSENT)
  Optional<LoadedPresetData> loadedPreset();

}
