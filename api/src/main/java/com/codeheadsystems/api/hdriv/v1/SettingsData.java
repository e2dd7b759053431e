package com.codeheadsystems.api.hdriv.v1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * The {@code settings} block of a 1.7 document.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableSettingsData.class)
@JsonDeserialize(builder = ImmutableSettingsData.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface SettingsData {

  @JsonProperty("rotation")
  double rotation();

  @JsonProperty("exposure")
  double exposure();

  @JsonProperty("blur")
  double blur();

  /**
   * Name of the HDRI shown when the project opens. Written as null when nothing is selected.
   *
   * @return the selected hdri name
   */
  @JsonProperty("selectedHdriName")
  Optional<String> selectedHdriName();

  /**
   * Tone mapping label, e.g. "ACES Filmic".
   *
   * @return the tone mapping
   */
  @JsonProperty("toneMapping")
  String toneMapping();

  @JsonProperty("spheresVisible")
  boolean spheresVisible();

  @JsonProperty("groundVisible")
  boolean groundVisible();

  @JsonProperty("shadowsVisible")
  boolean shadowsVisible();

  @JsonProperty("colorCheckerVisible")
  boolean colorCheckerVisible();

  /**
   * Built-in preset label, e.g. "SHV".
   *
   * @return the preset
   */
  @JsonProperty("preset")
  String preset();

  @JsonProperty("colorCheckerRows")
  List<Integer> colorCheckerRows();

}
