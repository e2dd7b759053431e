package com.codeheadsystems.api.hdriv.v1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * One HDRI in the {@code hdris} list of a 1.7 document.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableHdriEntry.class)
@JsonDeserialize(builder = ImmutableHdriEntry.Builder.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface HdriEntry extends EncryptedEntry {

  /**
   * Of hdri entry.
   *
   * @param name   the name
   * @param packet the encrypted packet
   * @return the hdri entry
   */
  static HdriEntry of(final String name, final EncryptedPacket packet) {
    return ImmutableHdriEntry.builder()
        .name(name)
        .data(packet.data())
        .iv(packet.iv())
        .wrappedKey(packet.wrappedKey())
        .keyIv(packet.keyIv())
        .build();
  }

  /**
   * Key light annotation, if the renderer computed one.
   *
   * @return the lights
   */
  @JsonProperty("lights")
  @JsonInclude(JsonInclude.Include.NON_ABSENT)
  Optional<LightsData> lights();

}
