package com.codeheadsystems.hdriv.model;

import com.codeheadsystems.api.hdriv.v1.PresetFile;
import org.immutables.value.Value;

/**
 * A user preset applied to the project, kept so it can be shown and re-applied after open.
 */
@Value.Immutable
public interface CustomPreset {

  static CustomPreset of(final String name, final PresetFile data) {
    return ImmutableCustomPreset.builder().name(name).data(data).build();
  }

  String name();

  PresetFile data();

}
