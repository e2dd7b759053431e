package com.codeheadsystems.hdriv.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Everything a version extractor read from a document. Material values carry no textures yet;
 * those are in {@link #textures()} until resolved.
 */
@Value.Immutable
public interface StoredProject {

  SchemaVersion version();

  ProjectSettings settings();

  Materials materials();

  Optional<String> selectedHdriName();

  List<StoredAsset> hdris();

  Map<AssetSlot, StoredAsset> textures();

  Optional<CustomPreset> loadedPreset();

}
