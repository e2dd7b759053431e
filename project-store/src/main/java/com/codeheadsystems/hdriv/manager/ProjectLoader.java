package com.codeheadsystems.hdriv.manager;

import com.codeheadsystems.api.hdriv.v1.EncryptedPacket;
import com.codeheadsystems.envelope.encryption.EnvelopeCipher;
import com.codeheadsystems.envelope.exception.DecryptionException;
import com.codeheadsystems.hdriv.exception.InvalidFormatException;
import com.codeheadsystems.hdriv.exception.UnsupportedLegacySchemeException;
import com.codeheadsystems.hdriv.migration.JsonFields;
import com.codeheadsystems.hdriv.migration.VersionExtractors;
import com.codeheadsystems.hdriv.model.Asset;
import com.codeheadsystems.hdriv.model.AssetSlot;
import com.codeheadsystems.hdriv.model.AssetWarning;
import com.codeheadsystems.hdriv.model.ImmutableFloorMaterial;
import com.codeheadsystems.hdriv.model.ImmutableGlassMaterial;
import com.codeheadsystems.hdriv.model.ImmutableLoadResult;
import com.codeheadsystems.hdriv.model.ImmutableMaterials;
import com.codeheadsystems.hdriv.model.ImmutableNormalizedProject;
import com.codeheadsystems.hdriv.model.ImmutableSurfaceMaterial;
import com.codeheadsystems.hdriv.model.LoadResult;
import com.codeheadsystems.hdriv.model.Materials;
import com.codeheadsystems.hdriv.model.SchemaVersion;
import com.codeheadsystems.hdriv.model.StoredAsset;
import com.codeheadsystems.hdriv.model.StoredProject;
import com.codeheadsystems.hdriv.model.WarningReason;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The type Project loader.
 * <p>
 * Reads a document of any known version into a {@link com.codeheadsystems.hdriv.model.NormalizedProject}.
 * Problems with the document itself fail the load with an {@link InvalidFormatException}.
 * Problems with a single asset drop that asset and add a warning; the rest of the project still
 * loads.
 */
@Singleton
public class ProjectLoader {

  private static final Logger log = LoggerFactory.getLogger(ProjectLoader.class);

  private final ObjectMapper objectMapper;
  private final VersionExtractors versionExtractors;
  private final AssetResolver assetResolver;
  private final EnvelopeCipher envelopeCipher;

  /**
   * Instantiates a new Project loader.
   *
   * @param objectMapper      the object mapper
   * @param versionExtractors the version extractors
   * @param assetResolver     the asset resolver
   * @param envelopeCipher    the envelope cipher
   */
  @Inject
  public ProjectLoader(final ObjectMapper objectMapper,
                       final VersionExtractors versionExtractors,
                       final AssetResolver assetResolver,
                       final EnvelopeCipher envelopeCipher) {
    log.info("ProjectLoader({}, {}, {}, {})", objectMapper, versionExtractors, assetResolver, envelopeCipher);
    this.objectMapper = objectMapper;
    this.versionExtractors = versionExtractors;
    this.assetResolver = assetResolver;
    this.envelopeCipher = envelopeCipher;
  }

  /**
   * Load a project document.
   *
   * @param rawText the document text
   * @return the load result
   * @throws InvalidFormatException if the document cannot be read
   */
  public LoadResult load(final String rawText) {
    log.trace("load({} chars)", rawText == null ? 0 : rawText.length());
    final ObjectNode root = parse(rawText);
    final String tag = JsonFields.text(root, "version")
        .orElseThrow(() -> new InvalidFormatException("Missing version"));
    final SchemaVersion version = SchemaVersion.fromTag(tag)
        .orElseThrow(() -> new InvalidFormatException("Unsupported version: " + tag));
    final StoredProject stored = versionExtractors.forVersion(version).extract(root);
    log.debug("load: version {} with {} hdris and {} textures", version, stored.hdris().size(), stored.textures().size());

    final List<AssetWarning> warnings = new ArrayList<>();
    final List<Asset> hdris = new ArrayList<>();
    for (StoredAsset hdri : stored.hdris()) {
      resolve(hdri, warnings).ifPresent(hdris::add);
    }
    final Materials materials = withTextures(stored.materials(), stored.textures(), warnings);
    final Optional<String> selected = stored.selectedHdriName()
        .filter(name -> hdris.stream().anyMatch(asset -> asset.name().equals(name)));
    if (stored.selectedHdriName().isPresent() && selected.isEmpty()) {
      log.info("load: selected hdri {} is not available, clearing selection", stored.selectedHdriName().get());
    }

    return ImmutableLoadResult.builder()
        .project(ImmutableNormalizedProject.builder()
            .settings(stored.settings())
            .materials(materials)
            .hdris(hdris)
            .selectedHdriName(selected)
            .loadedPreset(stored.loadedPreset())
            .build())
        .warnings(warnings)
        .build();
  }

  /**
   * Decrypt a single asset. Unlike {@link #load(String)} a failure is not turned into a
   * warning.
   *
   * @param name   the asset name
   * @param packet the packet
   * @return the asset
   * @throws DecryptionException if the packet cannot be opened
   */
  public Asset decryptAsset(final String name, final EncryptedPacket packet) {
    log.trace("decryptAsset({})", name);
    return Asset.of(name, envelopeCipher.decryptPayload(packet));
  }

  private ObjectNode parse(final String rawText) {
    if (rawText == null || rawText.isBlank()) {
      throw new InvalidFormatException("Empty document");
    }
    final JsonNode root;
    try {
      root = objectMapper.readTree(rawText);
    } catch (JsonProcessingException e) {
      throw new InvalidFormatException("Document is not valid JSON", e);
    }
    if (root == null || !root.isObject()) {
      throw new InvalidFormatException("Document root must be an object");
    }
    return (ObjectNode) root;
  }

  private Optional<Asset> resolve(final StoredAsset stored, final List<AssetWarning> warnings) {
    try {
      return Optional.of(assetResolver.resolve(stored));
    } catch (DecryptionException e) {
      return skip(stored, WarningReason.KEY_MISMATCH_OR_CORRUPTION, warnings);
    } catch (UnsupportedLegacySchemeException e) {
      return skip(stored, WarningReason.UNSUPPORTED_LEGACY_ENCRYPTION, warnings);
    } catch (IllegalArgumentException e) {
      return skip(stored, WarningReason.INVALID_ENCODING, warnings);
    }
  }

  private Optional<Asset> skip(final StoredAsset stored,
                               final WarningReason reason,
                               final List<AssetWarning> warnings) {
    log.warn("Skipping asset {}: {}", stored.name(), reason.message());
    warnings.add(AssetWarning.of(stored.name(), reason));
    return Optional.empty();
  }

  private Materials withTextures(final Materials materials,
                                 final Map<AssetSlot, StoredAsset> textures,
                                 final List<AssetWarning> warnings) {
    final ImmutableMaterials.Builder builder = ImmutableMaterials.builder().from(materials);
    for (AssetSlot slot : AssetSlot.values()) {
      final StoredAsset stored = textures.get(slot);
      if (stored == null) {
        continue;
      }
      final Optional<Asset> texture = resolve(stored, warnings);
      if (texture.isEmpty()) {
        continue;
      }
      switch (slot) {
        case FLOOR_TEXTURE -> builder.floor(ImmutableFloorMaterial.copyOf(materials.floor())
            .withTexture(texture));
        case GLASS_ROUGHNESS -> builder.glass(ImmutableGlassMaterial.copyOf(materials.glass())
            .withRoughnessTexture(texture));
        case MATTE_ROUGHNESS -> builder.matte(ImmutableSurfaceMaterial.copyOf(materials.matte())
            .withRoughnessTexture(texture));
        case CHROME_ROUGHNESS -> builder.chrome(ImmutableSurfaceMaterial.copyOf(materials.chrome())
            .withRoughnessTexture(texture));
        case PLASTIC_ROUGHNESS -> builder.plastic(ImmutableSurfaceMaterial.copyOf(materials.plastic())
            .withRoughnessTexture(texture));
        default -> throw new IllegalStateException("Not a texture slot: " + slot);
      }
    }
    return builder.build();
  }

}
