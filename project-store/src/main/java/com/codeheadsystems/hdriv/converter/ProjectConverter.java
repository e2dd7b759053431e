package com.codeheadsystems.hdriv.converter;

import com.codeheadsystems.api.hdriv.v1.EncryptedPacket;
import com.codeheadsystems.api.hdriv.v1.FloorData;
import com.codeheadsystems.api.hdriv.v1.GlassData;
import com.codeheadsystems.api.hdriv.v1.HdriEntry;
import com.codeheadsystems.api.hdriv.v1.ImmutableDirectionData;
import com.codeheadsystems.api.hdriv.v1.ImmutableFloorData;
import com.codeheadsystems.api.hdriv.v1.ImmutableGlassData;
import com.codeheadsystems.api.hdriv.v1.ImmutableHdriEntry;
import com.codeheadsystems.api.hdriv.v1.ImmutableLightsData;
import com.codeheadsystems.api.hdriv.v1.ImmutableLoadedPresetData;
import com.codeheadsystems.api.hdriv.v1.ImmutableMaterialsData;
import com.codeheadsystems.api.hdriv.v1.ImmutableProjectFile;
import com.codeheadsystems.api.hdriv.v1.ImmutableSettingsData;
import com.codeheadsystems.api.hdriv.v1.ImmutableSurfaceData;
import com.codeheadsystems.api.hdriv.v1.LightsData;
import com.codeheadsystems.api.hdriv.v1.MaterialsData;
import com.codeheadsystems.api.hdriv.v1.ProjectFile;
import com.codeheadsystems.api.hdriv.v1.SettingsData;
import com.codeheadsystems.api.hdriv.v1.SurfaceData;
import com.codeheadsystems.api.hdriv.v1.TextureEntry;
import com.codeheadsystems.hdriv.model.Asset;
import com.codeheadsystems.hdriv.model.AssetSlot;
import com.codeheadsystems.hdriv.model.GlassMaterial;
import com.codeheadsystems.hdriv.model.LightAnnotation;
import com.codeheadsystems.hdriv.model.Materials;
import com.codeheadsystems.hdriv.model.NormalizedProject;
import com.codeheadsystems.hdriv.model.ProjectSettings;
import com.codeheadsystems.hdriv.model.SchemaVersion;
import com.codeheadsystems.hdriv.model.SurfaceMaterial;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the current document shape from the normalized model and already encrypted assets.
 */
@Singleton
public class ProjectConverter {

  private static final Logger log = LoggerFactory.getLogger(ProjectConverter.class);

  /**
   * Instantiates a new Project converter.
   */
  @Inject
  public ProjectConverter() {
    log.info("ProjectConverter()");
  }

  /**
   * To project file.
   *
   * @param project  the project
   * @param hdris    the encrypted hdris, in project order
   * @param textures the encrypted textures by slot
   * @return the project file
   */
  public ProjectFile toProjectFile(final NormalizedProject project,
                                   final List<HdriEntry> hdris,
                                   final Map<AssetSlot, TextureEntry> textures) {
    log.trace("toProjectFile({} hdris, {} textures)", hdris.size(), textures.size());
    final ImmutableProjectFile.Builder builder = ImmutableProjectFile.builder()
        .version(SchemaVersion.CURRENT.tag())
        .settings(toSettingsData(project.settings(), project.selectedHdriName()))
        .materials(toMaterialsData(project.materials(), textures))
        .hdris(hdris);
    project.loadedPreset().ifPresent(preset -> builder.loadedPreset(
        ImmutableLoadedPresetData.builder().name(preset.name()).data(preset.data()).build()));
    return builder.build();
  }

  /**
   * To hdri entry.
   *
   * @param asset  the asset
   * @param packet the encrypted bytes of the asset
   * @return the hdri entry
   */
  public HdriEntry toHdriEntry(final Asset asset, final EncryptedPacket packet) {
    return ImmutableHdriEntry.copyOf(HdriEntry.of(asset.name(), packet))
        .withLights(asset.lights().map(this::toLightsData));
  }

  /**
   * To texture entry.
   *
   * @param asset  the asset
   * @param packet the packet
   * @return the texture entry
   */
  public TextureEntry toTextureEntry(final Asset asset, final EncryptedPacket packet) {
    return TextureEntry.of(asset.name(), packet);
  }

  /**
   * Textures of the materials by slot, in resolution order.
   *
   * @param materials the materials
   * @return the map
   */
  public Map<AssetSlot, Asset> textures(final Materials materials) {
    final Map<AssetSlot, Asset> result = new EnumMap<>(AssetSlot.class);
    materials.floor().texture().ifPresent(t -> result.put(AssetSlot.FLOOR_TEXTURE, t));
    materials.glass().roughnessTexture().ifPresent(t -> result.put(AssetSlot.GLASS_ROUGHNESS, t));
    materials.matte().roughnessTexture().ifPresent(t -> result.put(AssetSlot.MATTE_ROUGHNESS, t));
    materials.chrome().roughnessTexture().ifPresent(t -> result.put(AssetSlot.CHROME_ROUGHNESS, t));
    materials.plastic().roughnessTexture().ifPresent(t -> result.put(AssetSlot.PLASTIC_ROUGHNESS, t));
    return result;
  }

  /**
   * To settings data.
   *
   * @param settings the settings
   * @param selected the selected hdri name
   * @return the settings data
   */
  public SettingsData toSettingsData(final ProjectSettings settings, final Optional<String> selected) {
    return ImmutableSettingsData.builder()
        .rotation(settings.rotation())
        .exposure(settings.exposure())
        .blur(settings.blur())
        .selectedHdriName(selected)
        .toneMapping(settings.toneMapping().label())
        .spheresVisible(settings.spheresVisible())
        .groundVisible(settings.groundVisible())
        .shadowsVisible(settings.shadowsVisible())
        .colorCheckerVisible(settings.colorCheckerVisible())
        .preset(settings.preset().label())
        .colorCheckerRows(settings.colorCheckerRows())
        .build();
  }

  /**
   * Glass data without its texture.
   *
   * @param glass the glass
   * @return the glass data
   */
  public GlassData toGlassData(final GlassMaterial glass) {
    return ImmutableGlassData.builder()
        .color(glass.color())
        .roughness(glass.roughness())
        .ior(glass.ior())
        .transmission(glass.transmission())
        .build();
  }

  /**
   * Surface data without its texture.
   *
   * @param surface the surface
   * @return the surface data
   */
  public SurfaceData toSurfaceData(final SurfaceMaterial surface) {
    return ImmutableSurfaceData.builder()
        .color(surface.color())
        .roughness(surface.roughness())
        .metalness(surface.metalness())
        .build();
  }

  private MaterialsData toMaterialsData(final Materials materials, final Map<AssetSlot, TextureEntry> textures) {
    final FloorData floor = ImmutableFloorData.builder()
        .tiling(materials.floor().tiling())
        .texture(Optional.ofNullable(textures.get(AssetSlot.FLOOR_TEXTURE)))
        .build();
    return ImmutableMaterialsData.builder()
        .floor(floor)
        .glass(ImmutableGlassData.copyOf(toGlassData(materials.glass()))
            .withRoughnessTexture(Optional.ofNullable(textures.get(AssetSlot.GLASS_ROUGHNESS))))
        .matte(ImmutableSurfaceData.copyOf(toSurfaceData(materials.matte()))
            .withRoughnessTexture(Optional.ofNullable(textures.get(AssetSlot.MATTE_ROUGHNESS))))
        .chrome(ImmutableSurfaceData.copyOf(toSurfaceData(materials.chrome()))
            .withRoughnessTexture(Optional.ofNullable(textures.get(AssetSlot.CHROME_ROUGHNESS))))
        .plastic(ImmutableSurfaceData.copyOf(toSurfaceData(materials.plastic()))
            .withRoughnessTexture(Optional.ofNullable(textures.get(AssetSlot.PLASTIC_ROUGHNESS))))
        .build();
  }

  private LightsData toLightsData(final LightAnnotation lights) {
    return ImmutableLightsData.builder()
        .direction(ImmutableDirectionData.builder()
            .x(lights.directionX())
            .y(lights.directionY())
            .z(lights.directionZ())
            .build())
        .intensity(lights.intensity())
        .ambientIntensity(lights.ambientIntensity())
        .shadowRadius(lights.shadowRadius())
        .build();
  }

}
