package com.codeheadsystems.hdriv.converter;

import com.codeheadsystems.api.hdriv.v1.GlassData;
import com.codeheadsystems.api.hdriv.v1.ImmutablePresetFile;
import com.codeheadsystems.api.hdriv.v1.ImmutablePresetMaterialsData;
import com.codeheadsystems.api.hdriv.v1.ImmutablePresetSettingsData;
import com.codeheadsystems.api.hdriv.v1.PresetFile;
import com.codeheadsystems.api.hdriv.v1.PresetMaterialsData;
import com.codeheadsystems.api.hdriv.v1.PresetSettingsData;
import com.codeheadsystems.api.hdriv.v1.SurfaceData;
import com.codeheadsystems.hdriv.exception.InvalidFormatException;
import com.codeheadsystems.hdriv.model.CustomPreset;
import com.codeheadsystems.hdriv.model.ImmutableFloorMaterial;
import com.codeheadsystems.hdriv.model.ImmutableGlassMaterial;
import com.codeheadsystems.hdriv.model.ImmutableMaterials;
import com.codeheadsystems.hdriv.model.ImmutableNormalizedProject;
import com.codeheadsystems.hdriv.model.ImmutableProjectSettings;
import com.codeheadsystems.hdriv.model.ImmutableSurfaceMaterial;
import com.codeheadsystems.hdriv.model.Materials;
import com.codeheadsystems.hdriv.model.NormalizedProject;
import com.codeheadsystems.hdriv.model.ProjectSettings;
import com.codeheadsystems.hdriv.model.SurfaceMaterial;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads, writes and applies preset files. Presets are plain JSON, never encrypted, and carry no
 * textures.
 */
@Singleton
public class PresetCodec {

  private static final Logger log = LoggerFactory.getLogger(PresetCodec.class);

  private final ObjectMapper objectMapper;
  private final ProjectConverter projectConverter;

  /**
   * Instantiates a new Preset codec.
   *
   * @param objectMapper     the object mapper
   * @param projectConverter the project converter
   */
  @Inject
  public PresetCodec(final ObjectMapper objectMapper,
                     final ProjectConverter projectConverter) {
    log.info("PresetCodec({}, {})", objectMapper, projectConverter);
    this.objectMapper = objectMapper;
    this.projectConverter = projectConverter;
  }

  /**
   * Read preset file.
   *
   * @param text the text
   * @return the preset file
   * @throws InvalidFormatException if the text is not a version 1.0 preset
   */
  public PresetFile read(final String text) {
    log.trace("read()");
    final PresetFile presetFile;
    try {
      presetFile = objectMapper.readValue(text, PresetFile.class);
    } catch (JsonProcessingException | IllegalArgumentException | IllegalStateException e) {
      throw new InvalidFormatException("Not a preset file", e);
    }
    return requireSupportedVersion(presetFile);
  }

  /**
   * Rejects presets written in a version other than {@link PresetFile#VERSION}, whether read
   * from a file or embedded in a project.
   *
   * @param presetFile the preset file
   * @return the same preset file
   * @throws InvalidFormatException if the version is not supported
   */
  public static PresetFile requireSupportedVersion(final PresetFile presetFile) {
    if (!PresetFile.VERSION.equals(presetFile.version())) {
      throw new InvalidFormatException("Unsupported preset version: " + presetFile.version());
    }
    return presetFile;
  }

  /**
   * Write string.
   *
   * @param presetFile the preset file
   * @return the json text
   */
  public String write(final PresetFile presetFile) {
    log.trace("write({})", presetFile.name());
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(presetFile);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to write preset", e);
    }
  }

  /**
   * Capture the visibility and material values of a project as a preset.
   *
   * @param name    the preset name
   * @param project the project
   * @return the preset file
   */
  public PresetFile fromProject(final String name, final NormalizedProject project) {
    log.trace("fromProject({})", name);
    final ProjectSettings settings = project.settings();
    final Materials materials = project.materials();
    return ImmutablePresetFile.builder()
        .name(name)
        .settings(ImmutablePresetSettingsData.builder()
            .spheresVisible(settings.spheresVisible())
            .groundVisible(settings.groundVisible())
            .shadowsVisible(settings.shadowsVisible())
            .colorCheckerVisible(settings.colorCheckerVisible())
            .colorCheckerRows(settings.colorCheckerRows())
            .build())
        .materials(ImmutablePresetMaterialsData.builder()
            .floorTiling(materials.floor().tiling())
            .glass(projectConverter.toGlassData(materials.glass()))
            .matte(projectConverter.toSurfaceData(materials.matte()))
            .chrome(projectConverter.toSurfaceData(materials.chrome()))
            .plastic(projectConverter.toSurfaceData(materials.plastic()))
            .build())
        .build();
  }

  /**
   * Apply a preset. Textures and everything the preset does not carry are kept.
   *
   * @param project    the project
   * @param presetFile the preset file
   * @return the updated project
   */
  public NormalizedProject applyPreset(final NormalizedProject project, final PresetFile presetFile) {
    log.trace("applyPreset({})", presetFile.name());
    final PresetSettingsData settings = presetFile.settings();
    final PresetMaterialsData values = presetFile.materials();
    final Materials materials = project.materials();
    return ImmutableNormalizedProject.builder()
        .from(project)
        .settings(ImmutableProjectSettings.builder()
            .from(project.settings())
            .spheresVisible(settings.spheresVisible())
            .groundVisible(settings.groundVisible())
            .shadowsVisible(settings.shadowsVisible())
            .colorCheckerVisible(settings.colorCheckerVisible())
            .colorCheckerRows(settings.colorCheckerRows())
            .build())
        .materials(ImmutableMaterials.builder()
            .floor(ImmutableFloorMaterial.builder().from(materials.floor()).tiling(values.floorTiling()).build())
            .glass(applyGlass(ImmutableGlassMaterial.builder().from(materials.glass()), values.glass()))
            .matte(applySurface(materials.matte(), values.matte()))
            .chrome(applySurface(materials.chrome(), values.chrome()))
            .plastic(applySurface(materials.plastic(), values.plastic()))
            .build())
        .loadedPreset(CustomPreset.of(presetFile.name(), presetFile))
        .build();
  }

  private ImmutableGlassMaterial applyGlass(final ImmutableGlassMaterial.Builder builder, final GlassData glass) {
    return builder
        .color(glass.color())
        .roughness(glass.roughness())
        .ior(glass.ior())
        .transmission(glass.transmission())
        .build();
  }

  private SurfaceMaterial applySurface(final SurfaceMaterial surface, final SurfaceData values) {
    return ImmutableSurfaceMaterial.builder()
        .from(surface)
        .color(values.color())
        .roughness(values.roughness())
        .metalness(values.metalness())
        .build();
  }

}
