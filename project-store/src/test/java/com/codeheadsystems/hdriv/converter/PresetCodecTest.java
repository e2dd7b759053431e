package com.codeheadsystems.hdriv.converter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import com.codeheadsystems.api.hdriv.v1.PresetFile;
import com.codeheadsystems.hdriv.exception.InvalidFormatException;
import com.codeheadsystems.hdriv.model.Asset;
import com.codeheadsystems.hdriv.model.CustomPreset;
import com.codeheadsystems.hdriv.model.ImmutableFloorMaterial;
import com.codeheadsystems.hdriv.model.ImmutableMaterials;
import com.codeheadsystems.hdriv.model.ImmutableNormalizedProject;
import com.codeheadsystems.hdriv.model.ImmutableProjectSettings;
import com.codeheadsystems.hdriv.model.ImmutableSurfaceMaterial;
import com.codeheadsystems.hdriv.model.Materials;
import com.codeheadsystems.hdriv.model.NormalizedProject;
import com.codeheadsystems.hdriv.model.SurfaceMaterial;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PresetCodecTest {

  private ObjectMapper objectMapper;
  private PresetCodec presetCodec;

  @BeforeEach
  void setup() {
    objectMapper = new ObjectMapper().registerModule(new Jdk8Module());
    presetCodec = new PresetCodec(objectMapper, new ProjectConverter());
  }

  private NormalizedProject tuned() {
    return ImmutableNormalizedProject.builder()
        .settings(ImmutableProjectSettings.builder()
            .groundVisible(false)
            .colorCheckerRows(List.of(0, 2))
            .rotation(0.75)
            .build())
        .materials(ImmutableMaterials.builder()
            .floor(ImmutableFloorMaterial.builder().tiling(16).build())
            .plastic(SurfaceMaterial.of("#ff8800", 0.4, 0.2))
            .build())
        .build();
  }

  @Test
  void fromProject_writeRead() throws Exception {
    final PresetFile presetFile = presetCodec.fromProject("Warm", tuned());

    final String text = presetCodec.write(presetFile);
    final JsonNode node = objectMapper.readTree(text);

    assertThat(node.get("version").asText()).isEqualTo("1.0");
    assertThat(node.get("name").asText()).isEqualTo("Warm");
    assertThat(node.get("settings").get("groundVisible").asBoolean()).isFalse();
    assertThat(node.get("materials").get("floorTiling").asDouble()).isEqualTo(16);
    assertThat(node.get("materials").get("plastic").get("color").asText()).isEqualTo("#ff8800");
    assertThat(node.get("settings").has("rotation")).isFalse();
    assertThat(text).contains("\n");
    assertThat(presetCodec.read(text)).isEqualTo(presetFile);
  }

  @Test
  void read_missingVersion_defaults() throws Exception {
    final ObjectNode node = (ObjectNode) objectMapper.readTree(presetCodec.write(presetCodec.fromProject("x", tuned())));
    node.remove("version");

    assertThat(presetCodec.read(node.toString()).version()).isEqualTo("1.0");
  }

  @Test
  void read_otherVersion() throws Exception {
    final ObjectNode node = (ObjectNode) objectMapper.readTree(presetCodec.write(presetCodec.fromProject("x", tuned())));
    node.put("version", "2.0");

    assertThatExceptionOfType(InvalidFormatException.class)
        .isThrownBy(() -> presetCodec.read(node.toString()))
        .withMessageContaining("2.0");
  }

  @Test
  void read_notAPreset() {
    assertThatExceptionOfType(InvalidFormatException.class)
        .isThrownBy(() -> presetCodec.read("{\"name\":\"only a name\"}"));
    assertThatExceptionOfType(InvalidFormatException.class)
        .isThrownBy(() -> presetCodec.read("not json"));
  }

  @Test
  void applyPreset_keepsTexturesAndView() {
    final Asset texture = Asset.of("chrome.png", new byte[]{1, 2, 3});
    final NormalizedProject project = ImmutableNormalizedProject.builder()
        .settings(ImmutableProjectSettings.builder().rotation(0.5).exposure(2).build())
        .materials(ImmutableMaterials.builder()
            .chrome(ImmutableSurfaceMaterial.copyOf(SurfaceMaterial.chrome()).withRoughnessTexture(texture))
            .build())
        .addHdris(Asset.of("a.hdr", new byte[]{4}))
        .selectedHdriName("a.hdr")
        .build();
    final PresetFile presetFile = presetCodec.fromProject("Warm", tuned());

    final NormalizedProject applied = presetCodec.applyPreset(project, presetFile);

    assertThat(applied.settings().rotation()).isEqualTo(0.5);
    assertThat(applied.settings().exposure()).isEqualTo(2);
    assertThat(applied.settings().groundVisible()).isFalse();
    assertThat(applied.settings().colorCheckerRows()).containsExactly(0, 2);
    assertThat(applied.materials().floor().tiling()).isEqualTo(16);
    assertThat(applied.materials().plastic().color()).isEqualTo("#ff8800");
    assertThat(applied.materials().chrome().roughnessTexture()).contains(texture);
    assertThat(applied.hdris()).isEqualTo(project.hdris());
    assertThat(applied.selectedHdriName()).contains("a.hdr");
    assertThat(applied.loadedPreset()).contains(CustomPreset.of("Warm", presetFile));
  }

  @Test
  void applyPreset_defaultsPresetOnDefaultProject() {
    final NormalizedProject project = ImmutableNormalizedProject.builder().build();
    final PresetFile presetFile = presetCodec.fromProject("Default", project);

    final NormalizedProject applied = presetCodec.applyPreset(project, presetFile);

    assertThat(applied.materials()).isEqualTo(Materials.defaults());
    assertThat(applied.settings()).isEqualTo(project.settings());
  }

}
