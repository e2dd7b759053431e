package com.codeheadsystems.api.hdriv.v1;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ProjectFileTest {

  private ObjectMapper objectMapper;

  private static EncryptedPacket packet(final String prefix) {
    return ImmutableEncryptedPacket.builder()
        .data(prefix + "data")
        .iv(prefix + "iv")
        .wrappedKey(prefix + "wrapped")
        .keyIv(prefix + "keyIv")
        .build();
  }

  private static SurfaceData surface(final String color) {
    return ImmutableSurfaceData.builder().color(color).roughness(0.5).metalness(0.25).build();
  }

  private static ProjectFile projectFile() {
    return ImmutableProjectFile.builder()
        .settings(ImmutableSettingsData.builder()
            .rotation(0.25)
            .exposure(1.2)
            .blur(0)
            .toneMapping("ACES Filmic")
            .spheresVisible(true)
            .groundVisible(false)
            .shadowsVisible(true)
            .colorCheckerVisible(true)
            .preset("SHV")
            .colorCheckerRows(List.of(0, 2))
            .build())
        .materials(ImmutableMaterialsData.builder()
            .floor(ImmutableFloorData.builder()
                .tiling(40)
                .texture(TextureEntry.of("floor.png", packet("f")))
                .build())
            .glass(ImmutableGlassData.builder().color("#ffffff").roughness(0).ior(1.5).transmission(1).build())
            .matte(surface("#ffffff"))
            .chrome(surface("#eeeeee"))
            .plastic(surface("#00bcd4"))
            .build())
        .addHdris(HdriEntry.of("studio.hdr", packet("h")))
        .build();
  }

  @BeforeEach
  void setup() {
    objectMapper = new ObjectMapper().registerModule(new Jdk8Module());
  }

  @Test
  void writeFieldNames() throws Exception {
    final JsonNode tree = objectMapper.readTree(objectMapper.writeValueAsString(projectFile()));

    assertThat(tree.get("version").asText()).isEqualTo(ProjectFile.VERSION);
    assertThat(tree.has("loadedPreset")).isFalse();
    assertThat(tree.get("settings").get("selectedHdriName").isNull()).isTrue();
    final JsonNode hdri = tree.get("hdris").get(0);
    assertThat(hdri.get("name").asText()).isEqualTo("studio.hdr");
    assertThat(hdri.get("data").asText()).isEqualTo("hdata");
    assertThat(hdri.get("encrypted").asBoolean()).isTrue();
    assertThat(hdri.get("iv").asText()).isEqualTo("hiv");
    assertThat(hdri.get("wrappedKey").asText()).isEqualTo("hwrapped");
    assertThat(hdri.get("keyIv").asText()).isEqualTo("hkeyIv");
    assertThat(hdri.has("lights")).isFalse();
    assertThat(tree.get("materials").get("floor").get("texture").get("encrypted").asBoolean()).isTrue();
    assertThat(tree.get("materials").get("glass").has("roughnessTexture")).isFalse();
  }

  @Test
  void readBack() throws Exception {
    final ProjectFile original = projectFile();

    final ProjectFile result = objectMapper.readValue(objectMapper.writeValueAsString(original), ProjectFile.class);

    assertThat(result).isEqualTo(original);
  }

  @Test
  void readLights() throws Exception {
    final String json = "{\"name\":\"a.hdr\",\"data\":\"d\",\"encrypted\":true,\"iv\":\"i\",\"wrappedKey\":\"w\","
        + "\"keyIv\":\"k\",\"lights\":{\"direction\":{\"x\":0.0,\"y\":1.0,\"z\":0.0},"
        + "\"intensity\":2.5,\"ambientIntensity\":0.3,\"shadowRadius\":4.0},\"extra\":1}";

    final HdriEntry result = objectMapper.readValue(json, HdriEntry.class);

    assertThat(result.lights()).isPresent();
    assertThat(result.lights().get().direction().y()).isEqualTo(1.0);
    assertThat(result.lights().get().intensity()).isEqualTo(2.5);
  }

  @Test
  void presetFile_defaultVersion() {
    final PresetFile presetFile = ImmutablePresetFile.builder()
        .name("Studio")
        .settings(ImmutablePresetSettingsData.builder()
            .spheresVisible(true)
            .groundVisible(true)
            .shadowsVisible(true)
            .colorCheckerVisible(false)
            .build())
        .materials(ImmutablePresetMaterialsData.builder()
            .floorTiling(20)
            .glass(ImmutableGlassData.builder().color("#ffffff").roughness(0).ior(1.5).transmission(1).build())
            .matte(surface("#ffffff"))
            .chrome(surface("#ffffff"))
            .plastic(surface("#ffffff"))
            .build())
        .build();

    assertThat(presetFile.version()).isEqualTo("1.0");
    assertThat(presetFile.settings().colorCheckerRows()).isEmpty();
  }

}
