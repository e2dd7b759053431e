package com.codeheadsystems.hdriv.migration;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.hdriv.model.SchemaVersion;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class VersionExtractorsTest {

  private VersionExtractors versionExtractors;

  @BeforeEach
  void setup() {
    versionExtractors = new VersionExtractors(new ObjectMapper());
  }

  @ParameterizedTest
  @EnumSource(SchemaVersion.class)
  void forVersion(final SchemaVersion version) {
    assertThat(versionExtractors.forVersion(version).version()).isEqualTo(version);
  }

  @Test
  void forVersion_newerExtendsOlder() {
    assertThat(versionExtractors.forVersion(SchemaVersion.V1_7)).isInstanceOf(V16Extractor.class);
    assertThat(versionExtractors.forVersion(SchemaVersion.V1_5)).isInstanceOf(V10Extractor.class);
  }

  @Test
  void fromTag() {
    assertThat(SchemaVersion.fromTag("1.4")).contains(SchemaVersion.V1_4);
    assertThat(SchemaVersion.fromTag("1.8")).isEmpty();
    assertThat(SchemaVersion.fromTag("1")).isEmpty();
    assertThat(SchemaVersion.fromTag(null)).isEmpty();
    assertThat(SchemaVersion.CURRENT.tag()).isEqualTo("1.7");
  }

}
