package com.codeheadsystems.hdriv.migration;

import com.codeheadsystems.hdriv.exception.InvalidFormatException;
import com.codeheadsystems.hdriv.model.ImmutableLightAnnotation;
import com.codeheadsystems.hdriv.model.ImmutableStoredAsset;
import com.codeheadsystems.hdriv.model.LightAnnotation;
import com.codeheadsystems.hdriv.model.SchemaVersion;
import com.codeheadsystems.hdriv.model.StoredAsset;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Optional;

/**
 * Version 1.4 stores the key light annotation next to each HDRI.
 */
public class V14Extractor extends V13Extractor {

  @Override
  public SchemaVersion version() {
    return SchemaVersion.V1_4;
  }

  @Override
  protected StoredAsset readHdri(final JsonNode node) {
    final StoredAsset asset = super.readHdri(node);
    final Optional<LightAnnotation> lights = JsonFields.object(node, "lights").map(this::readLights);
    return ImmutableStoredAsset.copyOf(asset).withLights(lights);
  }

  private LightAnnotation readLights(final ObjectNode lights) {
    final ObjectNode direction = JsonFields.requireObject(lights, "direction");
    return ImmutableLightAnnotation.builder()
        .directionX(required(direction, "x"))
        .directionY(required(direction, "y"))
        .directionZ(required(direction, "z"))
        .intensity(required(lights, "intensity"))
        .ambientIntensity(required(lights, "ambientIntensity"))
        .shadowRadius(required(lights, "shadowRadius"))
        .build();
  }

  private double required(final ObjectNode node, final String field) {
    return JsonFields.number(node, field)
        .orElseThrow(() -> new InvalidFormatException("Light annotation is missing '" + field + "'"));
  }

}
