package com.codeheadsystems.hdriv.model;

import org.immutables.value.Value;

/**
 * Key light values the renderer derived from an HDRI. Stored so the analysis does not have to
 * run again on open.
 */
@Value.Immutable
public interface LightAnnotation {

  double directionX();

  double directionY();

  double directionZ();

  double intensity();

  double ambientIntensity();

  double shadowRadius();

}
