package com.codeheadsystems.hdriv.model;

/**
 * Where a stored asset goes in the project. Declaration order is resolution order.
 */
public enum AssetSlot {
  HDRI,
  FLOOR_TEXTURE,
  GLASS_ROUGHNESS,
  MATTE_ROUGHNESS,
  CHROME_ROUGHNESS,
  PLASTIC_ROUGHNESS
}
