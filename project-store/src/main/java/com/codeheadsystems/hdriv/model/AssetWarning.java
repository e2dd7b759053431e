package com.codeheadsystems.hdriv.model;

import org.immutables.value.Value;

/**
 * The interface Asset warning.
 */
@Value.Immutable
public interface AssetWarning {

  /**
   * Of asset warning.
   *
   * @param assetName the asset name
   * @param reason    the reason
   * @return the asset warning
   */
  static AssetWarning of(final String assetName, final WarningReason reason) {
    return ImmutableAssetWarning.builder().assetName(assetName).reason(reason).build();
  }

  String assetName();

  WarningReason reason();

  @Value.Default
  default String message() {
    return reason().message();
  }

}
