package com.codeheadsystems.hdriv.model;

import java.util.List;
import org.immutables.value.Value;

/**
 * A loaded project and the assets that had to be skipped, in document order.
 */
@Value.Immutable
public interface LoadResult {

  NormalizedProject project();

  List<AssetWarning> warnings();

}
