package com.codeheadsystems.hdriv.utilities;

import com.codeheadsystems.hdriv.model.Asset;
import com.codeheadsystems.hdriv.model.ImmutableAsset;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds assets from files on disk.
 */
public class AssetFiles {

  private static final Logger LOGGER = LoggerFactory.getLogger(AssetFiles.class);

  private static final Map<String, String> CONTENT_TYPES = Map.of(
      "hdr", "image/vnd.radiance",
      "pic", "image/vnd.radiance",
      "exr", "image/x-exr",
      "png", "image/png",
      "jpg", "image/jpeg",
      "jpeg", "image/jpeg");

  private AssetFiles() {
  }

  /**
   * Read an asset, named after the file.
   *
   * @param path the path
   * @return the asset
   * @throws IOException if the file cannot be read
   */
  public static Asset read(final Path path) throws IOException {
    LOGGER.trace("read({})", path);
    return ImmutableAsset.builder()
        .name(path.getFileName().toString())
        .bytes(Files.readAllBytes(path))
        .contentType(contentType(path))
        .build();
  }

  /**
   * Content type from the file extension.
   *
   * @param path the path
   * @return the content type, empty for unknown extensions
   */
  public static Optional<String> contentType(final Path path) {
    final String name = path.getFileName().toString();
    final int dot = name.lastIndexOf('.');
    if (dot < 0) {
      return Optional.empty();
    }
    return Optional.ofNullable(CONTENT_TYPES.get(name.substring(dot + 1).toLowerCase(Locale.ROOT)));
  }

}
