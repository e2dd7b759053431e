package com.codeheadsystems.hdriv.manager;

import com.codeheadsystems.api.hdriv.v1.PresetFile;
import com.codeheadsystems.hdriv.converter.PresetCodec;
import com.codeheadsystems.hdriv.model.LoadResult;
import com.codeheadsystems.hdriv.model.NormalizedProject;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Saves and opens project and preset files. Saves go to a temporary file next to the target
 * that is then moved into place, so a failed save leaves the old file untouched.
 */
@Singleton
public class ProjectFileManager {

  private static final Logger log = LoggerFactory.getLogger(ProjectFileManager.class);

  private final ProjectSerializer projectSerializer;
  private final ProjectLoader projectLoader;
  private final PresetCodec presetCodec;

  /**
   * Instantiates a new Project file manager.
   *
   * @param projectSerializer the project serializer
   * @param projectLoader     the project loader
   * @param presetCodec       the preset codec
   */
  @Inject
  public ProjectFileManager(final ProjectSerializer projectSerializer,
                            final ProjectLoader projectLoader,
                            final PresetCodec presetCodec) {
    log.info("ProjectFileManager({}, {}, {})", projectSerializer, projectLoader, presetCodec);
    this.projectSerializer = projectSerializer;
    this.projectLoader = projectLoader;
    this.presetCodec = presetCodec;
  }

  /**
   * Save a project.
   *
   * @param project the project
   * @param target  the target file
   * @throws IOException if the file cannot be written
   */
  public void save(final NormalizedProject project, final Path target) throws IOException {
    log.trace("save({})", target);
    write(projectSerializer.serializeToJson(project), target);
  }

  /**
   * Open a project.
   *
   * @param path the path
   * @return the load result
   * @throws IOException if the file cannot be read
   */
  public LoadResult open(final Path path) throws IOException {
    log.trace("open({})", path);
    return projectLoader.load(Files.readString(path, StandardCharsets.UTF_8));
  }

  /**
   * Save preset.
   *
   * @param presetFile the preset file
   * @param target     the target
   * @throws IOException if the file cannot be written
   */
  public void savePreset(final PresetFile presetFile, final Path target) throws IOException {
    log.trace("savePreset({})", target);
    write(presetCodec.write(presetFile), target);
  }

  /**
   * Open preset.
   *
   * @param path the path
   * @return the preset file
   * @throws IOException if the file cannot be read
   */
  public PresetFile openPreset(final Path path) throws IOException {
    log.trace("openPreset({})", path);
    return presetCodec.read(Files.readString(path, StandardCharsets.UTF_8));
  }

  private void write(final String text, final Path target) throws IOException {
    final Path absolute = target.toAbsolutePath();
    final Path temp = Files.createTempFile(absolute.getParent(), absolute.getFileName().toString(), ".tmp");
    try {
      Files.writeString(temp, text, StandardCharsets.UTF_8);
      try {
        Files.move(temp, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        log.warn("Atomic move not supported for {}, replacing", absolute);
        Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(temp);
    }
  }

}
