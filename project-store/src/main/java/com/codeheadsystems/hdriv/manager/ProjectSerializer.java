package com.codeheadsystems.hdriv.manager;

import com.codeheadsystems.api.hdriv.v1.HdriEntry;
import com.codeheadsystems.api.hdriv.v1.ProjectFile;
import com.codeheadsystems.api.hdriv.v1.TextureEntry;
import com.codeheadsystems.envelope.encryption.EnvelopeCipher;
import com.codeheadsystems.envelope.exception.EncryptionException;
import com.codeheadsystems.hdriv.converter.ProjectConverter;
import com.codeheadsystems.hdriv.dagger.HdrivModule;
import com.codeheadsystems.hdriv.model.Asset;
import com.codeheadsystems.hdriv.model.AssetSlot;
import com.codeheadsystems.hdriv.model.NormalizedProject;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The type Project serializer.
 * <p>
 * Writes a project as a current version document. All assets are encrypted in parallel on the
 * asset executor; if any one fails, no document is produced.
 */
@Singleton
public class ProjectSerializer {

  private static final Logger log = LoggerFactory.getLogger(ProjectSerializer.class);

  private final EnvelopeCipher envelopeCipher;
  private final ProjectConverter projectConverter;
  private final ObjectMapper objectMapper;
  private final Executor executor;

  /**
   * Instantiates a new Project serializer.
   *
   * @param envelopeCipher   the envelope cipher
   * @param projectConverter the project converter
   * @param objectMapper     the object mapper
   * @param executor         the executor assets are encrypted on
   */
  @Inject
  public ProjectSerializer(final EnvelopeCipher envelopeCipher,
                           final ProjectConverter projectConverter,
                           final ObjectMapper objectMapper,
                           @Named(HdrivModule.ASSET_EXECUTOR) final Executor executor) {
    log.info("ProjectSerializer({}, {}, {})", envelopeCipher, projectConverter, objectMapper);
    this.envelopeCipher = envelopeCipher;
    this.projectConverter = projectConverter;
    this.objectMapper = objectMapper;
    this.executor = executor;
  }

  /**
   * Serialize project file.
   *
   * @param project the project
   * @return the project file
   * @throws EncryptionException if any asset cannot be encrypted
   */
  public ProjectFile serialize(final NormalizedProject project) {
    log.trace("serialize({} hdris)", project.hdris().size());
    final List<CompletableFuture<HdriEntry>> hdris = new ArrayList<>();
    for (Asset hdri : project.hdris()) {
      hdris.add(CompletableFuture.supplyAsync(
          () -> projectConverter.toHdriEntry(hdri, envelopeCipher.encryptPayload(hdri.bytes())), executor));
    }
    final Map<AssetSlot, CompletableFuture<TextureEntry>> textures = new EnumMap<>(AssetSlot.class);
    projectConverter.textures(project.materials()).forEach((slot, texture) ->
        textures.put(slot, CompletableFuture.supplyAsync(
            () -> projectConverter.toTextureEntry(texture, envelopeCipher.encryptPayload(texture.bytes())), executor)));

    final List<CompletableFuture<?>> all = new ArrayList<>(hdris);
    all.addAll(textures.values());
    try {
      CompletableFuture.allOf(all.toArray(new CompletableFuture<?>[0])).join();
    } catch (CompletionException e) {
      final Throwable cause = e.getCause() == null ? e : e.getCause();
      log.error("serialize: asset encryption failed, nothing written", cause);
      if (cause instanceof EncryptionException) {
        throw (EncryptionException) cause;
      }
      throw new EncryptionException("Failed to encrypt project assets", cause);
    }

    final List<HdriEntry> hdriEntries = new ArrayList<>();
    hdris.forEach(future -> hdriEntries.add(future.join()));
    final Map<AssetSlot, TextureEntry> textureEntries = new EnumMap<>(AssetSlot.class);
    textures.forEach((slot, future) -> textureEntries.put(slot, future.join()));
    return projectConverter.toProjectFile(project, hdriEntries, textureEntries);
  }

  /**
   * Serialize to json string.
   *
   * @param project the project
   * @return the json text
   */
  public String serializeToJson(final NormalizedProject project) {
    log.trace("serializeToJson()");
    final ProjectFile projectFile = serialize(project);
    try {
      return objectMapper.writeValueAsString(projectFile);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to write project document", e);
    }
  }

}
