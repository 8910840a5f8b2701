package com.sessionradar.ingester.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores each document as {@code <directory>/<name>.json}.
 *
 * <p>Writes go to a temporary file in the same directory and are then moved over the target, so
 * readers see either the previous or the new document and never a partial one.
 */
public class FileDocumentStore implements DocumentStore {
  private static final Logger log = LoggerFactory.getLogger(FileDocumentStore.class);

  private final Path directory;
  private final ObjectMapper objectMapper;

  public FileDocumentStore(Path directory, ObjectMapper objectMapper) {
    this.directory = directory;
    this.objectMapper = objectMapper;
  }

  @Override
  public <T> Optional<T> read(String name, Class<T> type) {
    Path file = fileFor(name);
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(objectMapper.readValue(file.toFile(), type));
    } catch (IOException ex) {
      log.error("Unable to read document {} from {}", name, file, ex);
      return Optional.empty();
    }
  }

  @Override
  public void write(String name, Object document) {
    Path target = fileFor(name);
    Path tmp = null;
    try {
      Files.createDirectories(directory);
      tmp = Files.createTempFile(directory, name + "-", ".json.tmp");
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), document);
      try {
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException ex) {
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException ex) {
      deleteQuietly(tmp);
      throw new StoreIoException("Failed to write document " + target, ex);
    }
  }

  @Override
  public String describe() {
    return "file:" + directory.toAbsolutePath();
  }

  Path fileFor(String name) {
    return directory.resolve(name + ".json");
  }

  private void deleteQuietly(Path tmp) {
    if (tmp == null) {
      return;
    }
    try {
      Files.deleteIfExists(tmp);
    } catch (IOException ex) {
      log.debug("Unable to delete temporary file {}", tmp, ex);
    }
  }
}
