package com.sessionradar.dashboard.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/** Reads {@code <directory>/<name>.json}, the layout produced by the ingester's file backend. */
public class FileDocumentReader implements DocumentReader {
  private final Path directory;
  private final ObjectMapper objectMapper;

  public FileDocumentReader(Path directory, ObjectMapper objectMapper) {
    this.directory = directory;
    this.objectMapper = objectMapper;
  }

  @Override
  public <T> Optional<T> read(String name, Class<T> type) {
    Path file = directory.resolve(name + ".json");
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(objectMapper.readValue(file.toFile(), type));
    } catch (IOException ex) {
      throw new StoreReadException("Unable to read document " + file, ex);
    }
  }

  @Override
  public String describe() {
    return "file:" + directory.toAbsolutePath();
  }
}
