package com.beobachter.paper.journal;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Last known ledger totals, rewritten with write-temp-then-rename so readers never see a
 * partial file.
 */
public class CapitalSnapshotStore {

  private final Path path;
  private final ObjectMapper objectMapper;

  public CapitalSnapshotStore(Path path, ObjectMapper objectMapper) {
    this.path = path;
    this.objectMapper = objectMapper;
  }

  public synchronized void write(CapitalSnapshot snapshot) {
    try {
      Path dir = path.toAbsolutePath().getParent();
      if (dir != null) {
        Files.createDirectories(dir);
      }
      Path tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
      try {
        objectMapper.writeValue(tmp.toFile(), snapshot);
        try {
          Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
          Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
      } finally {
        Files.deleteIfExists(tmp);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("cannot write capital snapshot " + path, e);
    }
  }

  public Optional<CapitalSnapshot> read() {
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(path.toFile(), CapitalSnapshot.class));
    } catch (IOException e) {
      throw new UncheckedIOException("cannot read capital snapshot " + path, e);
    }
  }

  public Path path() {
    return path;
  }
}
