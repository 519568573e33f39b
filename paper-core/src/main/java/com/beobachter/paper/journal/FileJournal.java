package com.beobachter.paper.journal;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON Lines journal. Each append is written and forced to disk before it returns.
 *
 * <p>A failed write is truncated back to the previous end of file and retried with bounded
 * backoff. When every attempt fails the caller gets a {@link JournalWriteException}.
 */
@Slf4j
public class FileJournal implements Journal, Closeable {

  private final Path path;
  private final ObjectMapper objectMapper;
  private final RetryPolicy retry;
  private final FileChannel channel;

  private long lastSequence;

  public FileJournal(Path path, ObjectMapper objectMapper, RetryPolicy retry) {
    this.path = path;
    this.objectMapper = objectMapper;
    this.retry = retry;
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      this.channel = FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
          StandardOpenOption.READ);
      this.channel.position(channel.size());
    } catch (IOException e) {
      throw new UncheckedIOException("cannot open journal " + path, e);
    }
    List<JournalEntry> existing = readAll();
    this.lastSequence = existing.isEmpty() ? 0 : existing.get(existing.size() - 1).sequence();
    log.info("journal opened: path={} entries={} lastSequence={}", path, existing.size(), lastSequence);
  }

  @Override
  public synchronized JournalEntry append(JournalEntry entry) {
    JournalEntry sequenced = entry.withSequence(lastSequence + 1);
    byte[] line;
    try {
      line = (objectMapper.writeValueAsString(sequenced) + "\n").getBytes(StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new JournalWriteException("cannot encode journal entry " + sequenced.sequence(), e);
    }

    IOException last = null;
    for (int attempt = 1; attempt <= retry.maxAttempts(); attempt++) {
      long start = -1;
      try {
        start = channel.size();
        ByteBuffer buffer = ByteBuffer.wrap(line);
        channel.position(start);
        while (buffer.hasRemaining()) {
          channel.write(buffer);
        }
        channel.force(true);
        lastSequence = sequenced.sequence();
        return sequenced;
      } catch (IOException e) {
        last = e;
        truncateQuietly(start);
        log.warn("journal write attempt {}/{} failed for seq={}: {}",
            attempt, retry.maxAttempts(), sequenced.sequence(), e.getMessage());
        if (attempt < retry.maxAttempts() && !sleep(retry.backoffMillis(attempt))) {
          break;
        }
      }
    }
    throw new JournalWriteException("journal write failed after retries at seq=" + sequenced.sequence(), last);
  }

  @Override
  public synchronized List<JournalEntry> readAll() {
    List<JournalEntry> entries = new ArrayList<>();
    List<String> lines;
    try {
      lines = Files.readAllLines(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("cannot read journal " + path, e);
    }
    for (String line : lines) {
      if (line.isBlank()) {
        continue;
      }
      try {
        entries.add(objectMapper.readValue(line, JournalEntry.class));
      } catch (IOException e) {
        throw new UncheckedIOException("corrupt journal line " + (entries.size() + 1) + " in " + path, e);
      }
    }
    return entries;
  }

  @Override
  public synchronized long lastSequence() {
    return lastSequence;
  }

  public Path path() {
    return path;
  }

  @Override
  public synchronized void close() throws IOException {
    channel.close();
  }

  private void truncateQuietly(long size) {
    if (size < 0) {
      return;
    }
    try {
      channel.truncate(size);
    } catch (IOException e) {
      log.warn("journal truncate to {} failed: {}", size, e.getMessage());
    }
  }

  private static boolean sleep(long millis) {
    if (millis <= 0) {
      return true;
    }
    try {
      Thread.sleep(millis);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
