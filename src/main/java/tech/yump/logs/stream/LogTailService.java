package tech.yump.logs.stream;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.yump.logs.config.LiteLogsProperties;
import tech.yump.logs.model.StoredLog;
import tech.yump.logs.storage.StorageBackend;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;

/**
 * Turns a stored log file into a sequence of stream events and pumps them to a client.
 *
 * <p>Follow mode needs a local file to poll; on backends without one the read is
 * served as a snapshot.
 */
@Slf4j
@Service
public class LogTailService {

  private final StorageBackend storageBackend;
  private final EventStreamEncoder encoder;
  private final LiteLogsProperties.StreamProperties streamProperties;
  private final Clock clock;

  public LogTailService(StorageBackend storageBackend,
                        EventStreamEncoder encoder,
                        LiteLogsProperties properties,
                        Clock clock) {
    this.storageBackend = storageBackend;
    this.encoder = encoder;
    this.streamProperties = properties.stream();
    this.clock = clock;
  }

  /**
   * Opens a lazy cursor over the file. Nothing is read until the cursor is iterated.
   */
  public LogEventCursor open(StoredLog storedLog, StreamMode mode) {
    boolean redacted = storedLog.redacted();
    if (mode == StreamMode.FOLLOW) {
      Optional<Path> localFile = storageBackend.localFile(storedLog.container(), storedLog.name());
      if (localFile.isPresent()) {
        log.debug("Opening follow cursor for '{}' at {}", storedLog.name(), localFile.get());
        return new FollowCursor(storedLog.name(), redacted, clock, localFile.get(),
                streamProperties.pollInterval(), streamProperties.maxFollowDuration());
      }
      log.debug("Backend '{}' has no local file for '{}', serving a snapshot instead of following",
              storageBackend.type(), storedLog.name());
    }
    log.debug("Opening snapshot cursor for '{}'", storedLog.name());
    return new SnapshotCursor(storedLog.name(), redacted, clock,
            () -> storageBackend.openStream(storedLog.container(), storedLog.name())
                    .orElseThrow(() -> new NoSuchFileException(storedLog.name(), null, "file no longer exists")));
  }

  /**
   * Writes every event of the cursor to {@code out} as it becomes available, then closes
   * the cursor. While the cursor is idle a heartbeat is written instead. A write failure
   * means the client went away: the cursor is closed and the method returns normally.
   *
   * @return the number of frames written
   */
  public long pump(LogEventCursor cursor, OutputStream out) {
    long frames = 0;
    cursor.setIdleListener(() -> encoder.writeHeartbeat(out));
    try (cursor) {
      while (cursor.hasNext()) {
        encoder.writeTo(cursor.next(), out);
        frames++;
      }
      log.debug("Stream of '{}' completed after {} frames", cursor.getFileName(), frames);
    } catch (IOException e) {
      log.info("Client disconnected from stream of '{}' after {} frames: {}", cursor.getFileName(), frames, e.getMessage());
    }
    return frames;
  }
}
