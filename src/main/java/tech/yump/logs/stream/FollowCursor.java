package tech.yump.logs.stream;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Deque;

/**
 * Emits the current content of a local file, then keeps polling it for appended lines.
 *
 * <p>The first pass emits everything present, including an unterminated last line.
 * After that only complete lines are emitted; a partial line waits for its newline.
 * A file that shrinks is read again from the start; a deleted file is not noticed.
 * Every poll that finds nothing new is reported as idle. Following stops when the
 * cursor is closed, the thread is interrupted, the maximum follow duration elapses,
 * or a read fails.
 */
@Slf4j
public class FollowCursor extends LogEventCursor {

  private static final int CHUNK_SIZE = 4096;

  private final Path file;
  private final Duration pollInterval;
  private final Duration maxFollowDuration;
  private final LineBuffer lineBuffer = new LineBuffer();
  private final ByteBuffer buffer = ByteBuffer.allocate(CHUNK_SIZE);

  private FileChannel channel;
  private long position;
  private long observedSize;
  private boolean following;
  private Instant deadline;

  public FollowCursor(String fileName, boolean redacted, Clock clock, Path file,
                      Duration pollInterval, Duration maxFollowDuration) {
    super(fileName, redacted, clock);
    this.file = file;
    this.pollInterval = pollInterval;
    this.maxFollowDuration = maxFollowDuration;
  }

  @Override
  protected boolean fill(Deque<String> sink) throws IOException {
    if (channel == null) {
      channel = FileChannel.open(file, StandardOpenOption.READ);
    }

    int completed = readAvailable(sink);

    if (!following) {
      if (position < observedSize) {
        return true; // initial content not fully read yet
      }
      lineBuffer.drain().ifPresent(sink::addLast);
      following = true;
      deadline = clock().instant().plus(maxFollowDuration);
      log.debug("Initial content of '{}' read up to byte {}, now following", getFileName(), position);
      return true;
    }
    if (completed > 0) {
      return true;
    }
    if (!clock().instant().isBefore(deadline)) {
      log.info("Stopped following '{}' after the maximum follow duration of {}", getFileName(), maxFollowDuration);
      return false;
    }
    if (isClosed()) {
      return false;
    }
    try {
      Thread.sleep(pollInterval.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.debug("Follow of '{}' interrupted", getFileName());
      return false;
    }
    idle();
    return true;
  }

  /**
   * Reads from the current position towards the size observed now, stopping after the
   * first chunk that completes a line.
   */
  private int readAvailable(Deque<String> sink) throws IOException {
    long size = channel.size();
    if (size < position) {
      log.info("'{}' shrank from {} to {} bytes, reading it again from the start", getFileName(), position, size);
      position = 0;
      lineBuffer.reset();
    }
    observedSize = size;
    int completed = 0;
    while (position < size && completed == 0) {
      buffer.clear();
      int read = channel.read(buffer, position);
      if (read <= 0) {
        break;
      }
      position += read;
      completed += lineBuffer.append(buffer.array(), 0, read, sink::addLast);
    }
    return completed;
  }

  @Override
  protected void release() throws IOException {
    if (channel != null) {
      channel.close();
    }
  }
}
