package tech.yump.logs.stream;

import lombok.extern.slf4j.Slf4j;
import tech.yump.logs.storage.StorageException;

import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lazy, ordered sequence of {@link StreamEvent}s read from one stored log file.
 *
 * <p>Lines are pulled from the source only when {@link #hasNext()} needs them. Blank
 * lines are skipped. A read failure ends the sequence with a single
 * {@link LogLevel#ERROR} event describing it. {@link #close()} may be called from any
 * thread; the sequence then ends at the next check without an error event.
 *
 * <p>Sources that wait for more data report each empty wait to the {@link IdleListener},
 * if one is set. A listener that fails closes the cursor.
 *
 * <p>Not restartable: reading the file again requires a new cursor.
 */
@Slf4j
public abstract class LogEventCursor implements Iterator<StreamEvent>, Closeable {

  /**
   * Called on the reading thread while the source has nothing new to emit.
   */
  @FunctionalInterface
  public interface IdleListener {
    void onIdle() throws IOException;
  }

  private final String fileName;
  private final boolean redacted;
  private final Clock clock;

  private final Deque<String> lines = new ArrayDeque<>();
  private final AtomicBoolean released = new AtomicBoolean();

  private IdleListener idleListener;
  private StreamEvent next;
  private boolean idle;
  private boolean exhausted;
  private boolean finished;
  private volatile boolean closed;

  protected LogEventCursor(String fileName, boolean redacted, Clock clock) {
    this.fileName = fileName;
    this.redacted = redacted;
    this.clock = clock;
  }

  /**
   * Reads more of the source, adding completed lines to {@code sink} in file order.
   * May block.
   *
   * @return false once the source is exhausted and no more lines will follow
   */
  protected abstract boolean fill(Deque<String> sink) throws IOException;

  /**
   * Releases the underlying source. Called at most once.
   */
  protected abstract void release() throws IOException;

  @Override
  public boolean hasNext() {
    while (next == null && !finished) {
      String line = lines.pollFirst();
      if (line != null) {
        String message = line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
        if (!message.isBlank()) {
          next = StreamEvent.ofLine(clock.instant(), message, redacted);
        }
        continue;
      }
      if (exhausted || closed) {
        finish();
        break;
      }
      try {
        exhausted = !fill(lines);
        if (idle) {
          idle = false;
          notifyIdle();
        }
      } catch (IOException | StorageException e) {
        if (closed) {
          log.debug("Read of '{}' interrupted by close: {}", fileName, e.getMessage());
        } else {
          log.error("I/O failure while streaming '{}': {}", fileName, e.getMessage(), e);
          next = StreamEvent.error(clock.instant(), "Error reading file: " + describe(e), redacted);
        }
        lines.clear();
        finish();
      }
    }
    return next != null;
  }

  @Override
  public StreamEvent next() {
    if (!hasNext()) {
      throw new NoSuchElementException("No more events for " + fileName);
    }
    StreamEvent event = next;
    next = null;
    return event;
  }

  @Override
  public void close() {
    closed = true;
    releaseOnce();
  }

  public void setIdleListener(IdleListener idleListener) {
    this.idleListener = idleListener;
  }

  public boolean isClosed() {
    return closed;
  }

  public String getFileName() {
    return fileName;
  }

  protected Clock clock() {
    return clock;
  }

  /**
   * Marks the last {@link #fill} as a wait that produced nothing.
   */
  protected void idle() {
    idle = true;
  }

  private void notifyIdle() {
    if (idleListener == null || closed) {
      return;
    }
    try {
      idleListener.onIdle();
    } catch (IOException e) {
      log.info("Client of '{}' went away while the stream was idle: {}", fileName, e.getMessage());
      close();
    }
  }

  private void finish() {
    finished = true;
    releaseOnce();
  }

  private void releaseOnce() {
    if (released.compareAndSet(false, true)) {
      try {
        release();
      } catch (IOException e) {
        log.warn("Failed to release source of '{}': {}", fileName, e.getMessage());
      }
    }
  }

  private static String describe(Exception e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }
}
