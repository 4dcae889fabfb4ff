package tech.yump.logs.stream;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.Deque;

/**
 * Reads the content once from an opened stream and ends when the stream does.
 * The source is opened lazily, on the first read, so opening failures surface as
 * an in-band error event.
 */
public class SnapshotCursor extends LogEventCursor {

  /**
   * Opens the content to read. Called at most once.
   */
  @FunctionalInterface
  public interface ContentSource {
    InputStream open() throws IOException;
  }

  private static final int CHUNK_SIZE = 4096;

  private final ContentSource source;
  private final LineBuffer lineBuffer = new LineBuffer();
  private final byte[] buffer = new byte[CHUNK_SIZE];

  private InputStream in;

  public SnapshotCursor(String fileName, boolean redacted, Clock clock, ContentSource source) {
    super(fileName, redacted, clock);
    this.source = source;
  }

  @Override
  protected boolean fill(Deque<String> sink) throws IOException {
    if (in == null) {
      in = source.open();
    }
    int read;
    while ((read = in.read(buffer)) != -1) {
      if (lineBuffer.append(buffer, 0, read, sink::addLast) > 0) {
        return true;
      }
    }
    lineBuffer.drain().ifPresent(sink::addLast);
    return false;
  }

  @Override
  protected void release() throws IOException {
    if (in != null) {
      in.close();
    }
  }
}
