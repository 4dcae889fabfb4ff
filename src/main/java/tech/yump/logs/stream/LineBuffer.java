package tech.yump.logs.stream;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Splits a byte stream into {@code \n}-terminated lines. Works on bytes so a
 * multi-byte UTF-8 character split across two reads is decoded whole.
 */
class LineBuffer {

  private static final byte NEWLINE = '\n';

  private final ByteArrayOutputStream partial = new ByteArrayOutputStream();

  /**
   * Appends bytes and hands every line completed by them to {@code sink}, without the
   * terminating newline.
   *
   * @return the number of completed lines
   */
  int append(byte[] buffer, int offset, int length, Consumer<String> sink) {
    int completed = 0;
    int start = offset;
    int end = offset + length;
    for (int i = offset; i < end; i++) {
      if (buffer[i] == NEWLINE) {
        partial.write(buffer, start, i - start);
        sink.accept(partial.toString(StandardCharsets.UTF_8));
        partial.reset();
        start = i + 1;
        completed++;
      }
    }
    if (start < end) {
      partial.write(buffer, start, end - start);
    }
    return completed;
  }

  /**
   * Returns and clears the unterminated remainder, if any.
   */
  Optional<String> drain() {
    if (partial.size() == 0) {
      return Optional.empty();
    }
    String rest = partial.toString(StandardCharsets.UTF_8);
    partial.reset();
    return Optional.of(rest);
  }

  boolean hasPartial() {
    return partial.size() > 0;
  }

  void reset() {
    partial.reset();
  }
}
