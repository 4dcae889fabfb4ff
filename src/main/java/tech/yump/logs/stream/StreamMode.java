package tech.yump.logs.stream;

public enum StreamMode {
  /** Read the content once, emit every non-blank line, finish. */
  SNAPSHOT,
  /** Emit the current content, then keep emitting lines appended to the file. */
  FOLLOW;

  public static StreamMode of(boolean follow) {
    return follow ? FOLLOW : SNAPSHOT;
  }
}
