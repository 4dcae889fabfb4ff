package tech.yump.logs.stream;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Severity attached to a stream event.
 */
public enum LogLevel {

  TRACE, DEBUG, INFO, WARN, ERROR, FATAL;

  // Upper-case whole words only, so prose like "information" or "error-free" stays INFO
  private static final Pattern LEVEL_TOKEN =
          Pattern.compile("\\b(TRACE|DEBUG|INFO|WARNING|WARN|ERROR|SEVERE|FATAL|CRITICAL)\\b");

  /**
   * Detects the level from the first level token found in the line.
   * Lines without one are {@link #INFO}.
   */
  public static LogLevel detect(String line) {
    if (line == null || line.isEmpty()) {
      return INFO;
    }
    Matcher matcher = LEVEL_TOKEN.matcher(line);
    if (!matcher.find()) {
      return INFO;
    }
    return switch (matcher.group(1)) {
      case "TRACE" -> TRACE;
      case "DEBUG" -> DEBUG;
      case "WARN", "WARNING" -> WARN;
      case "ERROR", "SEVERE" -> ERROR;
      case "FATAL", "CRITICAL" -> FATAL;
      default -> INFO;
    };
  }

  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
