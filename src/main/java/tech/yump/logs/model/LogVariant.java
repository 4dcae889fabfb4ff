package tech.yump.logs.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The two stored forms of an ingested log file. The variant of a file is decided
 * by its name alone: sanitized copies carry the {@code .sanitized} suffix.
 */
public enum LogVariant {

  ORIGINAL,
  SANITIZED;

  public static final String SANITIZED_SUFFIX = ".sanitized";

  public static LogVariant fromFileName(String fileName) {
    return isSanitizedName(fileName) ? SANITIZED : ORIGINAL;
  }

  public static boolean isSanitizedName(String fileName) {
    return fileName != null && fileName.endsWith(SANITIZED_SUFFIX);
  }

  public static String sanitizedNameOf(String originalName) {
    return originalName + SANITIZED_SUFFIX;
  }

  /**
   * Strips the sanitized suffix, if present.
   */
  public static String originalNameOf(String fileName) {
    return isSanitizedName(fileName)
            ? fileName.substring(0, fileName.length() - SANITIZED_SUFFIX.length())
            : fileName;
  }

  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
