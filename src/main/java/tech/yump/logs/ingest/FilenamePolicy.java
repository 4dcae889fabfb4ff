package tech.yump.logs.ingest;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import tech.yump.logs.config.LiteLogsProperties;
import tech.yump.logs.model.LogVariant;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides which file names may be stored and read.
 *
 * <p>Uploaded names are normalized first: only the last path segment is kept, runs of
 * whitespace become {@code _}, characters outside {@code [A-Za-z0-9._-]} are dropped,
 * and leading or trailing dots and underscores are stripped. The result must be
 * non-empty, must not use the reserved {@value LogVariant#SANITIZED_SUFFIX} suffix and
 * must end with an allowed extension (case-insensitive).
 */
@Slf4j
@Component
public class FilenamePolicy {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern DISALLOWED_CHARS = Pattern.compile("[^A-Za-z0-9._-]");
  private static final Pattern EDGE_DOTS_UNDERSCORES = Pattern.compile("^[._]+|[._]+$");

  private final List<String> allowedExtensions;

  public FilenamePolicy(LiteLogsProperties properties) {
    this.allowedExtensions = properties.upload().allowedExtensions();
  }

  /**
   * Normalizes a client-supplied name. Never returns null; the result may be empty.
   */
  public static String secureFilename(String rawName) {
    if (rawName == null) {
      return "";
    }
    String name = rawName;
    int lastSeparator = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
    if (lastSeparator >= 0) {
      name = name.substring(lastSeparator + 1);
    }
    name = WHITESPACE.matcher(name.strip()).replaceAll("_");
    name = DISALLOWED_CHARS.matcher(name).replaceAll("");
    return EDGE_DOTS_UNDERSCORES.matcher(name).replaceAll("");
  }

  /**
   * Validates an uploaded file name and returns the name it will be stored under.
   *
   * @throws LogValidationException if the name cannot be stored
   */
  public String validateUpload(String rawName) {
    if (!StringUtils.hasText(rawName)) {
      throw new LogValidationException("No file selected.");
    }
    String name = secureFilename(rawName);
    if (name.isEmpty()) {
      throw new LogValidationException("File name '" + rawName + "' contains no usable characters.");
    }
    if (name.contains("..")) {
      throw new LogValidationException("File name '" + rawName + "' must not contain '..'.");
    }
    if (LogVariant.isSanitizedName(name)) {
      throw new LogValidationException("File names ending in '" + LogVariant.SANITIZED_SUFFIX + "' are reserved.");
    }
    requireAllowedExtension(name);
    if (!name.equals(rawName)) {
      log.debug("Normalized upload name '{}' to '{}'", rawName, name);
    }
    return name;
  }

  /**
   * Validates a name used to read a stored file. Both variants are accepted, but the
   * name must already be in normalized form.
   *
   * @throws LogValidationException if the name is unsafe or has a disallowed extension
   */
  public String validateStoredName(String name) {
    if (!StringUtils.hasText(name) || !name.equals(secureFilename(name)) || name.contains("..")) {
      throw new LogValidationException("Invalid log file name: '" + name + "'.");
    }
    requireAllowedExtension(LogVariant.originalNameOf(name));
    return name;
  }

  public boolean isAllowedExtension(String name) {
    String lower = name.toLowerCase(Locale.ROOT);
    return allowedExtensions.stream().anyMatch(ext -> lower.endsWith(ext) && lower.length() > ext.length());
  }

  public List<String> getAllowedExtensions() {
    return allowedExtensions;
  }

  private void requireAllowedExtension(String name) {
    if (!isAllowedExtension(name)) {
      throw new LogValidationException("File type not allowed. Allowed extensions: " + String.join(", ", allowedExtensions));
    }
  }
}
