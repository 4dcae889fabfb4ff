package tech.yump.logs.sanitize;

import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Produces the sanitized form of log text, one line at a time.
 *
 * <p>A line is sensitive when its lower-cased text contains any of
 * {@link #SENSITIVE_KEYWORDS} as a plain substring. This is a containment check,
 * not a tokenizer: "keyboard" and "monkey" match {@code key}, and keywords match in
 * field names and values alike.
 *
 * <p>A sensitive line is replaced by its first {@value #PREFIX_LENGTH} characters,
 * a space, {@value #MARKER}, a space and the SHA-256 hex digest of the whole original
 * line. A line shorter than the prefix length is kept in full before the marker, so
 * short sensitive lines still appear verbatim in the output.
 *
 * <p>Pure and deterministic; holds no state.
 */
@Component
public class RedactionEngine {

  public static final List<String> SENSITIVE_KEYWORDS = List.of("password", "token", "key", "secret");
  public static final int PREFIX_LENGTH = 24;
  public static final String MARKER = "[REDACTED]";

  private static final String LINE_SEPARATOR = "\n";

  /**
   * Sanitizes the whole content. Lines are split on {@code \n} and re-joined with it;
   * every line, including empty and trailing empty ones, keeps its position.
   *
   * @param content the log text. Must not be null.
   * @return the sanitized text
   */
  public String sanitize(String content) {
    if (content == null) {
      throw new IllegalArgumentException("Content to sanitize cannot be null.");
    }
    String[] lines = content.split(LINE_SEPARATOR, -1);
    StringBuilder out = new StringBuilder(content.length() + 32);
    for (int i = 0; i < lines.length; i++) {
      if (i > 0) {
        out.append(LINE_SEPARATOR);
      }
      out.append(decide(lines[i]).replacement());
    }
    return out.toString();
  }

  public RedactionDecision decide(String line) {
    if (!isSensitive(line)) {
      return RedactionDecision.keep(line);
    }
    return RedactionDecision.redact(prefixOf(line) + " " + MARKER + " " + DigestUtils.sha256Hex(line));
  }

  public boolean isSensitive(String line) {
    if (line == null || line.isEmpty()) {
      return false;
    }
    String lower = line.toLowerCase(Locale.ROOT);
    for (String keyword : SENSITIVE_KEYWORDS) {
      if (lower.contains(keyword)) {
        return true;
      }
    }
    return false;
  }

  // Counted in code points so a surrogate pair is never cut in half
  private String prefixOf(String line) {
    if (line.codePointCount(0, line.length()) <= PREFIX_LENGTH) {
      return line;
    }
    return line.substring(0, line.offsetByCodePoints(0, PREFIX_LENGTH));
  }
}
