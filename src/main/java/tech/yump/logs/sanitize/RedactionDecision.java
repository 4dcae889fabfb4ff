package tech.yump.logs.sanitize;

/**
 * Per-line outcome of the redaction policy. Never persisted.
 *
 * @param sensitive   whether the line matched a sensitive keyword
 * @param replacement the text to emit in place of the line; the line itself when not sensitive
 */
public record RedactionDecision(boolean sensitive, String replacement) {

  public static RedactionDecision keep(String line) {
    return new RedactionDecision(false, line);
  }

  public static RedactionDecision redact(String replacement) {
    return new RedactionDecision(true, replacement);
  }
}
