package tech.yump.logs.stream;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;

/**
 * One event of a log stream. Created right before it is encoded and written,
 * never stored.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"timestamp", "level", "message", "redacted"})
public record StreamEvent(
        Instant timestamp,      // wall clock at emission, not the time inside the file
        LogLevel level,
        String message,
        Boolean redacted        // true when read from a sanitized copy
) {

    public static StreamEvent ofLine(Instant now, String line, boolean redacted) {
        return new StreamEvent(now, LogLevel.detect(line), line, redacted);
    }

    public static StreamEvent error(Instant now, String message, boolean redacted) {
        return new StreamEvent(now, LogLevel.ERROR, message, redacted);
    }
}
