package tech.yump.logs.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Encodes stream events as text/event-stream frames: {@code data: <json>} followed by
 * a blank line.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventStreamEncoder {

  public static final String DATA_PREFIX = "data: ";
  public static final String FRAME_END = "\n\n";
  public static final String HEARTBEAT = ": keepalive" + FRAME_END;

  private final ObjectMapper objectMapper;

  public String encode(StreamEvent event) {
    if (event == null) {
      throw new IllegalArgumentException("Stream event cannot be null.");
    }
    try {
      return DATA_PREFIX + objectMapper.writeValueAsString(event) + FRAME_END;
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize stream event to JSON: {}", event, e);
      throw new IllegalStateException("Failed to encode stream event", e);
    }
  }

  /**
   * Writes one frame and flushes it, so the client sees each line as soon as it is read.
   */
  public void writeTo(StreamEvent event, OutputStream out) throws IOException {
    out.write(encode(event).getBytes(StandardCharsets.UTF_8));
    out.flush();
  }

  /**
   * Writes a comment frame that clients ignore. Used to find out whether an idle client
   * is still connected.
   */
  public void writeHeartbeat(OutputStream out) throws IOException {
    out.write(HEARTBEAT.getBytes(StandardCharsets.UTF_8));
    out.flush();
  }
}
