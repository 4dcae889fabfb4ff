package tech.yump.logs.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventStreamEncoderTest {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private final EventStreamEncoder encoder = new EventStreamEncoder(objectMapper);

    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");

    @Test
    @DisplayName("encode: frame is 'data: ' + JSON + blank line, fields in fixed order")
    void encode_frameLayout() {
        StreamEvent event = StreamEvent.ofLine(NOW, "WARN disk \"almost\" full", true);

        String frame = encoder.encode(event);

        assertThat(frame).isEqualTo("data: {\"timestamp\":\"2024-01-01T12:00:00Z\",\"level\":\"warn\","
                + "\"message\":\"WARN disk \\\"almost\\\" full\",\"redacted\":true}\n\n");
    }

    @Test
    @DisplayName("encode: message with control characters stays on one line")
    void encode_escapesNewlines() throws Exception {
        String frame = encoder.encode(StreamEvent.ofLine(NOW, "a\tb\u0001", false));

        String json = frame.substring(EventStreamEncoder.DATA_PREFIX.length(), frame.length() - EventStreamEncoder.FRAME_END.length());
        assertThat(json).doesNotContain("\n");
        JsonNode node = objectMapper.readTree(json);
        assertThat(node.get("message").asText()).isEqualTo("a\tb\u0001");
        assertThat(node.get("redacted").asBoolean()).isFalse();
    }

    @Test
    @DisplayName("writeTo: writes UTF-8 bytes of the frame")
    void writeTo_writesUtf8() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        encoder.writeTo(StreamEvent.ofLine(NOW, "grüße", false), out);

        assertThat(out.toString(StandardCharsets.UTF_8)).contains("\"message\":\"grüße\"").endsWith("\n\n");
    }

    @Test
    @DisplayName("writeHeartbeat: writes a comment frame without data")
    void writeHeartbeat_writesCommentFrame() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        encoder.writeHeartbeat(out);

        assertThat(out.toString(StandardCharsets.UTF_8)).isEqualTo(": keepalive\n\n");
    }

    @Test
    @DisplayName("encode: null event is rejected")
    void encode_null_throws() {
        assertThatThrownBy(() -> encoder.encode(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
