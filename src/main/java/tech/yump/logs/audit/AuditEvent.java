package tech.yump.logs.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * A single audit log entry: who did what to which log file, and how it ended.
 * Serialized as one JSON object per line.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEvent(
        Instant timestamp,
        String type,            // e.g. "log_ingest", "log_read", "auth"
        String action,          // e.g. "upload", "stream", "api_key_check"
        String outcome,         // "success" or "failure"
        AuthInfo authInfo,
        RequestInfo requestInfo,
        ResponseInfo responseInfo,
        Map<String, Object> data
) {

    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record AuthInfo(
            String principal,     // "api-key" when the write key was accepted, otherwise "anonymous"
            String sourceAddress
    ) {}

    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RequestInfo(
            String requestId,
            String httpMethod,
            String path,
            Map<String, String> headers // non-sensitive only, never the API key
    ) {}

    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ResponseInfo(
            int statusCode,
            String errorMessage
    ) {}
}
