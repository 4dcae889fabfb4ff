package tech.yump.logs.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes audit events as JSON lines through a dedicated logger. logback-spring.xml
 * routes that logger to the audit file only.
 */
@RequiredArgsConstructor
@Slf4j
public class FileAuditBackend implements AuditBackend {

    public static final String AUDIT_LOGGER_NAME = "tech.yump.logs.audit.FILE_AUDIT";
    private static final Logger auditLogger = LoggerFactory.getLogger(AUDIT_LOGGER_NAME);

    private final ObjectMapper objectMapper;

    @Override
    public void logEvent(AuditEvent event) {
        if (event == null) {
            log.warn("Attempted to log a null audit event.");
            return;
        }

        try {
            auditLogger.info(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            // Serialization errors go to the application log so the audit file stays valid JSON lines
            log.error("Failed to serialize AuditEvent to JSON for file audit logging. Event: {}", event, e);
        }
    }
}
