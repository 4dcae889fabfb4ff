package tech.yump.logs.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.logs.audit.AuditBackend;
import tech.yump.logs.audit.FileAuditBackend;
import tech.yump.logs.audit.LogAuditBackend;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class AuditConfiguration {

    public static final String BACKEND_PROPERTY = "litelogs.audit.backend";

    private final ObjectMapper objectMapper;

    @Bean
    @ConditionalOnProperty(name = BACKEND_PROPERTY, havingValue = "slf4j", matchIfMissing = true)
    public AuditBackend logAuditBackend() {
        log.info("Configuring SLF4j Audit Backend");
        return new LogAuditBackend(objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = BACKEND_PROPERTY, havingValue = "file")
    public AuditBackend fileAuditBackend() {
        // The file path is read by Logback directly, not injected here
        log.info("Configuring File Audit Backend. Ensure Logback is configured correctly for logger '{}' and path property '{}'.",
                FileAuditBackend.AUDIT_LOGGER_NAME, LiteLogsProperties.AuditProperties.FileAuditProperties.PATH_PROPERTY);
        return new FileAuditBackend(objectMapper);
    }
}
