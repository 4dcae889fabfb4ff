package tech.yump.logs.audit;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import tech.yump.logs.auth.ApiKeyAuthFilter;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Slf4j
public class AuditHelper {

    static final String ANONYMOUS = "anonymous";
    static final String SYSTEM = "system";

    private final AuditBackend auditBackend;

    /**
     * Logs an audit event for the outcome of the current HTTP request.
     * Authentication and request context are gathered when available.
     *
     * @param type         The type of event (e.g., "log_ingest", "log_read").
     * @param action       The specific action performed (e.g., "upload", "stream").
     * @param outcome      The result ("success" or "failure").
     * @param statusCode   The HTTP status code associated with the outcome.
     * @param errorMessage Optional error message (for failures).
     * @param data         Optional map containing context-specific data.
     */
    public void logHttpEvent(
            String type,
            String action,
            String outcome,
            int statusCode,
            @Nullable String errorMessage,
            @Nullable Map<String, Object> data) {

        HttpServletRequest request = getCurrentHttpRequest();
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        AuditEvent.AuthInfo authInfo = AuditEvent.AuthInfo.builder()
                .principal(principalOf(authentication, ANONYMOUS))
                .sourceAddress(request != null ? request.getRemoteAddr() : "unknown")
                .build();
        AuditEvent.ResponseInfo responseInfo = AuditEvent.ResponseInfo.builder()
                .statusCode(statusCode)
                .errorMessage(errorMessage)
                .build();

        logEventInternal(type, action, outcome, authInfo, buildRequestInfo(request), responseInfo, data);
    }

    /**
     * Logs an audit event that is not tied to a response, such as the end of a stream
     * running on a worker thread.
     *
     * @param principal Optional principal; falls back to the security context, then "system".
     */
    public void logInternalEvent(
            String type,
            String action,
            String outcome,
            @Nullable String principal,
            @Nullable Map<String, Object> data) {

        String effectivePrincipal = Optional.ofNullable(principal)
                .orElseGet(() -> principalOf(SecurityContextHolder.getContext().getAuthentication(), SYSTEM));

        AuditEvent.AuthInfo authInfo = AuditEvent.AuthInfo.builder()
                .principal(effectivePrincipal)
                .build();

        logEventInternal(type, action, outcome, authInfo, null, null, data);
    }

    /**
     * Builds the request part of an audit event. Shared with the auth filter, which audits
     * before the request reaches a handler.
     */
    @Nullable
    public static AuditEvent.RequestInfo buildRequestInfo(@Nullable HttpServletRequest request) {
        if (request == null) {
            return null;
        }
        return AuditEvent.RequestInfo.builder()
                .requestId((String) request.getAttribute(ApiKeyAuthFilter.REQUEST_ID_ATTR))
                .httpMethod(request.getMethod())
                .path(request.getRequestURI())
                .headers(Map.of("User-Agent", Optional.ofNullable(request.getHeader("User-Agent")).orElse("N/A")))
                .build();
    }

    private void logEventInternal(
            String type,
            String action,
            String outcome,
            @Nullable AuditEvent.AuthInfo authInfo,
            @Nullable AuditEvent.RequestInfo requestInfo,
            @Nullable AuditEvent.ResponseInfo responseInfo,
            @Nullable Map<String, Object> data) {
        try {
            AuditEvent auditEvent = AuditEvent.builder()
                    .timestamp(Instant.now())
                    .type(type)
                    .action(action)
                    .outcome(outcome)
                    .authInfo(authInfo)
                    .requestInfo(requestInfo)
                    .responseInfo(responseInfo)
                    .data(data != null && !data.isEmpty() ? data : null)
                    .build();

            auditBackend.logEvent(auditEvent);

        } catch (Exception e) {
            log.error("Failed to log audit event in AuditHelper: Type={}, Action={}, Outcome={}, Error={}",
                    type, action, outcome, e.getMessage(), e);
        }
    }

    private static String principalOf(@Nullable Authentication authentication, String fallback) {
        if (authentication == null
                || !authentication.isAuthenticated()
                || authentication instanceof AnonymousAuthenticationToken) {
            return fallback;
        }
        return authentication.getName();
    }

    @Nullable
    private HttpServletRequest getCurrentHttpRequest() {
        return Optional.ofNullable(RequestContextHolder.getRequestAttributes())
                .filter(ServletRequestAttributes.class::isInstance)
                .map(ServletRequestAttributes.class::cast)
                .map(ServletRequestAttributes::getRequest)
                .orElse(null);
    }
}
