package tech.yump.logs.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;
import tech.yump.logs.api.ApiError;
import tech.yump.logs.audit.AuditBackend;
import tech.yump.logs.audit.AuditEvent;
import tech.yump.logs.audit.AuditHelper;
import tech.yump.logs.config.LiteLogsProperties;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Tags every request with a request id and, when enabled, requires the shared API key
 * on write requests.
 *
 * <p>A write request without the right {@value #API_KEY_HEADER} header is answered
 * with 401 here and never reaches a handler. Reads are not checked.
 */
@Slf4j
public class ApiKeyAuthFilter extends OncePerRequestFilter {

  public static final String API_KEY_HEADER = "X-API-Key";
  public static final String REQUEST_ID_ATTR = "auditRequestId";
  public static final String MDC_REQUEST_ID_KEY = "requestId";
  public static final String PRINCIPAL = "api-key";
  public static final String ROLE_WRITER = "ROLE_LOG_WRITER";

  static final Set<String> WRITE_METHODS = Set.of("POST", "PUT", "DELETE", "PATCH");

  private final boolean enabled;
  private final byte[] expectedKey;
  private final AuditBackend auditBackend;
  private final ObjectMapper objectMapper;

  public ApiKeyAuthFilter(LiteLogsProperties.AuthProperties.ApiKeyProperties apiKeyProps,
                          AuditBackend auditBackend,
                          ObjectMapper objectMapper) {
    this.enabled = apiKeyProps != null && apiKeyProps.enabled();
    this.expectedKey = enabled
            ? apiKeyProps.key().getBytes(StandardCharsets.UTF_8)
            : new byte[0];
    this.auditBackend = auditBackend;
    this.objectMapper = objectMapper;
    log.debug("ApiKeyAuthFilter initialized. Enabled: {}", enabled);
  }

  @Override
  protected void doFilterInternal(
          @NonNull HttpServletRequest request,
          @NonNull HttpServletResponse response,
          @NonNull FilterChain filterChain) throws ServletException, IOException {

    String requestId = UUID.randomUUID().toString();
    request.setAttribute(REQUEST_ID_ATTR, requestId);
    MDC.put(MDC_REQUEST_ID_KEY, requestId);

    try {
      if (!enabled || !isWrite(request)) {
        filterChain.doFilter(request, response);
        return;
      }

      String provided = request.getHeader(API_KEY_HEADER);
      if (!StringUtils.hasText(provided)) {
        reject(request, response, "missing_key");
        return;
      }
      if (!MessageDigest.isEqual(expectedKey, provided.trim().getBytes(StandardCharsets.UTF_8))) {
        reject(request, response, "invalid_key");
        return;
      }

      UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
              PRINCIPAL, null, AuthorityUtils.createAuthorityList(ROLE_WRITER));
      authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
      SecurityContextHolder.getContext().setAuthentication(authentication);
      log.debug("API key accepted for {} {}", request.getMethod(), request.getRequestURI());
      logAuditEvent("success", request, null, null);

      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_REQUEST_ID_KEY);
    }
  }

  private void reject(HttpServletRequest request, HttpServletResponse response, String reason) throws IOException {
    String message = "Missing or invalid " + API_KEY_HEADER + " header.";
    log.warn("Rejected {} {}: {}", request.getMethod(), request.getRequestURI(), reason);
    logAuditEvent("failure",
            request,
            AuditEvent.ResponseInfo.builder().statusCode(HttpStatus.UNAUTHORIZED.value()).errorMessage(message).build(),
            Map.of("reason", reason));

    response.setStatus(HttpStatus.UNAUTHORIZED.value());
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setCharacterEncoding(StandardCharsets.UTF_8.name());
    response.getWriter().write(objectMapper.writeValueAsString(new ApiError(message)));
  }

  private void logAuditEvent(String outcome, HttpServletRequest request,
                             AuditEvent.ResponseInfo responseInfo, Map<String, Object> data) {
    try {
      AuditEvent event = AuditEvent.builder()
              .timestamp(Instant.now())
              .type("auth")
              .action("api_key_check")
              .outcome(outcome)
              .authInfo(AuditEvent.AuthInfo.builder()
                      .principal("success".equals(outcome) ? PRINCIPAL : "anonymous")
                      .sourceAddress(request.getRemoteAddr())
                      .build())
              .requestInfo(AuditHelper.buildRequestInfo(request))
              .responseInfo(responseInfo)
              .data(data)
              .build();
      auditBackend.logEvent(event);
    } catch (Exception e) {
      log.error("Failed to log audit event in ApiKeyAuthFilter: {}", e.getMessage(), e);
    }
  }

  static boolean isWrite(HttpServletRequest request) {
    return WRITE_METHODS.contains(request.getMethod());
  }

  public boolean isEnabled() {
    return enabled;
  }
}
