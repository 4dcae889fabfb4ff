package tech.yump.logs.auth;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import tech.yump.logs.audit.AuditBackend;
import tech.yump.logs.audit.AuditEvent;
import tech.yump.logs.config.LiteLogsProperties;

import java.io.IOException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class ApiKeyAuthFilterTest {

    private static final String API_KEY = "s3cret-key";

    @Mock
    private AuditBackend mockAuditBackend;
    @Mock
    private FilterChain mockFilterChain;

    @Captor
    private ArgumentCaptor<AuditEvent> auditEventCaptor;

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    private MockHttpServletRequest mockRequest;
    private MockHttpServletResponse mockResponse;

    @BeforeEach
    void setUp() {
        SecurityContextHolder.clearContext();
        mockRequest = new MockHttpServletRequest("POST", "/api/logs");
        mockRequest.setRemoteAddr("10.0.0.7");
        mockResponse = new MockHttpServletResponse();
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    private ApiKeyAuthFilter filter(boolean enabled) {
        return new ApiKeyAuthFilter(
                new LiteLogsProperties.AuthProperties.ApiKeyProperties(enabled, enabled ? API_KEY : null),
                mockAuditBackend, objectMapper);
    }

    @Test
    @DisplayName("doFilterInternal: When disabled, writes pass through unchecked")
    void doFilterInternal_whenDisabled_shouldProceed() throws ServletException, IOException {
        ApiKeyAuthFilter filter = filter(false);

        filter.doFilterInternal(mockRequest, mockResponse, mockFilterChain);

        verify(mockFilterChain).doFilter(mockRequest, mockResponse);
        verifyNoInteractions(mockAuditBackend);
        assertThat(filter.isEnabled()).isFalse();
        assertThat(mockRequest.getAttribute(ApiKeyAuthFilter.REQUEST_ID_ATTR)).isNotNull();
    }

    @ParameterizedTest
    @ValueSource(strings = {"GET", "HEAD", "OPTIONS"})
    @DisplayName("doFilterInternal: When enabled, reads need no key")
    void doFilterInternal_whenRead_shouldProceedWithoutKey(String method) throws ServletException, IOException {
        mockRequest.setMethod(method);

        filter(true).doFilterInternal(mockRequest, mockResponse, mockFilterChain);

        verify(mockFilterChain).doFilter(mockRequest, mockResponse);
        verifyNoInteractions(mockAuditBackend);
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    }

    @Test
    @DisplayName("doFilterInternal: When key header missing, should reject with 401 and audit")
    void doFilterInternal_whenKeyMissing_shouldReject() throws Exception {
        filter(true).doFilterInternal(mockRequest, mockResponse, mockFilterChain);

        verify(mockFilterChain, never()).doFilter(any(), any());
        assertThat(mockResponse.getStatus()).isEqualTo(401);
        assertThat(mockResponse.getContentType()).startsWith("application/json");
        Map<String, Object> body = objectMapper.readValue(mockResponse.getContentAsString(),
                new TypeReference<Map<String, Object>>() {});
        assertThat(body.get("message")).isEqualTo("Missing or invalid X-API-Key header.");
        assertThat(body).containsKey("timestamp");

        verify(mockAuditBackend).logEvent(auditEventCaptor.capture());
        AuditEvent event = auditEventCaptor.getValue();
        assertThat(event.type()).isEqualTo("auth");
        assertThat(event.action()).isEqualTo("api_key_check");
        assertThat(event.outcome()).isEqualTo("failure");
        assertThat(event.authInfo().principal()).isEqualTo("anonymous");
        assertThat(event.authInfo().sourceAddress()).isEqualTo("10.0.0.7");
        assertThat(event.responseInfo().statusCode()).isEqualTo(401);
        assertThat(event.data()).containsEntry("reason", "missing_key");
        assertThat(event.requestInfo().path()).isEqualTo("/api/logs");
    }

    @Test
    @DisplayName("doFilterInternal: When key is wrong, should reject with 401")
    void doFilterInternal_whenKeyInvalid_shouldReject() throws Exception {
        mockRequest.setMethod("DELETE");
        mockRequest.addHeader(ApiKeyAuthFilter.API_KEY_HEADER, "wrong-key");

        filter(true).doFilterInternal(mockRequest, mockResponse, mockFilterChain);

        verify(mockFilterChain, never()).doFilter(any(), any());
        assertThat(mockResponse.getStatus()).isEqualTo(401);
        verify(mockAuditBackend).logEvent(auditEventCaptor.capture());
        assertThat(auditEventCaptor.getValue().data()).containsEntry("reason", "invalid_key");
        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    }

    @Test
    @DisplayName("doFilterInternal: When key is correct, should authenticate and proceed")
    void doFilterInternal_whenKeyValid_shouldAuthenticate() throws ServletException, IOException {
        mockRequest.addHeader(ApiKeyAuthFilter.API_KEY_HEADER, " " + API_KEY + " ");

        filter(true).doFilterInternal(mockRequest, mockResponse, mockFilterChain);

        verify(mockFilterChain).doFilter(mockRequest, mockResponse);
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        assertThat(authentication).isNotNull();
        assertThat(authentication.getName()).isEqualTo(ApiKeyAuthFilter.PRINCIPAL);
        assertThat(authentication.getAuthorities())
                .extracting(GrantedAuthority::getAuthority)
                .containsExactly(ApiKeyAuthFilter.ROLE_WRITER);

        verify(mockAuditBackend).logEvent(auditEventCaptor.capture());
        assertThat(auditEventCaptor.getValue().outcome()).isEqualTo("success");
        assertThat(auditEventCaptor.getValue().authInfo().principal()).isEqualTo(ApiKeyAuthFilter.PRINCIPAL);
    }
}
