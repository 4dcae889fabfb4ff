package tech.yump.logs.audit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import tech.yump.logs.auth.ApiKeyAuthFilter;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class AuditHelperTest {

    private static final String TEST_REQUEST_ID = "req-42";
    private static final String TEST_IP = "192.168.0.100";

    @Mock
    private AuditBackend mockAuditBackend;

    @InjectMocks
    private AuditHelper auditHelper;

    @Captor
    private ArgumentCaptor<AuditEvent> auditEventCaptor;

    @BeforeEach
    void setUp() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/logs");
        request.setRemoteAddr(TEST_IP);
        request.setAttribute(ApiKeyAuthFilter.REQUEST_ID_ATTR, TEST_REQUEST_ID);
        request.addHeader("User-Agent", "TestAgent/1.0");
        RequestContextHolder.setRequestAttributes(new ServletRequestAttributes(request));
    }

    @AfterEach
    void tearDown() {
        RequestContextHolder.resetRequestAttributes();
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("logHttpEvent: authenticated request carries principal, request and response info")
    void logHttpEvent_authenticated() {
        SecurityContextHolder.getContext().setAuthentication(new UsernamePasswordAuthenticationToken(
                ApiKeyAuthFilter.PRINCIPAL, null, AuthorityUtils.createAuthorityList(ApiKeyAuthFilter.ROLE_WRITER)));

        auditHelper.logHttpEvent("log_ingest", "upload", "success", 201, null, Map.of("filename", "app.log"));

        verify(mockAuditBackend).logEvent(auditEventCaptor.capture());
        AuditEvent event = auditEventCaptor.getValue();
        assertThat(event.timestamp()).isNotNull();
        assertThat(event.type()).isEqualTo("log_ingest");
        assertThat(event.action()).isEqualTo("upload");
        assertThat(event.outcome()).isEqualTo("success");
        assertThat(event.authInfo().principal()).isEqualTo(ApiKeyAuthFilter.PRINCIPAL);
        assertThat(event.authInfo().sourceAddress()).isEqualTo(TEST_IP);
        assertThat(event.requestInfo().requestId()).isEqualTo(TEST_REQUEST_ID);
        assertThat(event.requestInfo().httpMethod()).isEqualTo("POST");
        assertThat(event.requestInfo().path()).isEqualTo("/api/logs");
        assertThat(event.requestInfo().headers()).containsEntry("User-Agent", "TestAgent/1.0");
        assertThat(event.responseInfo().statusCode()).isEqualTo(201);
        assertThat(event.data()).containsEntry("filename", "app.log");
    }

    @Test
    @DisplayName("logHttpEvent: anonymous token and missing authentication both audit as anonymous")
    void logHttpEvent_anonymous() {
        SecurityContextHolder.getContext().setAuthentication(new AnonymousAuthenticationToken(
                "key", "anonymousUser", AuthorityUtils.createAuthorityList("ROLE_ANONYMOUS")));
        auditHelper.logHttpEvent("log_read", "list", "success", 200, null, null);

        SecurityContextHolder.clearContext();
        auditHelper.logHttpEvent("log_read", "list", "success", 200, null, Map.of());

        verify(mockAuditBackend, times(2)).logEvent(auditEventCaptor.capture());
        assertThat(auditEventCaptor.getAllValues())
                .allSatisfy(event -> {
                    assertThat(event.authInfo().principal()).isEqualTo("anonymous");
                    assertThat(event.data()).isNull();
                });
    }

    @Test
    @DisplayName("logHttpEvent: outside a request the source address is unknown")
    void logHttpEvent_noRequest() {
        RequestContextHolder.resetRequestAttributes();

        auditHelper.logHttpEvent("system_error", "unknown", "failure", 500, "boom", null);

        verify(mockAuditBackend).logEvent(auditEventCaptor.capture());
        assertThat(auditEventCaptor.getValue().authInfo().sourceAddress()).isEqualTo("unknown");
        assertThat(auditEventCaptor.getValue().requestInfo()).isNull();
        assertThat(auditEventCaptor.getValue().responseInfo().errorMessage()).isEqualTo("boom");
    }

    @Test
    @DisplayName("logInternalEvent: falls back to system principal and omits request info")
    void logInternalEvent_systemPrincipal() {
        auditHelper.logInternalEvent("log_read", "stream_end", "success", null, Map.of("frames", 3L));

        verify(mockAuditBackend).logEvent(auditEventCaptor.capture());
        AuditEvent event = auditEventCaptor.getValue();
        assertThat(event.authInfo().principal()).isEqualTo("system");
        assertThat(event.requestInfo()).isNull();
        assertThat(event.responseInfo()).isNull();
        assertThat(event.data()).containsEntry("frames", 3L);
    }

    @Test
    @DisplayName("logInternalEvent: explicit principal wins")
    void logInternalEvent_explicitPrincipal() {
        auditHelper.logInternalEvent("log_ingest", "startup", "success", "scheduler", null);

        verify(mockAuditBackend).logEvent(auditEventCaptor.capture());
        assertThat(auditEventCaptor.getValue().authInfo().principal()).isEqualTo("scheduler");
    }

    @Test
    @DisplayName("logHttpEvent: backend failure is not propagated")
    void logHttpEvent_backendFailure_isSwallowed() {
        doThrow(new IllegalStateException("audit sink down")).when(mockAuditBackend).logEvent(any());

        assertThatCode(() -> auditHelper.logHttpEvent("log_read", "list", "success", 200, null, null))
                .doesNotThrowAnyException();
    }
}
