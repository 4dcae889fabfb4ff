package tech.yump.logs.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import tech.yump.logs.audit.AuditHelper;
import tech.yump.logs.ingest.IngestionException;
import tech.yump.logs.ingest.LogNotFoundException;
import tech.yump.logs.ingest.LogValidationException;
import tech.yump.logs.storage.StorageException;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private final AuditHelper auditHelper;

    private static final Pattern LOG_FILE_PATH_PATTERN = Pattern.compile(".*/api/logs/([^/]+)(?:/(raw|digest|sanitize))?");

    // --- Specific Handlers ---

    @ExceptionHandler(LogValidationException.class)
    public ResponseEntity<ProblemDetail> handleValidation(LogValidationException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problemDetail.setTitle("Invalid Log File");
        log.warn("Invalid log file: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI());

        audit(request, status, ex.getMessage());
        return ResponseEntity.status(status).body(problemDetail);
    }

    @ExceptionHandler(LogNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleNotFound(LogNotFoundException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.NOT_FOUND;
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problemDetail.setTitle("Log Not Found");
        problemDetail.setProperty("filename", ex.getFileName());
        log.warn("Log not found: {}. Request: {} {}", ex.getFileName(), request.getMethod(), request.getRequestURI());

        audit(request, status, ex.getMessage());
        return ResponseEntity.status(status).body(problemDetail);
    }

    @ExceptionHandler(IngestionException.class)
    public ResponseEntity<ProblemDetail> handleIngestion(IngestionException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        String message = switch (ex.getStage()) {
            case ORIGINAL_WRITE -> "The uploaded file could not be stored.";
            case SANITIZE -> "The uploaded file was stored but could not be sanitized.";
            case SANITIZED_WRITE -> "The uploaded file was stored but its sanitized copy could not be written.";
        };
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Ingestion Failed");
        problemDetail.setProperty("stage", ex.getStage().name());
        problemDetail.setProperty("filename", ex.getFileName());
        log.error("Ingestion of '{}' failed at stage {}: {}. Request: {} {}",
                ex.getFileName(), ex.getStage(), ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);

        Map<String, Object> data = extractContextData(request);
        data.put("stage", ex.getStage().name());
        auditHelper.logHttpEvent("log_ingest", determineActionFromRequest(request), "failure", status.value(), message, data);
        return ResponseEntity.status(status).body(problemDetail);
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ProblemDetail> handleStorage(StorageException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        String message = "Storage backend error.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Storage Error");
        log.error("Storage error: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);

        audit(request, status, message);
        return ResponseEntity.status(status).body(problemDetail);
    }

    @ExceptionHandler(TaskRejectedException.class)
    public ResponseEntity<ProblemDetail> handleTaskRejected(TaskRejectedException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.SERVICE_UNAVAILABLE;
        String message = "Too many concurrent log streams. Try again later.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Stream Capacity Exhausted");
        log.warn("Stream executor rejected a task: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI());

        audit(request, status, message);
        return ResponseEntity.status(status).body(problemDetail);
    }

    @Override
    protected ResponseEntity<Object> handleMissingServletRequestPart(
            @NonNull MissingServletRequestPartException ex, @NonNull HttpHeaders headers, @NonNull HttpStatusCode status, @NonNull WebRequest request) {
        String message = "Required multipart field '" + ex.getRequestPartName() + "' is missing.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Invalid Log File");
        log.warn("Bad request: {} Request: {}", message, request.getDescription(false));

        auditWebRequest(request, status, message);
        return handleExceptionInternal(ex, problemDetail, headers, status, request);
    }

    @Override
    protected ResponseEntity<Object> handleMaxUploadSizeExceededException(
            @NonNull MaxUploadSizeExceededException ex, @NonNull HttpHeaders headers, @NonNull HttpStatusCode status, @NonNull WebRequest request) {
        String message = "Upload exceeds the maximum allowed size.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Upload Too Large");
        log.warn("Upload rejected as too large ({}). Request: {}", ex.getMessage(), request.getDescription(false));

        auditWebRequest(request, status, message);
        return handleExceptionInternal(ex, problemDetail, headers, status, request);
    }

    // --- Fallback Handler ---

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGenericException(Exception ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        String message = "An unexpected internal error occurred.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Internal Server Error");
        log.error("An unexpected error occurred: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);

        auditHelper.logHttpEvent("system_error", determineActionFromRequest(request), "failure",
                status.value(), message, extractContextData(request));
        return ResponseEntity.status(status).body(problemDetail);
    }

    // --- Audit context helpers ---

    private void audit(HttpServletRequest request, HttpStatusCode status, String message) {
        auditHelper.logHttpEvent(determineEventType(request), determineActionFromRequest(request), "failure",
                status.value(), message, extractContextData(request));
    }

    private void auditWebRequest(WebRequest request, HttpStatusCode status, String message) {
        HttpServletRequest servletRequest = (request instanceof ServletWebRequest servletWebRequest)
                ? servletWebRequest.getRequest()
                : null;
        if (servletRequest == null) {
            log.error("Could not obtain HttpServletRequest from WebRequest for audit logging.");
            return;
        }
        audit(servletRequest, status, message);
    }

    private String determineEventType(HttpServletRequest request) {
        if (!request.getRequestURI().startsWith("/api/logs")) {
            return "request_error";
        }
        return "POST".equals(request.getMethod()) ? "log_ingest" : "log_read";
    }

    private String determineActionFromRequest(HttpServletRequest request) {
        String path = request.getRequestURI();
        if (path.endsWith("/raw")) return "raw";
        if (path.endsWith("/digest")) return "digest";
        if (path.endsWith("/sanitize")) return "resanitize";
        if (path.equals("/api/logs") || path.equals("/api/logs/")) {
            return "POST".equals(request.getMethod()) ? "upload" : "list";
        }
        if (path.startsWith("/api/logs/")) return "stream";
        return "unknown";
    }

    private Map<String, Object> extractContextData(@Nullable HttpServletRequest request) {
        Map<String, Object> data = new HashMap<>();
        if (request == null) {
            return data;
        }
        Matcher matcher = LOG_FILE_PATH_PATTERN.matcher(request.getRequestURI());
        if (matcher.matches()) {
            data.put("filename", matcher.group(1));
        }
        return data;
    }
}
