package tech.yump.logs.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;
import tech.yump.logs.api.dto.DigestResponse;
import tech.yump.logs.api.dto.UploadResponse;
import tech.yump.logs.audit.AuditHelper;
import tech.yump.logs.config.LiteLogsProperties;
import tech.yump.logs.ingest.IngestionResult;
import tech.yump.logs.ingest.LogCatalogService;
import tech.yump.logs.ingest.LogIngestionService;
import tech.yump.logs.model.LogFileInfo;
import tech.yump.logs.model.StoredLog;
import tech.yump.logs.stream.LogEventCursor;
import tech.yump.logs.stream.LogTailService;
import tech.yump.logs.stream.StreamMode;

import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/logs")
@Slf4j
@Tag(name = "Logs", description = "Upload, list, stream and digest stored log files")
public class LogController {

    public static final MediaType TEXT_PLAIN_UTF8 = MediaType.parseMediaType("text/plain; charset=UTF-8");
    static final String ACCEL_BUFFERING_HEADER = "X-Accel-Buffering";

    private final LogIngestionService ingestionService;
    private final LogCatalogService catalogService;
    private final LogTailService tailService;
    private final AuditHelper auditHelper;
    private final boolean followByDefault;

    public LogController(LogIngestionService ingestionService,
                         LogCatalogService catalogService,
                         LogTailService tailService,
                         AuditHelper auditHelper,
                         LiteLogsProperties properties) {
        this.ingestionService = ingestionService;
        this.catalogService = catalogService;
        this.tailService = tailService;
        this.auditHelper = auditHelper;
        this.followByDefault = properties.stream().followByDefault();
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(
            summary = "Upload a log file",
            description = "Stores the uploaded file and a sanitized copy named '<filename>.sanitized' in which lines mentioning password, token, key or secret are redacted."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Original and sanitized copy stored.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = UploadResponse.class))),
            @ApiResponse(responseCode = "400", description = "Missing file part, empty or unsafe name, or disallowed extension.",
                    content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "401", description = "Missing or invalid X-API-Key.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "413", description = "Upload exceeds the configured size limit.",
                    content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "500", description = "Storage failure; the 'stage' property tells which step failed.",
                    content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<UploadResponse> upload(
            @Parameter(description = "The log file to upload (.log or .txt by default).", required = true)
            @RequestPart("file") MultipartFile file) {
        log.info("Received upload '{}' ({} bytes)", file.getOriginalFilename(), file.getSize());
        IngestionResult result = ingestionService.ingest(file);

        auditHelper.logHttpEvent(
                "log_ingest", "upload", "success", HttpStatus.CREATED.value(),
                null, Map.of("filename", result.fileName(), "size", result.size())
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(UploadResponse.from(result));
    }

    @GetMapping
    @Operation(summary = "List stored log files", description = "Originals and sanitized copies, newest first.")
    @ApiResponse(responseCode = "200", description = "Stored files.",
            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, array = @ArraySchema(schema = @Schema(implementation = LogFileInfo.class))))
    public List<LogFileInfo> list() {
        List<LogFileInfo> files = catalogService.list();
        auditHelper.logHttpEvent("log_read", "list", "success", HttpStatus.OK.value(), null, Map.of("count", files.size()));
        return files;
    }

    @GetMapping("/{filename}")
    @Operation(
            summary = "Stream a log file",
            description = "Streams the file as text/event-stream frames 'data: {timestamp, level, message, redacted}'. "
                    + "With follow=true lines appended later are streamed too, on backends that keep files locally."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Event stream of the file's lines.",
                    content = @Content(mediaType = MediaType.TEXT_EVENT_STREAM_VALUE)),
            @ApiResponse(responseCode = "400", description = "Unsafe name or disallowed extension.",
                    content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "No such file.",
                    content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<StreamingResponseBody> stream(
            @Parameter(description = "Stored file name, original or '.sanitized'.", required = true, example = "app.log.sanitized")
            @PathVariable String filename,
            @Parameter(description = "Keep streaming appended lines. Defaults to litelogs.stream.follow-by-default.")
            @RequestParam(required = false) Boolean follow) {
        StoredLog storedLog = catalogService.locate(filename);
        StreamMode mode = StreamMode.of(follow != null ? follow : followByDefault);
        LogEventCursor cursor = tailService.open(storedLog, mode);
        log.info("Streaming '{}' in {} mode", filename, mode);

        auditHelper.logHttpEvent(
                "log_read", "stream", "success", HttpStatus.OK.value(),
                null, Map.of("filename", filename, "mode", mode.name().toLowerCase(Locale.ROOT))
        );

        Map<String, String> mdc = MDC.getCopyOfContextMap();
        StreamingResponseBody body = out -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                long frames = tailService.pump(cursor, out);
                auditHelper.logInternalEvent("log_read", "stream_end", "success", null,
                        Map.of("filename", filename, "frames", frames));
            } finally {
                MDC.clear();
            }
        };

        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .cacheControl(CacheControl.noCache())
                .header(ACCEL_BUFFERING_HEADER, "no")
                .body(body);
    }

    @GetMapping("/{filename}/raw")
    @Operation(summary = "Download a log file", description = "Returns the stored bytes unchanged.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "File content.", content = @Content(mediaType = MediaType.TEXT_PLAIN_VALUE)),
            @ApiResponse(responseCode = "404", description = "No such file.",
                    content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<byte[]> raw(@PathVariable String filename) {
        byte[] content = catalogService.readRaw(filename);
        auditHelper.logHttpEvent("log_read", "raw", "success", HttpStatus.OK.value(), null,
                Map.of("filename", filename, "size", content.length));
        return ResponseEntity.ok()
                .contentType(TEXT_PLAIN_UTF8)
                .body(content);
    }

    @GetMapping("/{filename}/digest")
    @Operation(summary = "Digest a log file", description = "SHA-256 of the stored bytes, computed on every request.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Digest computed.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = DigestResponse.class))),
            @ApiResponse(responseCode = "404", description = "No such file.",
                    content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public DigestResponse digest(@PathVariable String filename) {
        DigestResponse digest = catalogService.digest(filename);
        auditHelper.logHttpEvent("log_read", "digest", "success", HttpStatus.OK.value(), null,
                Map.of("filename", filename, "sha256", digest.sha256()));
        return digest;
    }

    @PostMapping("/{filename}/sanitize")
    @Operation(
            summary = "Re-sanitize a log file",
            description = "Regenerates '<filename>.sanitized' from the current original. Sanitized copies are otherwise never refreshed."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Sanitized copy regenerated.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = UploadResponse.class))),
            @ApiResponse(responseCode = "400", description = "Name is unsafe or is itself a sanitized name.",
                    content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "401", description = "Missing or invalid X-API-Key.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "404", description = "Original not found.",
                    content = @Content(mediaType = MediaType.APPLICATION_PROBLEM_JSON_VALUE, schema = @Schema(implementation = ProblemDetail.class)))
    })
    public UploadResponse resanitize(@PathVariable String filename) {
        IngestionResult result = ingestionService.resanitize(filename);
        auditHelper.logHttpEvent("log_ingest", "resanitize", "success", HttpStatus.OK.value(), null,
                Map.of("filename", filename, "sanitized_sha256", result.sanitizedSha256()));
        return UploadResponse.from(result);
    }
}
