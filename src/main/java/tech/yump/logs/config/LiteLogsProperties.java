package tech.yump.logs.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import tech.yump.logs.config.validation.ValidApiKeyConfig;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Configuration properties for the LiteLogs application under the 'litelogs' prefix.
 * Built once at startup and injected wherever configuration is needed.
 */
@ConfigurationProperties(prefix = "litelogs")
@Validated
public record LiteLogsProperties(

        @Valid
        @NotNull(message = "Storage configuration (litelogs.storage) is required.")
        StorageProperties storage,

        @Valid
        AuthProperties auth,

        @Valid
        UploadProperties upload,

        @Valid
        StreamProperties stream,

        @Valid
        AuditProperties audit
) {

    public LiteLogsProperties {
        if (auth == null) {
            auth = new AuthProperties(null);
        }
        if (upload == null) {
            upload = new UploadProperties(null);
        }
        if (stream == null) {
            stream = new StreamProperties(null, null, null, null);
        }
        if (audit == null) {
            audit = new AuditProperties(null, null);
        }
    }

    public enum StorageBackendType {
        FILESYSTEM, MINIO
    }

    // --- StorageProperties ---
    @Validated
    public record StorageProperties(
            StorageBackendType backend,

            @Valid
            ContainerProperties containers,

            @Valid
            FileSystemProperties filesystem,

            @Valid
            MinioProperties minio
    ) {
        public StorageProperties {
            if (backend == null) {
                backend = StorageBackendType.FILESYSTEM;
            }
            if (containers == null) {
                containers = new ContainerProperties(null, null);
            }
        }

        @AssertTrue(message = "Filesystem storage configuration (litelogs.storage.filesystem) is required when litelogs.storage.backend=filesystem.")
        public boolean isFilesystemConfigured() {
            return backend != StorageBackendType.FILESYSTEM || filesystem != null;
        }

        @AssertTrue(message = "MinIO endpoint, access key and secret key (litelogs.storage.minio.*) are required when litelogs.storage.backend=minio.")
        public boolean isMinioConfigured() {
            return backend != StorageBackendType.MINIO
                    || (minio != null
                    && StringUtils.hasText(minio.endpoint())
                    && StringUtils.hasText(minio.accessKey())
                    && StringUtils.hasText(minio.secretKey()));
        }

        /**
         * Names of the two logical containers. On the filesystem these are
         * sub-directories of the base path, on MinIO they are buckets.
         */
        @Validated
        public record ContainerProperties(
                String original,
                String sanitized
        ) {
            public static final String DEFAULT_ORIGINAL = "logs-original";
            public static final String DEFAULT_SANITIZED = "logs-sanitized";

            public ContainerProperties {
                if (!StringUtils.hasText(original)) {
                    original = DEFAULT_ORIGINAL;
                }
                if (!StringUtils.hasText(sanitized)) {
                    sanitized = DEFAULT_SANITIZED;
                }
            }

            @AssertTrue(message = "Original and sanitized containers (litelogs.storage.containers) must have different names.")
            public boolean isDistinct() {
                return !original.equals(sanitized);
            }
        }

        @Validated
        public record FileSystemProperties(
                @NotBlank(message = "Filesystem storage path (litelogs.storage.filesystem.path) must be provided.")
                String path
        ) {}

        /**
         * Checked only when MinIO is the selected backend, see {@link #isMinioConfigured()}.
         */
        public record MinioProperties(
                String endpoint,

                String accessKey,

                String secretKey,

                String region
        ) {
            @Override
            public String toString() {
                return "MinioProperties[" +
                        "endpoint='" + endpoint + '\'' +
                        ", accessKey='" + accessKey + '\'' +
                        ", secretKey=******" +
                        ", region='" + region + '\'' +
                        ']';
            }
        }
    }

    @Validated
    public record AuthProperties(
            @Valid
            ApiKeyProperties apiKey
    ) {
        public AuthProperties {
            if (apiKey == null) {
                apiKey = new ApiKeyProperties(false, null);
            }
        }

        /**
         * Shared-secret header check for write operations.
         */
        @Validated
        @ValidApiKeyConfig
        public record ApiKeyProperties(
                boolean enabled,
                String key
        ) {
            @Override
            public String toString() {
                return "ApiKeyProperties[enabled=" + enabled + ", key=******]";
            }
        }
    }

    @Validated
    public record UploadProperties(
            @NotEmpty(message = "At least one allowed upload extension (litelogs.upload.allowed-extensions) must be configured.")
            List<String> allowedExtensions
    ) {
        public static final List<String> DEFAULT_EXTENSIONS = List.of(".log", ".txt");

        public UploadProperties {
            if (allowedExtensions == null || allowedExtensions.isEmpty()) {
                allowedExtensions = DEFAULT_EXTENSIONS;
            } else {
                allowedExtensions = allowedExtensions.stream()
                        .map(ext -> ext.trim().toLowerCase(Locale.ROOT))
                        .map(ext -> ext.startsWith(".") ? ext : "." + ext)
                        .toList();
            }
        }
    }

    @Validated
    public record StreamProperties(
            Boolean followByDefault,

            Duration pollInterval,

            Duration maxFollowDuration,

            @Valid
            ExecutorProperties executor
    ) {
        public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(250);
        public static final Duration DEFAULT_MAX_FOLLOW = Duration.ofMinutes(30);

        public StreamProperties {
            if (followByDefault == null) {
                followByDefault = Boolean.TRUE;
            }
            if (pollInterval == null) {
                pollInterval = DEFAULT_POLL_INTERVAL;
            }
            if (maxFollowDuration == null) {
                maxFollowDuration = DEFAULT_MAX_FOLLOW;
            }
            if (executor == null) {
                executor = new ExecutorProperties(0, 0, 0);
            }
        }

        @AssertTrue(message = "Follow poll interval (litelogs.stream.poll-interval) must be between 50ms and 5s.")
        public boolean isPollIntervalValid() {
            return pollInterval.compareTo(Duration.ofMillis(50)) >= 0
                    && pollInterval.compareTo(Duration.ofSeconds(5)) <= 0;
        }

        @AssertTrue(message = "Maximum follow duration (litelogs.stream.max-follow-duration) must be positive.")
        public boolean isMaxFollowDurationValid() {
            return !maxFollowDuration.isNegative() && !maxFollowDuration.isZero();
        }

        @Validated
        public record ExecutorProperties(
                @Min(value = 0, message = "Stream executor core size cannot be negative.")
                int coreSize,

                @Min(value = 0, message = "Stream executor max size cannot be negative.")
                int maxSize,

                @Min(value = 0, message = "Stream executor queue capacity cannot be negative.")
                int queueCapacity
        ) {
            public ExecutorProperties {
                if (coreSize == 0) {
                    coreSize = 4;
                }
                if (maxSize == 0) {
                    maxSize = 32;
                }
                if (queueCapacity == 0) {
                    queueCapacity = 64;
                }
            }

            @AssertTrue(message = "Stream executor max size must be >= core size.")
            public boolean isSizingValid() {
                return maxSize >= coreSize;
            }
        }
    }

    @Validated
    public record AuditProperties(
            String backend,

            @Valid
            FileAuditProperties file
    ) {
        public AuditProperties {
            if (!StringUtils.hasText(backend)) {
                backend = "slf4j";
            }
        }

        public record FileAuditProperties(
                String path
        ) {
            public static final String PATH_PROPERTY = "litelogs.audit.file.path";
        }
    }
}
