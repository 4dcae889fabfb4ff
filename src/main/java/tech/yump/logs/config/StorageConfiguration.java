package tech.yump.logs.config;

import io.minio.MinioClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import tech.yump.logs.storage.FileSystemStorageBackend;
import tech.yump.logs.storage.MinioStorageBackend;
import tech.yump.logs.storage.StorageBackend;

/**
 * Selects the storage backend from {@code litelogs.storage.backend}.
 */
@Configuration
@Slf4j
public class StorageConfiguration {

    public static final String BACKEND_PROPERTY = "litelogs.storage.backend";

    @Bean
    @ConditionalOnProperty(name = BACKEND_PROPERTY, havingValue = "filesystem", matchIfMissing = true)
    public StorageBackend fileSystemStorageBackend(LiteLogsProperties properties) {
        String path = properties.storage().filesystem().path();
        log.info("Configuring filesystem storage backend rooted at '{}'", path);
        return new FileSystemStorageBackend(path);
    }

    @Bean
    @ConditionalOnProperty(name = BACKEND_PROPERTY, havingValue = "minio")
    public MinioClient minioClient(LiteLogsProperties properties) {
        LiteLogsProperties.StorageProperties.MinioProperties minio = properties.storage().minio();
        log.info("Configuring MinIO client for endpoint '{}'", minio.endpoint());
        MinioClient.Builder builder = MinioClient.builder()
                .endpoint(minio.endpoint())
                .credentials(minio.accessKey(), minio.secretKey());
        if (StringUtils.hasText(minio.region())) {
            builder.region(minio.region());
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnProperty(name = BACKEND_PROPERTY, havingValue = "minio")
    public StorageBackend minioStorageBackend(MinioClient minioClient) {
        log.info("Configuring MinIO storage backend. Follow mode is unavailable; streams are served as snapshots.");
        return new MinioStorageBackend(minioClient);
    }
}
