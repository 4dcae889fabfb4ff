package tech.yump.logs.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import tech.yump.logs.ingest.IngestionResult;

@Schema(description = "Result of storing an upload and its sanitized copy.")
public record UploadResponse(
        @Schema(description = "Name the original was stored under.", example = "app.log", requiredMode = Schema.RequiredMode.REQUIRED)
        String filename,

        @Schema(description = "Name of the sanitized copy.", example = "app.log.sanitized", requiredMode = Schema.RequiredMode.REQUIRED)
        String sanitizedFilename,

        @Schema(description = "Size of the original in bytes.", example = "2048", requiredMode = Schema.RequiredMode.REQUIRED)
        long size,

        @Schema(description = "SHA-256 of the stored original.", requiredMode = Schema.RequiredMode.REQUIRED)
        String originalSha256,

        @Schema(description = "SHA-256 of the stored sanitized copy.", requiredMode = Schema.RequiredMode.REQUIRED)
        String sanitizedSha256
) {

    public static UploadResponse from(IngestionResult result) {
        return new UploadResponse(
                result.fileName(),
                result.sanitizedFileName(),
                result.size(),
                result.originalSha256(),
                result.sanitizedSha256());
    }
}
