package tech.yump.logs.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import tech.yump.logs.model.LogVariant;

@Schema(description = "SHA-256 digest of one stored log file, computed on request.")
public record DigestResponse(
        @Schema(description = "File name as stored.", example = "app.log", requiredMode = Schema.RequiredMode.REQUIRED)
        String name,

        @Schema(description = "Stored variant.", example = "original", allowableValues = {"original", "sanitized"}, requiredMode = Schema.RequiredMode.REQUIRED)
        LogVariant type,

        @Schema(description = "Lower-case hex SHA-256 of the stored bytes.", example = "9f86d081884c7d659a2feaa0c55ad015a3bf4f1b2b0b822cd15d6c15b0f00a08", requiredMode = Schema.RequiredMode.REQUIRED)
        String sha256,

        @Schema(description = "Size in bytes.", example = "2048", requiredMode = Schema.RequiredMode.REQUIRED)
        long size
) {
}
