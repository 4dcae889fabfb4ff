package tech.yump.logs.api;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(description = "Error body written by the API-key check")
public record ApiError(
        @Schema(description = "Detailed error message.", example = "Missing or invalid X-API-Key header.", requiredMode = Schema.RequiredMode.REQUIRED)
        String message,
        @Schema(description = "Timestamp when the error occurred.", requiredMode = Schema.RequiredMode.REQUIRED)
        Instant timestamp
) {
    public ApiError(String message) {
        this(message, Instant.now());
    }
}
