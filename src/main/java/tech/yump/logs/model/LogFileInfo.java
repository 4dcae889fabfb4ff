package tech.yump.logs.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.Comparator;

@Schema(description = "A stored log file (original or sanitized copy)")
public record LogFileInfo(
        @Schema(description = "File name as stored.", example = "app.log.sanitized", requiredMode = Schema.RequiredMode.REQUIRED)
        String name,
        @Schema(description = "Stored variant.", example = "sanitized", allowableValues = {"original", "sanitized"}, requiredMode = Schema.RequiredMode.REQUIRED)
        LogVariant type,
        @Schema(description = "Last modification time (ISO-8601).", requiredMode = Schema.RequiredMode.REQUIRED)
        Instant timestamp,
        @Schema(description = "Size in bytes.", example = "2048", requiredMode = Schema.RequiredMode.REQUIRED)
        long size
) {

    /**
     * Newest first; equal timestamps fall back to the name.
     */
    public static final Comparator<LogFileInfo> NEWEST_FIRST =
            Comparator.comparing(LogFileInfo::timestamp, Comparator.reverseOrder())
                    .thenComparing(LogFileInfo::name);
}
