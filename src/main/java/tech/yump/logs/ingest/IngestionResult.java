package tech.yump.logs.ingest;

/**
 * Outcome of a successful ingestion. Digests are computed over the stored bytes of each variant.
 */
public record IngestionResult(
        String fileName,
        String sanitizedFileName,
        long size,
        String originalSha256,
        String sanitizedSha256
) {
}
