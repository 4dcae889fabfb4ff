package tech.yump.logs.ingest;

/**
 * Step of an upload that failed. Tells an operator whether the original made it to storage.
 */
public enum IngestionStage {
    ORIGINAL_WRITE,
    SANITIZE,
    SANITIZED_WRITE
}
