package tech.yump.logs.ingest;

/**
 * Thrown when storing an upload or producing its sanitized copy fails.
 * The original is not rolled back when a later stage fails.
 */
public class IngestionException extends RuntimeException {

    private final IngestionStage stage;
    private final String fileName;

    public IngestionException(IngestionStage stage, String fileName, Throwable cause) {
        super("Ingestion of '" + fileName + "' failed at stage " + stage + ": " + cause.getMessage(), cause);
        this.stage = stage;
        this.fileName = fileName;
    }

    public IngestionStage getStage() {
        return stage;
    }

    public String getFileName() {
        return fileName;
    }
}
