package tech.yump.logs.ingest;

/**
 * Thrown when a requested log file does not exist in its container.
 */
public class LogNotFoundException extends RuntimeException {

    private final String fileName;

    public LogNotFoundException(String fileName) {
        super("Log file not found: " + fileName);
        this.fileName = fileName;
    }

    public String getFileName() {
        return fileName;
    }
}
