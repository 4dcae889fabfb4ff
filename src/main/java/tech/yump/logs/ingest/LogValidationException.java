package tech.yump.logs.ingest;

/**
 * Thrown when an uploaded or requested file name is unusable: empty, unsafe, or with an
 * extension that is not allowed. Nothing is written when this is raised.
 */
public class LogValidationException extends RuntimeException {

    public LogValidationException(String message) {
        super(message);
    }
}
