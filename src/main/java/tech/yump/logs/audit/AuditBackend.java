package tech.yump.logs.audit;

/**
 * Interface for audit logging backends.
 * Defines the contract for recording audit events.
 */
public interface AuditBackend {

    /**
     * Logs a given audit event.
     * Implementations decide where it goes (application log, dedicated audit file).
     *
     * @param event The AuditEvent to log. Must not be null.
     */
    void logEvent(AuditEvent event);

}
