package tech.yump.logs.model;

/**
 * A resolved reference to one stored log file: its name, its variant and the
 * container that holds it.
 */
public record StoredLog(
        String name,
        LogVariant variant,
        String container
) {

    public boolean redacted() {
        return variant == LogVariant.SANITIZED;
    }
}
