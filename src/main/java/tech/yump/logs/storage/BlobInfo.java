package tech.yump.logs.storage;

import java.time.Instant;

/**
 * Listing entry for a stored blob.
 *
 * @param name         blob name within its container
 * @param size         size in bytes
 * @param lastModified last modification time reported by the backend
 */
public record BlobInfo(String name, long size, Instant lastModified) {
}
