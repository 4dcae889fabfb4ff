package tech.yump.logs.storage;

/**
 * Runtime exception for errors occurring within a StorageBackend implementation
 * (backend unreachable, read or write failure, invalid container or blob name).
 */
public class StorageException extends RuntimeException {

  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
