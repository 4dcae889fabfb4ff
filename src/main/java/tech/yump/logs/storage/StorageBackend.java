package tech.yump.logs.storage;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Interface defining the contract for persistent storage backends.
 * Implementations store named blobs inside named containers (a directory on the
 * local filesystem, a bucket in an object store).
 */
public interface StorageBackend {

  /**
   * Short identifier of the backend, reported by the status endpoint.
   */
  String type();

  /**
   * Creates the container if it does not exist yet. Idempotent.
   *
   * @param container The container name. Must not be null or empty.
   * @throws StorageException If the container cannot be created or checked.
   */
  void ensureContainer(String container) throws StorageException;

  /**
   * Persists the bytes under the given name, overwriting any existing blob.
   *
   * @param container The container name. Must not be null or empty.
   * @param name      The blob name. Must not be null or empty, and must not contain path separators.
   * @param data      The content to store. Must not be null.
   * @throws StorageException If an error occurs during persistence.
   */
  void put(String container, String name, byte[] data) throws StorageException;

  /**
   * Retrieves the full content of a blob.
   *
   * @return An Optional containing the bytes if found, otherwise Optional.empty().
   * @throws StorageException If an error occurs during retrieval.
   */
  Optional<byte[]> get(String container, String name) throws StorageException;

  /**
   * Opens a stream over a blob's content. The caller must close the stream.
   *
   * @return An Optional containing the open stream if found, otherwise Optional.empty().
   * @throws StorageException If an error occurs opening the blob.
   */
  Optional<InputStream> openStream(String container, String name) throws StorageException;

  /**
   * Checks whether a blob exists.
   *
   * @throws StorageException If the backend cannot be queried.
   */
  boolean exists(String container, String name) throws StorageException;

  /**
   * Lists the blobs of a container. A container that does not exist is reported as empty.
   *
   * @throws StorageException If the backend cannot be queried.
   */
  List<BlobInfo> list(String container) throws StorageException;

  /**
   * Returns the local file backing a blob, for backends that keep blobs on the local
   * filesystem. Callers use this to follow a file as it grows.
   *
   * @return The path of the existing file, or Optional.empty() if the backend is not file-based
   * or the blob does not exist.
   */
  default Optional<Path> localFile(String container, String name) throws StorageException {
    return Optional.empty();
  }
}
