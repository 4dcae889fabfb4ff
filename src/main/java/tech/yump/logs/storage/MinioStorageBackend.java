package tech.yump.logs.storage;

import io.minio.BucketExistsArgs;
import io.minio.GetObjectArgs;
import io.minio.GetObjectResponse;
import io.minio.ListObjectsArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.Result;
import io.minio.StatObjectArgs;
import io.minio.errors.ErrorResponseException;
import io.minio.errors.MinioException;
import io.minio.messages.Item;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Object-store backend: each container is a bucket, each blob an object.
 * Content is only available as complete objects, so callers read it in snapshot mode.
 */
@Slf4j
public class MinioStorageBackend implements StorageBackend {

  private static final Set<String> NOT_FOUND_CODES = Set.of("NoSuchKey", "NoSuchBucket", "NoSuchObject");
  private static final String CONTENT_TYPE = "text/plain; charset=utf-8";

  private final MinioClient client;

  public MinioStorageBackend(MinioClient client) {
    this.client = client;
  }

  @Override
  public String type() {
    return "minio";
  }

  @Override
  public void ensureContainer(String container) throws StorageException {
    requireText(container, "Container");
    try {
      boolean exists = client.bucketExists(BucketExistsArgs.builder().bucket(container).build());
      if (!exists) {
        client.makeBucket(MakeBucketArgs.builder().bucket(container).build());
        log.info("Created bucket '{}'", container);
      } else {
        log.debug("Bucket '{}' already exists", container);
      }
    } catch (MinioException | InvalidKeyException | NoSuchAlgorithmException | IOException e) {
      log.error("Failed to ensure bucket '{}': {}", container, e.getMessage(), e);
      throw new StorageException("Failed to ensure container: " + container, e);
    }
  }

  @Override
  public void put(String container, String name, byte[] data) throws StorageException {
    requireText(container, "Container");
    requireText(name, "Blob name");
    if (data == null) {
      throw new IllegalArgumentException("Data cannot be null for put operation.");
    }
    try (ByteArrayInputStream in = new ByteArrayInputStream(data)) {
      client.putObject(
              PutObjectArgs.builder()
                      .bucket(container)
                      .object(name)
                      .stream(in, data.length, -1)
                      .contentType(CONTENT_TYPE)
                      .build()
      );
      log.info("Successfully stored '{}/{}' ({} bytes)", container, name, data.length);
    } catch (MinioException | InvalidKeyException | NoSuchAlgorithmException | IOException e) {
      log.error("Failed to put '{}/{}': {}", container, name, e.getMessage(), e);
      throw new StorageException("Failed to write blob: " + container + "/" + name, e);
    }
  }

  @Override
  public Optional<byte[]> get(String container, String name) throws StorageException {
    Optional<InputStream> stream = openStream(container, name);
    if (stream.isEmpty()) {
      return Optional.empty();
    }
    try (InputStream in = stream.get()) {
      return Optional.of(in.readAllBytes());
    } catch (IOException e) {
      log.error("Failed to read '{}/{}': {}", container, name, e.getMessage(), e);
      throw new StorageException("Failed to read blob: " + container + "/" + name, e);
    }
  }

  @Override
  public Optional<InputStream> openStream(String container, String name) throws StorageException {
    requireText(container, "Container");
    requireText(name, "Blob name");
    try {
      GetObjectResponse response = client.getObject(
              GetObjectArgs.builder().bucket(container).object(name).build());
      return Optional.of(response);
    } catch (ErrorResponseException e) {
      if (isNotFound(e)) {
        log.debug("Blob '{}/{}' not found ({})", container, name, e.errorResponse().code());
        return Optional.empty();
      }
      log.error("Failed to open '{}/{}': {}", container, name, e.getMessage(), e);
      throw new StorageException("Failed to open blob: " + container + "/" + name, e);
    } catch (MinioException | InvalidKeyException | NoSuchAlgorithmException | IOException e) {
      log.error("Failed to open '{}/{}': {}", container, name, e.getMessage(), e);
      throw new StorageException("Failed to open blob: " + container + "/" + name, e);
    }
  }

  @Override
  public boolean exists(String container, String name) throws StorageException {
    requireText(container, "Container");
    requireText(name, "Blob name");
    try {
      client.statObject(StatObjectArgs.builder().bucket(container).object(name).build());
      return true;
    } catch (ErrorResponseException e) {
      if (isNotFound(e)) {
        return false;
      }
      log.error("Failed to stat '{}/{}': {}", container, name, e.getMessage(), e);
      throw new StorageException("Failed to check blob: " + container + "/" + name, e);
    } catch (MinioException | InvalidKeyException | NoSuchAlgorithmException | IOException e) {
      log.error("Failed to stat '{}/{}': {}", container, name, e.getMessage(), e);
      throw new StorageException("Failed to check blob: " + container + "/" + name, e);
    }
  }

  @Override
  public List<BlobInfo> list(String container) throws StorageException {
    requireText(container, "Container");
    try {
      if (!client.bucketExists(BucketExistsArgs.builder().bucket(container).build())) {
        log.debug("Bucket '{}' does not exist, reporting it as empty", container);
        return List.of();
      }
      Iterable<Result<Item>> results = client.listObjects(
              ListObjectsArgs.builder()
                      .bucket(container)
                      .recursive(true)
                      .build());
      List<BlobInfo> entries = new ArrayList<>();
      for (Result<Item> result : results) {
        Item item = result.get();
        if (item.isDir()) {
          continue;
        }
        Instant lastModified = item.lastModified() != null ? item.lastModified().toInstant() : Instant.EPOCH;
        entries.add(new BlobInfo(item.objectName(), item.size(), lastModified));
      }
      log.debug("Found {} objects in bucket {}", entries.size(), container);
      return entries;
    } catch (MinioException | InvalidKeyException | NoSuchAlgorithmException | IOException e) {
      log.error("Failed to list bucket '{}': {}", container, e.getMessage(), e);
      throw new StorageException("Failed to list container: " + container, e);
    }
  }

  private boolean isNotFound(ErrorResponseException e) {
    return e.errorResponse() != null && NOT_FOUND_CODES.contains(e.errorResponse().code());
  }

  private void requireText(String value, String what) {
    if (!StringUtils.hasText(value)) {
      throw new IllegalArgumentException(what + " cannot be null or empty.");
    }
  }
}
