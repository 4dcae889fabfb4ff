package tech.yump.logs.storage;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Stores each container as a sub-directory of a fixed base directory and each blob
 * as a regular file inside it.
 */
@Slf4j
public class FileSystemStorageBackend implements StorageBackend {

  static final String TEMP_PREFIX = ".upload-";

  private final Path basePath;

  public FileSystemStorageBackend(String basePath) {
    if (!StringUtils.hasText(basePath)) {
      throw new IllegalArgumentException("Filesystem storage base path cannot be null or empty.");
    }
    this.basePath = Paths.get(basePath)
            .toAbsolutePath()
            .normalize();
    log.info("FileSystemStorageBackend initialized with base path: {}", this.basePath);
  }

  /**
   * Validates the base path after bean creation, creating it when missing.
   */
  @PostConstruct
  void validateBasePath() {
    try {
      if (Files.exists(basePath)) {
        if (!Files.isDirectory(basePath)) {
          throw new StorageException("Configured base path exists but is not a directory: " + basePath);
        }
        if (!Files.isReadable(basePath) || !Files.isWritable(basePath)) {
          throw new StorageException("Configured base path directory lacks read/write permissions: " + basePath);
        }
        log.debug("Base path validation successful: {}", basePath);
      } else {
        log.warn("Base path directory does not exist, attempting to create: {}", basePath);
        Files.createDirectories(basePath);
        log.info("Successfully created base path directory: {}", basePath);
      }
    } catch (IOException e) {
      log.error("Failed to validate or create base path: {}", basePath, e);
      throw new StorageException("Failed to initialize storage base path: " + basePath, e);
    }
  }

  @Override
  public String type() {
    return "filesystem";
  }

  @Override
  public void ensureContainer(String container) throws StorageException {
    Path dir = resolveContainer(container);
    try {
      Files.createDirectories(dir);
      log.debug("Container directory ready: {}", dir);
    } catch (IOException e) {
      log.error("Failed to create container directory {}: {}", dir, e.getMessage(), e);
      throw new StorageException("Failed to create container: " + container, e);
    }
  }

  @Override
  public void put(String container, String name, byte[] data) throws StorageException {
    if (data == null) {
      throw new IllegalArgumentException("Data cannot be null for put operation.");
    }
    Path filePath = resolveBlob(container, name);
    log.debug("Putting {} bytes for '{}/{}' at path: {}", data.length, container, name, filePath);

    Path tempFile = null;
    try {
      Files.createDirectories(filePath.getParent());
      // Write next to the target, then move into place so readers never see a half-written blob
      tempFile = Files.createTempFile(filePath.getParent(), TEMP_PREFIX, ".tmp");
      try (OutputStream out = Files.newOutputStream(tempFile, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
        out.write(data);
      }
      moveIntoPlace(tempFile, filePath);
      tempFile = null;
      log.info("Successfully stored '{}/{}' ({} bytes)", container, name, data.length);
    } catch (IOException e) {
      log.error("Failed to put '{}/{}' at path {}: {}", container, name, filePath, e.getMessage(), e);
      throw new StorageException("Failed to write blob: " + container + "/" + name, e);
    } finally {
      if (tempFile != null) {
        deleteQuietly(tempFile);
      }
    }
  }

  @Override
  public Optional<byte[]> get(String container, String name) throws StorageException {
    Path filePath = resolveBlob(container, name);
    log.debug("Getting '{}/{}' from path: {}", container, name, filePath);

    if (!Files.isRegularFile(filePath, LinkOption.NOFOLLOW_LINKS)) {
      log.debug("Blob '{}/{}' not found (path {} does not exist or is not a file)", container, name, filePath);
      return Optional.empty();
    }

    try {
      return Optional.of(Files.readAllBytes(filePath));
    } catch (NoSuchFileException e) {
      log.warn("Blob '{}/{}' disappeared during read attempt: {}", container, name, filePath);
      return Optional.empty();
    } catch (IOException e) {
      log.error("Failed to read '{}/{}' from path {}: {}", container, name, filePath, e.getMessage(), e);
      throw new StorageException("Failed to read blob: " + container + "/" + name, e);
    }
  }

  @Override
  public Optional<InputStream> openStream(String container, String name) throws StorageException {
    Path filePath = resolveBlob(container, name);
    if (!Files.isRegularFile(filePath, LinkOption.NOFOLLOW_LINKS)) {
      return Optional.empty();
    }
    try {
      return Optional.of(Files.newInputStream(filePath, StandardOpenOption.READ));
    } catch (NoSuchFileException e) {
      log.warn("Blob '{}/{}' disappeared before it could be opened: {}", container, name, filePath);
      return Optional.empty();
    } catch (IOException e) {
      log.error("Failed to open '{}/{}' at path {}: {}", container, name, filePath, e.getMessage(), e);
      throw new StorageException("Failed to open blob: " + container + "/" + name, e);
    }
  }

  @Override
  public boolean exists(String container, String name) throws StorageException {
    return Files.isRegularFile(resolveBlob(container, name), LinkOption.NOFOLLOW_LINKS);
  }

  @Override
  public List<BlobInfo> list(String container) throws StorageException {
    Path dir = resolveContainer(container);
    log.debug("Listing container directory: {}", dir);

    if (!Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) {
      log.debug("Container directory {} does not exist, reporting it as empty", dir);
      return List.of();
    }

    List<BlobInfo> entries = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
      for (Path entry : stream) {
        String fileName = entry.getFileName().toString();
        if (fileName.startsWith(".")) {
          continue; // in-flight temp files and hidden files
        }
        BasicFileAttributes attrs = Files.readAttributes(entry, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        if (attrs.isRegularFile()) {
          entries.add(new BlobInfo(fileName, attrs.size(), attrs.lastModifiedTime().toInstant()));
        }
      }
      log.debug("Found {} blobs in container {}", entries.size(), container);
      return entries;
    } catch (IOException e) {
      log.error("Failed to list container directory {}: {}", dir, e.getMessage(), e);
      throw new StorageException("Failed to list container: " + container, e);
    }
  }

  @Override
  public Optional<Path> localFile(String container, String name) throws StorageException {
    Path filePath = resolveBlob(container, name);
    return Files.isRegularFile(filePath, LinkOption.NOFOLLOW_LINKS) ? Optional.of(filePath) : Optional.empty();
  }

  Path getBasePath() {
    return basePath;
  }

  private void moveIntoPlace(Path source, Path target) throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      log.debug("Atomic move not supported for {}, falling back to a plain replace", target);
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private void deleteQuietly(Path tempFile) {
    try {
      Files.deleteIfExists(tempFile);
    } catch (IOException e) {
      log.warn("Could not remove temporary file {}: {}", tempFile, e.getMessage());
    }
  }

  private Path resolveContainer(String container) throws StorageException {
    return resolvePath(validateSegment(container, "container"));
  }

  private Path resolveBlob(String container, String name) throws StorageException {
    return resolvePath(validateSegment(container, "container") + "/" + validateSegment(name, "blob name"));
  }

  /**
   * Single path segment: no separators, no parent references, no hidden names.
   */
  private String validateSegment(String segment, String what) {
    if (!StringUtils.hasText(segment)) {
      throw new IllegalArgumentException("The " + what + " cannot be null or empty.");
    }
    if (segment.contains("/") || segment.contains("\\") || segment.contains("..") || segment.startsWith(".")) {
      log.error("Invalid {} provided: '{}'", what, segment);
      throw new StorageException("Invalid " + what + ": " + segment);
    }
    return segment;
  }

  /**
   * Resolves a relative path against the base storage path and checks that the
   * result stays inside it.
   */
  private Path resolvePath(String relativePath) throws StorageException {
    Path absolutePath = this.basePath.resolve(relativePath).normalize();
    if (!absolutePath.startsWith(this.basePath)) {
      log.error("Path traversal attempt detected for path '{}', resolved path '{}' is outside base path '{}'", relativePath, absolutePath, this.basePath);
      throw new StorageException("Invalid path resulting in path traversal attempt: " + relativePath);
    }
    return absolutePath;
  }
}
