package tech.yump.logs.crypto;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.MessageDigestAlgorithms;
import org.springframework.stereotype.Component;
import tech.yump.logs.storage.StorageException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 digests of stored content, reported for integrity only. Input is consumed in
 * fixed-size chunks so arbitrarily large files never have to fit in memory.
 */
@Slf4j
@Component
public class ContentHasher {

  public static final int CHUNK_SIZE = 4096;

  /**
   * Digests the remaining content of the stream. The stream is read to its end but
   * not closed.
   *
   * @return the lower-case hex digest (64 characters)
   * @throws StorageException if the stream cannot be read
   */
  public String digest(InputStream in) {
    if (in == null) {
      throw new IllegalArgumentException("Input stream to digest cannot be null.");
    }
    MessageDigest digest = newDigest();
    byte[] buffer = new byte[CHUNK_SIZE];
    long total = 0;
    try {
      int read;
      while ((read = in.read(buffer)) != -1) {
        digest.update(buffer, 0, read);
        total += read;
      }
    } catch (IOException e) {
      log.error("Failed to read content while digesting after {} bytes: {}", total, e.getMessage(), e);
      throw new StorageException("Failed to read content for digest", e);
    }
    String hex = Hex.encodeHexString(digest.digest());
    log.trace("Digested {} bytes -> {}", total, hex);
    return hex;
  }

  public String digest(byte[] data) {
    if (data == null) {
      throw new IllegalArgumentException("Data to digest cannot be null.");
    }
    return digest(new ByteArrayInputStream(data));
  }

  private MessageDigest newDigest() {
    try {
      return MessageDigest.getInstance(MessageDigestAlgorithms.SHA_256);
    } catch (NoSuchAlgorithmException e) {
      // Every Java platform is required to provide SHA-256
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }
}
