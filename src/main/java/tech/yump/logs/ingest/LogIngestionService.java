package tech.yump.logs.ingest;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;
import tech.yump.logs.config.LiteLogsProperties;
import tech.yump.logs.crypto.ContentHasher;
import tech.yump.logs.model.LogVariant;
import tech.yump.logs.sanitize.RedactionEngine;
import tech.yump.logs.storage.StorageBackend;
import tech.yump.logs.storage.StorageException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Stores an uploaded log and its sanitized copy.
 *
 * <p>The steps run in order and each one only after the previous succeeded: write the
 * original, sanitize it, write the sanitized copy, digest both stored variants. A failure
 * is reported with the {@link IngestionStage} it happened in. An original that was
 * stored is kept even if a later stage fails; {@link #resanitize(String)} repairs it.
 */
@Slf4j
@Service
public class LogIngestionService {

    private final StorageBackend storageBackend;
    private final RedactionEngine redactionEngine;
    private final ContentHasher contentHasher;
    private final FilenamePolicy filenamePolicy;
    private final String originalContainer;
    private final String sanitizedContainer;

    public LogIngestionService(StorageBackend storageBackend,
                               RedactionEngine redactionEngine,
                               ContentHasher contentHasher,
                               FilenamePolicy filenamePolicy,
                               LiteLogsProperties properties) {
        this.storageBackend = storageBackend;
        this.redactionEngine = redactionEngine;
        this.contentHasher = contentHasher;
        this.filenamePolicy = filenamePolicy;
        this.originalContainer = properties.storage().containers().original();
        this.sanitizedContainer = properties.storage().containers().sanitized();
    }

    /**
     * Validates the upload's name, then stores it.
     *
     * @throws LogValidationException if there is no file or its name is not acceptable
     * @throws IngestionException     if storing or sanitizing fails
     */
    public IngestionResult ingest(MultipartFile file) {
        if (file == null) {
            throw new LogValidationException("No file part in the request.");
        }
        String name = filenamePolicy.validateUpload(file.getOriginalFilename());
        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            log.error("Failed to read uploaded content of '{}': {}", name, e.getMessage(), e);
            throw new IngestionException(IngestionStage.ORIGINAL_WRITE, name, e);
        }
        return store(name, content);
    }

    /**
     * Stores content under a name that has already passed {@link FilenamePolicy#validateUpload(String)}.
     */
    IngestionResult store(String name, byte[] content) {
        log.info("Ingesting '{}' ({} bytes)", name, content.length);
        try {
            storageBackend.ensureContainer(originalContainer);
            storageBackend.put(originalContainer, name, content);
        } catch (StorageException e) {
            log.error("Failed to store original '{}': {}", name, e.getMessage(), e);
            throw new IngestionException(IngestionStage.ORIGINAL_WRITE, name, e);
        }

        String sanitizedName = writeSanitizedCopy(name, content);

        IngestionResult result = new IngestionResult(
                name,
                sanitizedName,
                content.length,
                digestStored(originalContainer, name),
                digestStored(sanitizedContainer, sanitizedName));
        log.info("Ingested '{}' -> '{}' (sha256 {} / {})",
                name, sanitizedName, result.originalSha256(), result.sanitizedSha256());
        return result;
    }

    /**
     * Regenerates the sanitized copy of an original from its current content.
     * Only called on request; sanitized copies are never refreshed automatically.
     *
     * @throws LogValidationException if the name is unsafe or names a sanitized copy
     * @throws LogNotFoundException   if the original does not exist
     */
    public IngestionResult resanitize(String name) {
        filenamePolicy.validateStoredName(name);
        if (LogVariant.isSanitizedName(name)) {
            throw new LogValidationException("Re-sanitize expects the original file name, not '" + name + "'.");
        }
        byte[] content = storageBackend.get(originalContainer, name)
                .orElseThrow(() -> new LogNotFoundException(name));

        log.info("Re-sanitizing '{}' ({} bytes)", name, content.length);
        String sanitizedName = writeSanitizedCopy(name, content);
        return new IngestionResult(
                name,
                sanitizedName,
                content.length,
                digestStored(originalContainer, name),
                digestStored(sanitizedContainer, sanitizedName));
    }

    private String writeSanitizedCopy(String name, byte[] content) {
        String sanitizedName = LogVariant.sanitizedNameOf(name);
        byte[] sanitized;
        try {
            sanitized = redactionEngine.sanitize(new String(content, StandardCharsets.UTF_8))
                    .getBytes(StandardCharsets.UTF_8);
        } catch (RuntimeException e) {
            log.error("Failed to sanitize '{}': {}", name, e.getMessage(), e);
            throw new IngestionException(IngestionStage.SANITIZE, name, e);
        }

        try {
            storageBackend.ensureContainer(sanitizedContainer);
            storageBackend.put(sanitizedContainer, sanitizedName, sanitized);
        } catch (StorageException e) {
            log.error("Original '{}' is stored but its sanitized copy could not be written: {}", name, e.getMessage(), e);
            throw new IngestionException(IngestionStage.SANITIZED_WRITE, name, e);
        }
        return sanitizedName;
    }

    private String digestStored(String container, String name) {
        try (InputStream in = storageBackend.openStream(container, name)
                .orElseThrow(() -> new StorageException("Stored file '" + name + "' disappeared before it could be digested"))) {
            return contentHasher.digest(in);
        } catch (IOException e) {
            throw new StorageException("Failed to close stream of '" + name + "' after digest", e);
        }
    }
}
