package tech.yump.logs.ingest;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.yump.logs.api.dto.DigestResponse;
import tech.yump.logs.config.LiteLogsProperties;
import tech.yump.logs.crypto.ContentHasher;
import tech.yump.logs.model.LogFileInfo;
import tech.yump.logs.model.LogVariant;
import tech.yump.logs.model.StoredLog;
import tech.yump.logs.storage.BlobInfo;
import tech.yump.logs.storage.StorageBackend;
import tech.yump.logs.storage.StorageException;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Read side of the stored logs: listing, resolving a name to its container, raw
 * content and digests.
 */
@Slf4j
@Service
public class LogCatalogService {

    private final StorageBackend storageBackend;
    private final ContentHasher contentHasher;
    private final FilenamePolicy filenamePolicy;
    private final String originalContainer;
    private final String sanitizedContainer;

    public LogCatalogService(StorageBackend storageBackend,
                             ContentHasher contentHasher,
                             FilenamePolicy filenamePolicy,
                             LiteLogsProperties properties) {
        this.storageBackend = storageBackend;
        this.contentHasher = contentHasher;
        this.filenamePolicy = filenamePolicy;
        this.originalContainer = properties.storage().containers().original();
        this.sanitizedContainer = properties.storage().containers().sanitized();
    }

    /**
     * Lists both containers, newest first. Only names in their own container's variant
     * are reported, so stray files never show up under the wrong type.
     */
    public List<LogFileInfo> list() {
        List<LogFileInfo> files = new ArrayList<>();
        addAll(files, originalContainer, LogVariant.ORIGINAL);
        addAll(files, sanitizedContainer, LogVariant.SANITIZED);
        files.sort(LogFileInfo.NEWEST_FIRST);
        log.debug("Listed {} stored log files", files.size());
        return files;
    }

    /**
     * Resolves a name to the stored file it refers to.
     *
     * @throws LogValidationException if the name is unsafe or has a disallowed extension
     * @throws LogNotFoundException   if no such file is stored
     */
    public StoredLog locate(String name) {
        filenamePolicy.validateStoredName(name);
        LogVariant variant = LogVariant.fromFileName(name);
        String container = containerOf(variant);
        if (!storageBackend.exists(container, name)) {
            throw new LogNotFoundException(name);
        }
        return new StoredLog(name, variant, container);
    }

    public byte[] readRaw(String name) {
        StoredLog storedLog = locate(name);
        return storageBackend.get(storedLog.container(), storedLog.name())
                .orElseThrow(() -> new LogNotFoundException(name));
    }

    /**
     * Digests the stored bytes of one file. Computed on every call.
     */
    public DigestResponse digest(String name) {
        StoredLog storedLog = locate(name);
        CountingInputStream counting;
        String sha256;
        try (InputStream in = storageBackend.openStream(storedLog.container(), storedLog.name())
                .orElseThrow(() -> new LogNotFoundException(name))) {
            counting = new CountingInputStream(in);
            sha256 = contentHasher.digest(counting);
        } catch (IOException e) {
            throw new StorageException("Failed to close stream of '" + name + "' after digest", e);
        }
        return new DigestResponse(name, storedLog.variant(), sha256, counting.getCount());
    }

    public String containerOf(LogVariant variant) {
        return variant == LogVariant.SANITIZED ? sanitizedContainer : originalContainer;
    }

    private void addAll(List<LogFileInfo> files, String container, LogVariant variant) {
        for (BlobInfo blob : storageBackend.list(container)) {
            if (LogVariant.fromFileName(blob.name()) != variant) {
                log.debug("Skipping '{}' in container '{}': name does not match the {} variant", blob.name(), container, variant.label());
                continue;
            }
            files.add(new LogFileInfo(blob.name(), variant, blob.lastModified(), blob.size()));
        }
    }

    private static final class CountingInputStream extends FilterInputStream {

        private long count;

        CountingInputStream(InputStream in) {
            super(in);
        }

        @Override
        public int read() throws IOException {
            int b = super.read();
            if (b != -1) {
                count++;
            }
            return b;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            int read = super.read(b, off, len);
            if (read > 0) {
                count += read;
            }
            return read;
        }

        long getCount() {
            return count;
        }
    }
}
