package com.auscomply.api.privacy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;

/**
 * Writes exports to a local directory, one sub-directory per request.
 */
@Component
public class LocalExportStorage implements ExportStorage {

    private static final Logger log = LoggerFactory.getLogger(LocalExportStorage.class);

    private final Path baseDirectory;

    public LocalExportStorage(
            @Value("${auscomply.privacy.export-directory:${java.io.tmpdir}/auscomply-exports}") String baseDirectory) {
        this.baseDirectory = Paths.get(baseDirectory).toAbsolutePath().normalize();
    }

    @Override
    public String store(UUID requestId, String fileName, byte[] content) {
        Path target = baseDirectory.resolve(requestId.toString()).resolve(fileName).normalize();
        if (!target.startsWith(baseDirectory)) {
            throw new IllegalArgumentException("Export file name escapes the export directory: " + fileName);
        }
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content);
        } catch (IOException e) {
            throw new ExportStorageException("Could not write export for request " + requestId, e);
        }
        log.info("Stored export for request {} at {} ({} bytes)", requestId, target, content.length);
        return target.toUri().toString();
    }
}
