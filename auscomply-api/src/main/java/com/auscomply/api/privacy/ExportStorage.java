package com.auscomply.api.privacy;

import java.util.UUID;

/**
 * Stores data-subject exports and hands back the location the user downloads them from.
 */
public interface ExportStorage {

    /**
     * @return the URL of the stored export
     * @throws ExportStorageException if the export could not be written
     */
    String store(UUID requestId, String fileName, byte[] content);

    class ExportStorageException extends RuntimeException {
        public ExportStorageException(String message, Throwable cause) { super(message, cause); }
    }
}
