package com.solusoft.medclaims.features.claims.storage;

import org.springframework.web.multipart.MultipartFile;

public interface AttachmentStorage {

    /**
     * Validates and stores an uploaded claim document.
     *
     * @throws IllegalArgumentException when the content type or size is not acceptable
     * @throws com.solusoft.medclaims.exception.AttachmentStorageException when the write fails
     */
    StoredFile store(MultipartFile file);

    void delete(String path);

    /** Whether new documents can currently be written. */
    boolean isAvailable();
}
