package com.solusoft.medclaims.features.claims.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

import org.apache.tika.Tika;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import com.solusoft.medclaims.config.MedClaimsProperties;
import com.solusoft.medclaims.exception.AttachmentStorageException;

import lombok.extern.slf4j.Slf4j;

/**
 * Stores claim documents on the local file system under random names. The type is
 * sniffed from the bytes with Tika, the client supplied name and Content-Type are not trusted.
 */
@Component
@Slf4j
public class LocalFileAttachmentStorage implements AttachmentStorage {

    // zip and OLE2 containers only get their concrete Office type from the file name
    private static final Set<String> CONTAINER_TYPES = Set.of("application/zip", "application/x-tika-ooxml",
            "application/x-tika-msoffice");

    private final Tika tika = new Tika();
    private final MedClaimsProperties.Uploads settings;
    private final Path root;

    public LocalFileAttachmentStorage(MedClaimsProperties properties) {
        this.settings = properties.getUploads();
        this.root = Paths.get(settings.getDirectory()).toAbsolutePath().normalize();
    }

    @Override
    public StoredFile store(MultipartFile file) {
        log.info("Entering store");
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Uploaded file is empty");
        }
        String originalName = StringUtils.cleanPath(file.getOriginalFilename() == null ? "document" : file.getOriginalFilename());
        log.debug("Input fileName: {}, size: {}", originalName, file.getSize());

        if (file.getSize() > settings.getMaxSizeBytes()) {
            throw new IllegalArgumentException("Security Block: file " + originalName + " exceeds the limit of "
                    + settings.getMaxSizeBytes() + " bytes");
        }

        try {
            byte[] content = file.getBytes();
            String detectedType = detect(content, originalName);
            if (!settings.getAllowedMimeTypes().contains(detectedType)) {
                log.warn("Rejected upload {} with detected type {}", originalName, detectedType);
                throw new IllegalArgumentException("Security Block: file type " + detectedType + " is not allowed");
            }

            Files.createDirectories(root);
            Path target = root.resolve(UUID.randomUUID() + extensionOf(originalName));
            Files.write(target, content);

            log.info("Stored {} ({}, {} KB) as {}", originalName, detectedType, content.length / 1024, target.getFileName());
            return new StoredFile(originalName, target.toString(), detectedType);
        } catch (IOException e) {
            throw new AttachmentStorageException("Could not store file " + originalName, e);
        }
    }

    @Override
    public void delete(String path) {
        Path target = Paths.get(path).toAbsolutePath().normalize();
        if (!target.startsWith(root)) {
            throw new AttachmentStorageException("Refusing to delete outside the upload directory: " + path, null);
        }
        try {
            boolean removed = Files.deleteIfExists(target);
            if (!removed) {
                log.warn("Attachment file {} was already gone", target);
            }
        } catch (IOException e) {
            throw new AttachmentStorageException("Could not delete file " + path, e);
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            Files.createDirectories(root);
            return Files.isWritable(root);
        } catch (IOException e) {
            log.warn("Upload directory {} is not usable: {}", root, e.getMessage());
            return false;
        }
    }

    String detect(byte[] content, String originalName) {
        String detected = tika.detect(content);
        if (CONTAINER_TYPES.contains(detected)) {
            detected = tika.detect(content, originalName);
        }
        return detected;
    }

    private static String extensionOf(String fileName) {
        String extension = StringUtils.getFilenameExtension(fileName);
        return extension == null ? "" : "." + extension.toLowerCase(Locale.ROOT);
    }
}
