package com.solusoft.medclaims.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.solusoft.medclaims.config.MedClaimsProperties;
import com.solusoft.medclaims.features.claims.storage.AttachmentStorage;

@Component
public class UploadStorageHealthIndicator implements HealthIndicator {

    private final AttachmentStorage storage;
    private final String directory;

    public UploadStorageHealthIndicator(AttachmentStorage storage, MedClaimsProperties properties) {
        this.storage = storage;
        this.directory = properties.getUploads().getDirectory();
    }

    @Override
    public Health health() {
        try {
            if (storage.isAvailable()) {
                return Health.up()
                    .withDetail("system", "Attachment storage")
                    .withDetail("directory", directory)
                    .build();
            }
            return Health.down()
                .withDetail("system", "Attachment storage")
                .withDetail("error", "Upload directory is not writable")
                .build();
        } catch (Exception e) {
            return Health.down()
                .withDetail("system", "Attachment storage")
                .withDetail("error", e.getMessage())
                .build();
        }
    }
}
