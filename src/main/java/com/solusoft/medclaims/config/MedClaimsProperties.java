package com.solusoft.medclaims.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Application settings bound once at startup from the {@code medclaims.*} keys
 * and handed to collaborators by injection.
 */
@ConfigurationProperties(prefix = "medclaims")
public class MedClaimsProperties {

    private String adminSecret;
    private Uploads uploads = new Uploads();
    private Notifications notifications = new Notifications();
    private Async async = new Async();

    public String getAdminSecret() { return adminSecret; }
    public void setAdminSecret(String adminSecret) { this.adminSecret = adminSecret; }
    public Uploads getUploads() { return uploads; }
    public void setUploads(Uploads uploads) { this.uploads = uploads; }
    public Notifications getNotifications() { return notifications; }
    public void setNotifications(Notifications notifications) { this.notifications = notifications; }
    public Async getAsync() { return async; }
    public void setAsync(Async async) { this.async = async; }

    public static class Uploads {
        private String directory = "./uploads";
        private long maxSizeBytes = 10L * 1024 * 1024;
        private List<String> allowedMimeTypes = new ArrayList<>(List.of(
                "application/pdf", "image/jpeg", "image/png"));

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
        public long getMaxSizeBytes() { return maxSizeBytes; }
        public void setMaxSizeBytes(long maxSizeBytes) { this.maxSizeBytes = maxSizeBytes; }
        public List<String> getAllowedMimeTypes() { return allowedMimeTypes; }
        public void setAllowedMimeTypes(List<String> allowedMimeTypes) { this.allowedMimeTypes = allowedMimeTypes; }
    }

    public static class Notifications {
        private boolean emailEnabled = true;
        private boolean inAppEnabled = true;
        private String fromAddress = "claims@medclaims.local";
        private String fromName = "MedClaims";

        public boolean isEmailEnabled() { return emailEnabled; }
        public void setEmailEnabled(boolean emailEnabled) { this.emailEnabled = emailEnabled; }
        public boolean isInAppEnabled() { return inAppEnabled; }
        public void setInAppEnabled(boolean inAppEnabled) { this.inAppEnabled = inAppEnabled; }
        public String getFromAddress() { return fromAddress; }
        public void setFromAddress(String fromAddress) { this.fromAddress = fromAddress; }
        public String getFromName() { return fromName; }
        public void setFromName(String fromName) { this.fromName = fromName; }
    }

    public static class Async {
        private int corePoolSize = 2;
        private int maxPoolSize = 8;
        private int queueCapacity = 500;

        public int getCorePoolSize() { return corePoolSize; }
        public void setCorePoolSize(int corePoolSize) { this.corePoolSize = corePoolSize; }
        public int getMaxPoolSize() { return maxPoolSize; }
        public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
    }
}
