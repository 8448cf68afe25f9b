package com.solusoft.medclaims.features.notifications.model;

public enum NotificationChannel {
    EMAIL,
    IN_APP
}
