package com.solusoft.medclaims.features.notifications.model;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Table("notifications")
@Getter
@Setter
@NoArgsConstructor
public class Notification {

    @Id
    private Long id;

    private Long userId;
    private Long claimId;
    private String title;
    private String message;
    @Column("notification_type")
    private NotificationChannel channel;
    @Column("is_read")
    private boolean read;
    private Instant createdAt;
}
