package com.solusoft.medclaims.features.notifications.model;

/**
 * One message to one recipient, rendered for both channels.
 *
 * @param title   in-app title
 * @param message in-app body (plain text)
 * @param subject email subject
 * @param html    email body
 */
public record NotificationMessage(Long claimId, String title, String message, String subject, String html) {}
