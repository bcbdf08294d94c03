package com.ayende.backend.domain.enums;

public enum NotificationStatus {
    DRAFT,
    SCHEDULED,
    SENDING,
    SENT,
    FAILED
}
