package com.ayende.backend.domain.enums;

public enum NotificationCategory {
    PROMOTION,
    ANNOUNCEMENT,
    BIRTHDAY,
    REMINDER,
    ALERT,
    UPDATE,
    OTHER
}
