package com.ayende.backend.domain.enums;

public enum NotificationPriority {
    LOW,
    NORMAL,
    HIGH,
    URGENT
}
