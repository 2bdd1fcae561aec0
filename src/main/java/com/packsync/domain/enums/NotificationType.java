package com.packsync.domain.enums;

public enum NotificationType {
    SYNC_STARTED,
    SYNC_COMPLETED,
    SYNC_FAILED
}
