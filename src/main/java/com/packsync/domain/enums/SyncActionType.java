package com.packsync.domain.enums;

public enum SyncActionType {
    CREATE,
    UPDATE,
    DELIST,
    SYNC
}
