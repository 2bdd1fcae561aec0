package com.packsync.domain.enums;

/** Whether a seat pack is currently part of the scraped inventory. Never hard-deleted. */
public enum PackStatus {
    ACTIVE,
    INACTIVE
}
