package com.packsync.domain.enums;

/** How a pack came to exist, or why it stopped existing. */
public enum PackState {
    CREATE,
    SPLIT,
    MERGE,
    SHRINK,
    TRANSFORMED,
    DELIST
}
