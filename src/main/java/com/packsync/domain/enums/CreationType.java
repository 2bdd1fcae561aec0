package com.packsync.domain.enums;

/** Why a new pack row is created. CREATE is an organic addition with no predecessor. */
public enum CreationType {
    CREATE,
    SPLIT,
    MERGE,
    SHRINK,
    TRANSFORMED;

    public PackState toPackState() {
        return PackState.valueOf(name());
    }
}
