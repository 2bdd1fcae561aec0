package com.packsync.domain.enums;

/** Structural relationship between vanished and new packs in the same row. */
public enum TransformationType {
    /** One vanished pack, several new packs whose union covers it. */
    SPLIT,
    /** Several vanished packs, one new pack covering all of them. */
    MERGE,
    /** One vanished pack, one new pack that is a strict subset of it. */
    SHRINK,
    /** Any other overlapping relationship. */
    TRANSFORMED;

    public CreationType toCreationType() {
        return switch (this) {
            case SPLIT -> CreationType.SPLIT;
            case MERGE -> CreationType.MERGE;
            case SHRINK -> CreationType.SHRINK;
            case TRANSFORMED -> CreationType.TRANSFORMED;
        };
    }
}
