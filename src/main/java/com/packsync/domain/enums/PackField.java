package com.packsync.domain.enums;

/** Mutable attributes of a pack that an in-place update may change. */
public enum PackField {
    PACK_PRICE,
    TOTAL_PRICE,
    PACK_SIZE,
    SEAT_KEYS
}
