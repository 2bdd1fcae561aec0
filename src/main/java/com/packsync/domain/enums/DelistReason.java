package com.packsync.domain.enums;

public enum DelistReason {
    /** Seats no longer present in the scrape. */
    VANISHED,
    /** Consumed by a split, merge, shrink or general transformation. */
    TRANSFORMED,
    /** Removed by an operator. Never resurrected by the reconciler. */
    MANUAL_DELIST,
    /** POS was switched off for the whole performance. */
    PERFORMANCE_DISABLED;

    /** The pack_state a pack ends in when delisted for this reason. */
    public PackState toPackState() {
        return this == TRANSFORMED ? PackState.TRANSFORMED : PackState.DELIST;
    }
}
