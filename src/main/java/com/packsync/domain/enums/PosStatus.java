package com.packsync.domain.enums;

/**
 * Vendor-side state of a seat pack.
 *
 * <p>ACTIVE and SYNCED both mean the listing exists at the vendor. SYNCED is set when
 * the push was confirmed by this engine; ACTIVE is kept for listings imported as live.
 */
public enum PosStatus {
    /** Not yet confirmed at the vendor. Picked up by the pending sweep. */
    PENDING,
    ACTIVE,
    /** Delisted at the vendor, or never listed and no longer wanted. */
    INACTIVE,
    SYNCED;

    public boolean isListedAtVendor() {
        return this == ACTIVE || this == SYNCED;
    }
}
