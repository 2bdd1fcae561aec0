package com.packsync.mapper;

import com.packsync.domain.enums.PackStatus;
import com.packsync.entity.SeatPackEntity;

/**
 * The only place that interprets the legacy {@code synced_to_pos} column.
 *
 * <p>On an inactive row the flag means "vendor side is consistent": false leaves a vendor
 * delete owed. On an active row it mirrors whether the listing exists at the vendor.
 */
public final class PosSyncFlagAdapter {

    private PosSyncFlagAdapter() {}

    public static boolean vendorCleanupOwed(SeatPackEntity entity) {
        return entity.getPackStatus() == PackStatus.INACTIVE && !entity.isSyncedToPos();
    }

    /** Writes the legacy flag from the entity's current lifecycle columns. */
    public static void apply(SeatPackEntity entity, boolean vendorCleanupOwed) {
        if (entity.getPackStatus() == PackStatus.INACTIVE) {
            entity.setSyncedToPos(!vendorCleanupOwed);
        } else {
            entity.setSyncedToPos(entity.getPosStatus() != null && entity.getPosStatus().isListedAtVendor());
        }
    }

    public static boolean legacyFlag(PackStatus packStatus, boolean listedAtVendor, boolean vendorCleanupOwed) {
        return packStatus == PackStatus.INACTIVE ? !vendorCleanupOwed : listedAtVendor;
    }
}
