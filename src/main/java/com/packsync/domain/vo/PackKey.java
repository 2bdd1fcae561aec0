package com.packsync.domain.vo;

import lombok.Value;

/**
 * Identity of a pack across scrapes: location plus its start and end seat.
 *
 * <p>Two packs with the same key are the same listing, even if price or size moved.
 */
@Value
public class PackKey {

    String zoneId;
    String rowLabel;
    String startSeatNumber;
    String endSeatNumber;

    public static PackKey of(String zoneId, String rowLabel, String startSeatNumber, String endSeatNumber) {
        return new PackKey(trim(zoneId), trim(rowLabel), trim(startSeatNumber), trim(endSeatNumber));
    }

    public PackLocation location() {
        return PackLocation.of(zoneId, rowLabel);
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }
}
