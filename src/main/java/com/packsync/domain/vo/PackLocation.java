package com.packsync.domain.vo;

import lombok.Value;

/** A row within a zone. Packs in different locations never relate structurally. */
@Value
public class PackLocation {

    String zoneId;
    String rowLabel;

    public static PackLocation of(String zoneId, String rowLabel) {
        return new PackLocation(zoneId, rowLabel);
    }
}
