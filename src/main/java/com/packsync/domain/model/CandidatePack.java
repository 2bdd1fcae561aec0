package com.packsync.domain.model;

import com.packsync.domain.vo.PackKey;
import com.packsync.domain.vo.PackLocation;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A pack produced by the newest scrape. Structural fields only; it has no identity
 * until the executor persists it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CandidatePack {

    private String zoneId;
    private String levelId;
    private String sectionId;
    private String rowLabel;
    private String startSeatNumber;
    private String endSeatNumber;
    private int packSize;
    private BigDecimal packPrice;

    /** Falls back to {@link #packPrice} when the scrape does not supply it. */
    private BigDecimal totalPrice;

    @Builder.Default
    private List<String> seatKeys = new ArrayList<>();

    public List<String> getSeatKeys() {
        return seatKeys != null ? seatKeys : List.of();
    }

    public BigDecimal effectiveTotalPrice() {
        return totalPrice != null ? totalPrice : packPrice;
    }

    public PackKey key() {
        return PackKey.of(zoneId, rowLabel, startSeatNumber, endSeatNumber);
    }

    public PackLocation location() {
        return PackLocation.of(zoneId, rowLabel);
    }

    /** Builds candidate data mirroring a persisted pack. */
    public static CandidatePack from(SeatPack pack) {
        return CandidatePack.builder()
                .zoneId(pack.getZoneId())
                .levelId(pack.getLevelId())
                .sectionId(pack.getSectionId())
                .rowLabel(pack.getRowLabel())
                .startSeatNumber(pack.getStartSeatNumber())
                .endSeatNumber(pack.getEndSeatNumber())
                .packSize(pack.getPackSize())
                .packPrice(pack.getPackPrice())
                .totalPrice(pack.getTotalPrice())
                .seatKeys(new ArrayList<>(pack.getSeatKeys()))
                .build();
    }
}
