package com.packsync.domain.model;

import com.packsync.domain.enums.DelistReason;
import com.packsync.domain.enums.PackState;
import com.packsync.domain.enums.PackStatus;
import com.packsync.domain.enums.PosStatus;
import com.packsync.domain.vo.PackKey;
import com.packsync.domain.vo.PackLocation;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A persisted sellable pack: a priced, contiguous run of seats in one row.
 *
 * <p>The lifecycle is tracked in four orthogonal dimensions: {@link #packStatus} (does
 * the storefront offer it), {@link #posStatus} (vendor sync state), {@link #packState}
 * (cause of the last transition) and {@link #delistReason} (set only while inactive).
 * Once INACTIVE a pack is never reactivated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeatPack {

    private String internalPackId;
    private String performanceId;
    private String eventId;

    private String zoneId;
    private String levelId;
    private String sectionId;
    private String rowLabel;
    private String startSeatNumber;
    private String endSeatNumber;

    private int packSize;
    private BigDecimal packPrice;
    private BigDecimal totalPrice;

    @Builder.Default
    private List<String> seatKeys = new ArrayList<>();

    /** Packs this one was derived from. Empty for organic creations. */
    @Builder.Default
    private List<String> sourcePackIds = new ArrayList<>();

    private String sourceWebsite;

    private PackStatus packStatus;
    private PosStatus posStatus;
    private PackState packState;
    private DelistReason delistReason;

    /** Listing may still exist at the vendor and a delete call is owed. */
    private boolean vendorCleanupOwed;

    private String posInventoryId;
    private int posSyncAttempts;
    private LocalDateTime lastPosSyncAttempt;
    private String posSyncError;

    private boolean manuallyDelisted;
    private String manuallyDelistedBy;
    private LocalDateTime manuallyDelistedAt;

    private LocalDateTime delistedAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public List<String> getSeatKeys() {
        return seatKeys != null ? seatKeys : List.of();
    }

    public List<String> getSourcePackIds() {
        return sourcePackIds != null ? sourcePackIds : List.of();
    }

    public boolean isActive() {
        return packStatus == PackStatus.ACTIVE;
    }

    public PackKey key() {
        return PackKey.of(zoneId, rowLabel, startSeatNumber, endSeatNumber);
    }

    public PackLocation location() {
        return PackLocation.of(zoneId, rowLabel);
    }
}
