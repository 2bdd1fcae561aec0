package com.packsync.entity;

import com.packsync.domain.enums.DelistReason;
import com.packsync.domain.enums.PackState;
import com.packsync.domain.enums.PackStatus;
import com.packsync.domain.enums.PosStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the seat_packs table.
 *
 * <p>Rows are never deleted. Overlap between active packs is a range relationship and
 * is kept out of the schema; the reconciler guarantees it.
 *
 * <p>{@code synced_to_pos} is the legacy vendor-consistency flag. Only
 * {@link com.packsync.mapper.PosSyncFlagAdapter} reads or writes it.
 */
@Entity
@Table(
        name = "seat_packs",
        indexes = {
            @Index(name = "idx_seat_packs_perf_status", columnList = "internal_performance_id, pack_status"),
            @Index(name = "idx_seat_packs_perf_pos_status", columnList = "internal_performance_id, pos_status")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SeatPackEntity {

    public static final int LOCATION_ID_LENGTH = 100;
    public static final int ROW_LABEL_LENGTH = 20;
    public static final int SEAT_NUMBER_LENGTH = 20;
    public static final int PRICE_PRECISION = 10;
    public static final int PRICE_SCALE = 2;

    @Id
    @Column(name = "internal_pack_id", length = 120)
    private String internalPackId;

    @Column(name = "internal_performance_id", length = 100, nullable = false)
    private String performanceId;

    @Column(name = "internal_event_id", length = 100)
    private String eventId;

    @Column(name = "zone_id", length = LOCATION_ID_LENGTH)
    private String zoneId;

    @Column(name = "level_id", length = LOCATION_ID_LENGTH)
    private String levelId;

    @Column(name = "section_id", length = LOCATION_ID_LENGTH)
    private String sectionId;

    @Column(name = "row_label", length = ROW_LABEL_LENGTH)
    private String rowLabel;

    @Column(name = "start_seat_number", length = SEAT_NUMBER_LENGTH)
    private String startSeatNumber;

    @Column(name = "end_seat_number", length = SEAT_NUMBER_LENGTH)
    private String endSeatNumber;

    @Column(name = "pack_size")
    private int packSize;

    @Column(name = "pack_price", precision = PRICE_PRECISION, scale = PRICE_SCALE)
    private BigDecimal packPrice;

    @Column(name = "total_price", precision = PRICE_PRECISION, scale = PRICE_SCALE)
    private BigDecimal totalPrice;

    /** JSON array of seat identities. */
    @Column(name = "seat_keys", columnDefinition = "TEXT")
    private String seatKeys;

    /** JSON array of predecessor pack ids. */
    @Column(name = "source_pack_ids", columnDefinition = "TEXT")
    private String sourcePackIds;

    @Column(name = "source_website", length = 100)
    private String sourceWebsite;

    @Enumerated(EnumType.STRING)
    @Column(name = "pack_status", nullable = false, columnDefinition = "varchar(20)")
    private PackStatus packStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "pos_status", nullable = false, columnDefinition = "varchar(20)")
    private PosStatus posStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "pack_state", nullable = false, columnDefinition = "varchar(20)")
    private PackState packState;

    @Enumerated(EnumType.STRING)
    @Column(name = "delist_reason", columnDefinition = "varchar(30)")
    private DelistReason delistReason;

    @Column(name = "synced_to_pos")
    private boolean syncedToPos;

    @Column(name = "pos_inventory_id", length = 100)
    private String posInventoryId;

    @Column(name = "pos_sync_attempts")
    private int posSyncAttempts;

    @Column(name = "last_pos_sync_attempt")
    private LocalDateTime lastPosSyncAttempt;

    @Column(name = "pos_sync_error", columnDefinition = "TEXT")
    private String posSyncError;

    @Column(name = "manually_delisted")
    private boolean manuallyDelisted;

    @Column(name = "manually_delisted_by", length = 100)
    private String manuallyDelistedBy;

    @Column(name = "manually_delisted_at")
    private LocalDateTime manuallyDelistedAt;

    @Column(name = "delisted_at")
    private LocalDateTime delistedAt;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Version
    @Column(name = "version")
    private Long version;
}
