package com.packsync.repository.jpa;

import com.packsync.domain.enums.PackStatus;
import com.packsync.domain.enums.PosStatus;
import com.packsync.entity.SeatPackEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * JPA repository for the seat_packs table.
 * Active packs per performance feed the reconciler; pending and cleanup-owed packs feed the sweep.
 */
@Repository
public interface SeatPackJpaRepository extends JpaRepository<SeatPackEntity, String> {

    List<SeatPackEntity> findByPerformanceIdAndPackStatusOrderByInternalPackIdAsc(
            String performanceId, PackStatus packStatus);

    boolean existsByPerformanceIdAndPackStatus(String performanceId, PackStatus packStatus);

    /** Every row ever stored for the performance, active or not. Seeds the id sequence. */
    long countByPerformanceId(String performanceId);

    /** Sweep candidates in a given state, fewest attempts first, then oldest. */
    @Query("SELECT p FROM SeatPackEntity p WHERE p.performanceId = :performanceId"
            + " AND p.packStatus = :packStatus AND p.posStatus = :posStatus"
            + " ORDER BY p.posSyncAttempts ASC, p.createdAt ASC")
    List<SeatPackEntity> findSweepCandidates(
            @Param("performanceId") String performanceId,
            @Param("packStatus") PackStatus packStatus,
            @Param("posStatus") PosStatus posStatus,
            Pageable pageable);

    /** Inactive packs whose vendor listing still has to be deleted. */
    @Query("SELECT p FROM SeatPackEntity p WHERE p.performanceId = :performanceId"
            + " AND p.packStatus = :packStatus AND p.syncedToPos = false"
            + " ORDER BY p.posSyncAttempts ASC, p.createdAt ASC")
    List<SeatPackEntity> findVendorCleanupCandidates(
            @Param("performanceId") String performanceId,
            @Param("packStatus") PackStatus packStatus,
            Pageable pageable);

    /** Records a failed vendor call without touching the lifecycle columns. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE SeatPackEntity p SET p.posSyncAttempts = p.posSyncAttempts + 1, p.posSyncError = :error,"
            + " p.lastPosSyncAttempt = :attemptedAt WHERE p.internalPackId = :id")
    int recordPosSyncFailure(
            @Param("id") String id, @Param("error") String error, @Param("attemptedAt") LocalDateTime attemptedAt);

    /** The vendor confirmed the listing is gone; nothing more is owed for this pack. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE SeatPackEntity p SET p.syncedToPos = true, p.posSyncError = null,"
            + " p.lastPosSyncAttempt = :deletedAt WHERE p.internalPackId = :id")
    int markVendorDeleted(@Param("id") String id, @Param("deletedAt") LocalDateTime deletedAt);
}
