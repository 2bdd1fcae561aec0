package com.packsync.pos;

import com.packsync.config.PosApiConfig;
import com.packsync.config.SweepConfig;
import com.packsync.domain.enums.PackStatus;
import com.packsync.domain.enums.PosStatus;
import com.packsync.domain.model.BulkInventoryResult;
import com.packsync.domain.model.DelistResult;
import com.packsync.domain.model.PerformanceContext;
import com.packsync.domain.model.SeatPack;
import com.packsync.domain.model.SweepResult;
import com.packsync.domain.model.SyncAction;
import com.packsync.domain.model.SyncExecutionSummary;
import com.packsync.domain.model.SyncPlan;
import com.packsync.exception.PackValidationException;
import com.packsync.exception.PosVendorException;
import com.packsync.exception.SyncExecutionException;
import com.packsync.mapper.SeatPackMapper;
import com.packsync.repository.jpa.SeatPackJpaRepository;
import com.packsync.sync.SyncExecutor;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/**
 * Pushes committed packs to the POS vendor and removes vendor listings of retired packs.
 *
 * <p>Every vendor call is per pack and its outcome is recorded per pack; nothing here fails
 * a batch. Confirmed pushes are committed through {@link SyncExecutor} as sync actions.
 * A failed push increments the pack's attempt counter and leaves it PENDING for the sweep.
 *
 * <p>Local state always wins: a failed vendor delete leaves the pack inactive locally and
 * only keeps its vendor cleanup owed.
 */
@Service
public class InventoryPusher {

    private static final Logger log = LoggerFactory.getLogger(InventoryPusher.class);

    private final PosGateway posGateway;
    private final PosPushValidator posPushValidator;
    private final SyncExecutor syncExecutor;
    private final SeatPackJpaRepository seatPackJpaRepository;
    private final PosApiConfig posApiConfig;
    private final SweepConfig sweepConfig;
    private final SeatPackMapper seatPackMapper = Mappers.getMapper(SeatPackMapper.class);

    public InventoryPusher(
            PosGateway posGateway,
            PosPushValidator posPushValidator,
            SyncExecutor syncExecutor,
            SeatPackJpaRepository seatPackJpaRepository,
            PosApiConfig posApiConfig,
            SweepConfig sweepConfig) {
        this.posGateway = posGateway;
        this.posPushValidator = posPushValidator;
        this.syncExecutor = syncExecutor;
        this.seatPackJpaRepository = seatPackJpaRepository;
        this.posApiConfig = posApiConfig;
        this.sweepConfig = sweepConfig;
    }

    /** True when vendor calls are allowed for this performance. */
    public boolean isPosActive(PerformanceContext performance) {
        return posApiConfig.isEnabled() && performance.isPosEnabled();
    }

    /**
     * Pushes each pack to the vendor, then commits every confirmed push in one transaction.
     * The packs must already be committed locally.
     */
    public BulkInventoryResult createBulkInventory(List<SeatPack> newPacks, PerformanceContext performance) {
        BulkInventoryResult result = BulkInventoryResult.empty();
        if (newPacks.isEmpty()) {
            return result;
        }
        if (!isPosActive(performance)) {
            log.info("POS disabled for performance {}, {} packs left pending", performance.getPerformanceId(),
                    newPacks.size());
            return result;
        }

        List<SyncAction> confirmed = new ArrayList<>();
        for (SeatPack pack : newPacks) {
            result.setAttempted(result.getAttempted() + 1);
            result.getAttemptedPackIds().add(pack.getInternalPackId());
            try {
                posPushValidator.validate(pack);
                String inventoryId = posGateway.push(pack, performance);
                result.getInventoryIds().put(pack.getInternalPackId(), inventoryId);
                confirmed.add(SyncAction.builder()
                        .packId(pack.getInternalPackId())
                        .vendorInventoryId(inventoryId)
                        .build());
            } catch (PackValidationException | PosVendorException e) {
                recordFailure(result, pack, e.getMessage());
            }
        }

        commitConfirmedPushes(confirmed, performance, result);
        result.setSuccessfulCreations(result.getInventoryIds().size());
        log.info(
                "Vendor push for performance {}: {} attempted, {} created, {} failed",
                performance.getPerformanceId(),
                result.getAttempted(),
                result.getSuccessfulCreations(),
                result.getFailedCreations());
        return result;
    }

    /**
     * Removes vendor listings of inactive packs that still owe a vendor delete.
     * Packs with nothing owed are skipped.
     */
    public DelistResult delistSeatPacks(List<SeatPack> packs) {
        DelistResult result = DelistResult.empty();
        if (!posApiConfig.isEnabled()) {
            log.info("POS API disabled, {} vendor deletes deferred", packs.size());
            return result;
        }

        for (SeatPack pack : packs) {
            if (!pack.isVendorCleanupOwed()) {
                continue;
            }
            try {
                posGateway.delist(pack);
                seatPackJpaRepository.markVendorDeleted(pack.getInternalPackId(), LocalDateTime.now());
                result.setDelistedCount(result.getDelistedCount() + 1);
            } catch (PosVendorException e) {
                result.setFailedCount(result.getFailedCount() + 1);
                result.getErrors().add(pack.getInternalPackId() + ": " + e.getMessage());
                seatPackJpaRepository.recordPosSyncFailure(pack.getInternalPackId(), e.getMessage(), LocalDateTime.now());
                log.warn("Vendor delete failed for pack {}: {}", pack.getInternalPackId(), e.getMessage());
            }
        }
        return result;
    }

    /** Loads packs by id and removes their vendor listings. */
    public DelistResult delistSeatPacksById(List<String> packIds) {
        if (packIds.isEmpty()) {
            return DelistResult.empty();
        }
        return delistSeatPacks(seatPackMapper.toDomainList(seatPackJpaRepository.findAllById(packIds)));
    }

    /**
     * One sweep over a performance: pushes PENDING active packs and deletes vendor listings
     * still owed by inactive packs, at most {@code batchSize} of each. Packs in
     * {@code excludedPackIds} were handled earlier in the same pass and are left alone.
     */
    public SweepResult syncPendingPacks(PerformanceContext performance, Set<String> excludedPackIds) {
        String performanceId = performance.getPerformanceId();
        SweepResult sweep = SweepResult.empty(performanceId);
        if (!isPosActive(performance)) {
            return sweep;
        }

        int fetchSize = sweepConfig.getBatchSize() + excludedPackIds.size();
        List<SeatPack> pending = selectForSweep(
                seatPackMapper.toDomainList(seatPackJpaRepository.findSweepCandidates(
                        performanceId, PackStatus.ACTIVE, PosStatus.PENDING, PageRequest.of(0, fetchSize))),
                excludedPackIds,
                sweep);
        List<SeatPack> cleanup = selectForSweep(
                seatPackMapper.toDomainList(seatPackJpaRepository.findVendorCleanupCandidates(
                        performanceId, PackStatus.INACTIVE, PageRequest.of(0, fetchSize))),
                excludedPackIds,
                sweep);

        if (!pending.isEmpty()) {
            BulkInventoryResult pushed = createBulkInventory(pending, performance);
            sweep.setPushed(pushed.getSuccessfulCreations());
            sweep.setFailed(sweep.getFailed() + pushed.getFailedCreations());
            sweep.getErrors().addAll(pushed.getErrors());
        }
        if (!cleanup.isEmpty()) {
            DelistResult deleted = delistSeatPacks(cleanup);
            sweep.setVendorDeletes(deleted.getDelistedCount());
            sweep.setFailed(sweep.getFailed() + deleted.getFailedCount());
            sweep.getErrors().addAll(deleted.getErrors());
        }

        if (sweep.getPushed() + sweep.getVendorDeletes() + sweep.getFailed() + sweep.getSkippedMaxAttempts() > 0) {
            log.info(
                    "Sweep for performance {}: {} pushed, {} vendor deletes, {} failed, {} at attempt limit",
                    performanceId,
                    sweep.getPushed(),
                    sweep.getVendorDeletes(),
                    sweep.getFailed(),
                    sweep.getSkippedMaxAttempts());
        }
        return sweep;
    }

    private List<SeatPack> selectForSweep(List<SeatPack> candidates, Set<String> excludedPackIds, SweepResult sweep) {
        List<SeatPack> selected = new ArrayList<>();
        for (SeatPack pack : candidates) {
            if (excludedPackIds.contains(pack.getInternalPackId())) {
                continue;
            }
            if (pack.getPosSyncAttempts() >= sweepConfig.getMaxAttempts()) {
                sweep.setSkippedMaxAttempts(sweep.getSkippedMaxAttempts() + 1);
                continue;
            }
            if (selected.size() < sweepConfig.getBatchSize()) {
                selected.add(pack);
            }
        }
        return selected;
    }

    private void commitConfirmedPushes(
            List<SyncAction> confirmed, PerformanceContext performance, BulkInventoryResult result) {
        if (confirmed.isEmpty()) {
            return;
        }
        try {
            SyncExecutionSummary summary = syncExecutor.execute(SyncPlan.syncOnly(confirmed), performance, false);
            result.getErrors().addAll(summary.getErrors());
        } catch (SyncExecutionException e) {
            // Listings exist at the vendor but are not recorded; keep their ids in the error for follow-up.
            log.error("Could not record {} confirmed vendor listings for performance {}: {}", confirmed.size(),
                    performance.getPerformanceId(), result.getInventoryIds(), e);
            result.getErrors().add("Failed to record vendor listings " + result.getInventoryIds() + ": "
                    + e.getMessage());
            result.setFailedCreations(result.getFailedCreations() + confirmed.size());
            result.getInventoryIds().clear();
        }
    }

    private void recordFailure(BulkInventoryResult result, SeatPack pack, String message) {
        result.setFailedCreations(result.getFailedCreations() + 1);
        result.getErrors().add(pack.getInternalPackId() + ": " + message);
        seatPackJpaRepository.recordPosSyncFailure(pack.getInternalPackId(), message, LocalDateTime.now());
        log.warn("Vendor push failed for pack {}: {}", pack.getInternalPackId(), message);
    }
}
