package com.packsync.service;

import com.packsync.domain.enums.DelistReason;
import com.packsync.domain.enums.PackStatus;
import com.packsync.domain.model.AdminActionResult;
import com.packsync.domain.model.DelistAction;
import com.packsync.domain.model.DelistResult;
import com.packsync.domain.model.PerformanceContext;
import com.packsync.domain.model.SyncExecutionSummary;
import com.packsync.domain.model.SyncPlan;
import com.packsync.entity.SeatPackEntity;
import com.packsync.exception.PackNotFoundException;
import com.packsync.lock.PerformanceLockService;
import com.packsync.pos.InventoryPusher;
import com.packsync.repository.jpa.SeatPackJpaRepository;
import com.packsync.sync.SyncExecutor;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Operator actions on stored packs. Each runs under the performance lock, commits the local
 * delist first and then removes vendor listings best-effort.
 */
@Service
public class SeatPackAdminService {

    private static final Logger log = LoggerFactory.getLogger(SeatPackAdminService.class);

    private final SeatPackJpaRepository seatPackJpaRepository;
    private final SyncExecutor syncExecutor;
    private final InventoryPusher inventoryPusher;
    private final PerformanceLookupService performanceLookupService;
    private final PerformanceLockService performanceLockService;

    public SeatPackAdminService(
            SeatPackJpaRepository seatPackJpaRepository,
            SyncExecutor syncExecutor,
            InventoryPusher inventoryPusher,
            PerformanceLookupService performanceLookupService,
            PerformanceLockService performanceLockService) {
        this.seatPackJpaRepository = seatPackJpaRepository;
        this.syncExecutor = syncExecutor;
        this.inventoryPusher = inventoryPusher;
        this.performanceLookupService = performanceLookupService;
        this.performanceLockService = performanceLockService;
    }

    /**
     * Retires one pack on an operator's request. The pack is marked manually delisted
     * and will not be pushed again.
     *
     * @throws PackNotFoundException when no such pack exists
     */
    public AdminActionResult manualDelist(String packId, String requestedBy) {
        SeatPackEntity entity =
                seatPackJpaRepository.findById(packId).orElseThrow(() -> new PackNotFoundException(packId));
        String performanceId = entity.getPerformanceId();
        log.info("Manual delist of pack {} requested by {}", packId, requestedBy);

        List<DelistAction> delists = List.of(DelistAction.builder()
                .packId(packId)
                .reason(DelistReason.MANUAL_DELIST)
                .requestedBy(requestedBy)
                .build());
        return performanceLockService.executeWithLock(performanceId, () -> delist(performanceId, delists));
    }

    /**
     * Turns POS off for a performance and retires all of its active packs.
     * Vendor listings are removed while the POS API itself is still enabled.
     */
    public AdminActionResult disablePerformancePos(String performanceId) {
        log.info("Disabling POS for performance {}", performanceId);
        return performanceLockService.executeWithLock(performanceId, () -> {
            List<DelistAction> delists = new ArrayList<>();
            for (SeatPackEntity entity : seatPackJpaRepository.findByPerformanceIdAndPackStatusOrderByInternalPackIdAsc(
                    performanceId, PackStatus.ACTIVE)) {
                delists.add(DelistAction.builder()
                        .packId(entity.getInternalPackId())
                        .reason(DelistReason.PERFORMANCE_DISABLED)
                        .build());
            }
            AdminActionResult result = delist(performanceId, delists);
            if (!performanceLookupService.disablePos(performanceId)) {
                result.getErrors().add("Performance not found: " + performanceId);
            }
            return result;
        });
    }

    private AdminActionResult delist(String performanceId, List<DelistAction> delists) {
        AdminActionResult result = AdminActionResult.builder().performanceId(performanceId).build();
        if (delists.isEmpty()) {
            return result;
        }

        PerformanceContext performance = performanceLookupService.findContext(performanceId)
                .orElseGet(() -> PerformanceContext.builder().performanceId(performanceId).build());
        SyncExecutionSummary summary = syncExecutor.execute(SyncPlan.delistOnly(delists), performance, false);
        result.setPacksDelisted(summary.getDelistedPacks());
        result.getErrors().addAll(summary.getErrors());

        DelistResult vendor = inventoryPusher.delistSeatPacksById(summary.delistedPackIds());
        result.setVendorDeletes(vendor.getDelistedCount());
        result.setVendorFailures(vendor.getFailedCount());
        if (vendor.getFailedCount() > 0) {
            log.warn("{} vendor deletes failed for performance {}, left for the sweep", vendor.getFailedCount(),
                    performanceId);
        }
        log.info("Delisted {} packs of performance {}, {} vendor listings removed", result.getPacksDelisted(),
                performanceId, result.getVendorDeletes());
        return result;
    }
}
