package com.packsync.pos;

import com.packsync.config.SweepConfig;
import com.packsync.domain.model.PerformanceContext;
import com.packsync.domain.model.SweepResult;
import com.packsync.lock.PerformanceLockService;
import com.packsync.service.PerformanceLookupService;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic retry of vendor work left over by earlier passes: pending pushes and owed
 * vendor deletes, for every POS-enabled performance.
 *
 * <p>A performance whose lock is held is skipped for this run; the pass holding it runs
 * its own sweep.
 */
@Component
public class PendingPackSweeper {

    private static final Logger log = LoggerFactory.getLogger(PendingPackSweeper.class);

    private final InventoryPusher inventoryPusher;
    private final PerformanceLookupService performanceLookupService;
    private final PerformanceLockService performanceLockService;
    private final SweepConfig sweepConfig;

    public PendingPackSweeper(
            InventoryPusher inventoryPusher,
            PerformanceLookupService performanceLookupService,
            PerformanceLockService performanceLockService,
            SweepConfig sweepConfig) {
        this.inventoryPusher = inventoryPusher;
        this.performanceLookupService = performanceLookupService;
        this.performanceLockService = performanceLockService;
        this.sweepConfig = sweepConfig;
    }

    @Scheduled(fixedDelayString = "${packsync.sweep.interval-ms:300000}")
    public void sweepAll() {
        runSweep();
    }

    public List<SweepResult> runSweep() {
        if (!sweepConfig.isEnabled()) {
            return Collections.emptyList();
        }

        List<SweepResult> results = new ArrayList<>();
        for (PerformanceContext performance : performanceLookupService.findPosEnabled()) {
            String performanceId = performance.getPerformanceId();
            try {
                Optional<SweepResult> result = performanceLockService.executeIfFree(
                        performanceId, () -> inventoryPusher.syncPendingPacks(performance, Collections.emptySet()));
                if (result.isPresent()) {
                    results.add(result.get());
                } else {
                    log.debug("Performance {} locked, sweep skipped", performanceId);
                }
            } catch (RuntimeException e) {
                log.error("Sweep failed for performance {}: {}", performanceId, e.getMessage(), e);
            }
        }
        return results;
    }
}
