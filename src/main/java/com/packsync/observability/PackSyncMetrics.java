package com.packsync.observability;

import com.packsync.domain.model.WorkflowResult;
import com.packsync.domain.enums.WorkflowStage;
import com.packsync.event.PackSyncEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for reconcile-and-sync passes, exposed through the actuator:
 * <ul>
 *   <li><b>packsync.packs.created/updated/delisted</b> (counters): committed pack changes</li>
 *   <li><b>packsync.pos.inventories.created</b> (counter): confirmed vendor listings</li>
 *   <li><b>packsync.pos.failures</b> (counter): passes with at least one vendor failure</li>
 *   <li><b>packsync.passes.failed</b> (counter): passes that ended in FAILED</li>
 *   <li><b>packsync.empty.scrape.guards</b> (counter): empty scrapes whose delists were withheld</li>
 *   <li><b>packsync.pass.duration</b> (timer)</li>
 * </ul>
 * Updated from {@link PackSyncEvent}.
 */
@Service
public class PackSyncMetrics {

    private static final Logger log = LoggerFactory.getLogger(PackSyncMetrics.class);

    private final Counter packsCreatedCounter;
    private final Counter packsUpdatedCounter;
    private final Counter packsDelistedCounter;
    private final Counter posInventoriesCreatedCounter;
    private final Counter posFailureCounter;
    private final Counter failedPassCounter;
    private final Counter emptyScrapeGuardCounter;
    private final Timer passTimer;

    public PackSyncMetrics(MeterRegistry meterRegistry) {
        this.packsCreatedCounter = Counter.builder("packsync.packs.created")
                .description("Seat packs created")
                .register(meterRegistry);
        this.packsUpdatedCounter = Counter.builder("packsync.packs.updated")
                .description("Seat packs updated in place")
                .register(meterRegistry);
        this.packsDelistedCounter = Counter.builder("packsync.packs.delisted")
                .description("Seat packs retired")
                .register(meterRegistry);
        this.posInventoriesCreatedCounter = Counter.builder("packsync.pos.inventories.created")
                .description("Vendor listings confirmed")
                .register(meterRegistry);
        this.posFailureCounter = Counter.builder("packsync.pos.failures")
                .description("Passes with failed vendor calls")
                .register(meterRegistry);
        this.failedPassCounter = Counter.builder("packsync.passes.failed")
                .description("Passes that ended in the FAILED stage")
                .register(meterRegistry);
        this.emptyScrapeGuardCounter = Counter.builder("packsync.empty.scrape.guards")
                .description("Empty scrapes whose delists were withheld")
                .register(meterRegistry);
        this.passTimer = Timer.builder("packsync.pass.duration")
                .description("Duration of one reconcile-and-sync pass")
                .register(meterRegistry);
    }

    @EventListener
    @Order(20)
    public void onPackSync(PackSyncEvent event) {
        WorkflowResult result = event.getResult();
        packsCreatedCounter.increment(result.getPacksCreated());
        packsUpdatedCounter.increment(result.getPacksUpdated());
        packsDelistedCounter.increment(result.getPacksDelisted());
        posInventoriesCreatedCounter.increment(result.getPosInventoriesCreated());
        passTimer.record(result.getExecutionTimeMs(), TimeUnit.MILLISECONDS);

        if (result.isEmptyScrapeGuarded()) {
            emptyScrapeGuardCounter.increment();
        }
        if (result.getFinalStage() == WorkflowStage.FAILED) {
            failedPassCounter.increment();
            log.warn("Pass for performance {} failed: {}", result.getPerformanceId(), result.getErrorMessages());
        } else if (!result.isSuccess()) {
            posFailureCounter.increment();
        }
    }
}
