package com.packsync.workflow;

import com.packsync.domain.model.CandidatePack;
import com.packsync.domain.model.PerformanceContext;
import com.packsync.domain.model.WorkflowResult;
import com.packsync.event.PackSyncEvent;
import com.packsync.event.ScrapeCompletedEvent;
import com.packsync.exception.PerformanceLockException;
import com.packsync.lock.PerformanceLockService;
import com.packsync.service.PerformanceLookupService;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Entry point for scrape results. Resolves the performance, takes its lock and runs one
 * pass through {@link WorkflowManager}, then publishes a {@link PackSyncEvent}.
 *
 * <p>A performance that cannot be locked within the configured wait yields a failed result;
 * the next scrape retries it.
 */
@Component
public class PackSyncCoordinator {

    private static final Logger log = LoggerFactory.getLogger(PackSyncCoordinator.class);

    private final WorkflowManager workflowManager;
    private final PerformanceLookupService performanceLookupService;
    private final PerformanceLockService performanceLockService;
    private final ApplicationEventPublisher applicationEventPublisher;

    public PackSyncCoordinator(
            WorkflowManager workflowManager,
            PerformanceLookupService performanceLookupService,
            PerformanceLockService performanceLockService,
            ApplicationEventPublisher applicationEventPublisher) {
        this.workflowManager = workflowManager;
        this.performanceLookupService = performanceLookupService;
        this.performanceLockService = performanceLockService;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @Async("reconcileExecutor")
    @EventListener
    public void onScrapeCompleted(ScrapeCompletedEvent event) {
        synchronize(event.getPerformanceId(), event.getCandidatePacks());
    }

    public WorkflowResult synchronize(String performanceId, List<CandidatePack> candidates) {
        Optional<PerformanceContext> performance = performanceLookupService.findContext(performanceId);
        WorkflowResult result;
        if (performance.isEmpty()) {
            log.error("Scrape received for unknown performance {}", performanceId);
            result = WorkflowResult.failed(performanceId, null, "Performance not found: " + performanceId);
        } else {
            try {
                result = performanceLockService.executeWithLock(
                        performanceId, () -> workflowManager.processAutoDetectScenario(candidates, performance.get()));
            } catch (PerformanceLockException e) {
                log.warn("Skipping pass for performance {}: {}", performanceId, e.getMessage());
                result = WorkflowResult.failed(performanceId, null, e.describe());
            }
        }
        applicationEventPublisher.publishEvent(new PackSyncEvent(this, result));
        return result;
    }
}
