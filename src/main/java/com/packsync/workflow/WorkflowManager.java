package com.packsync.workflow;

import com.packsync.domain.enums.NotificationType;
import com.packsync.domain.enums.PackStatus;
import com.packsync.domain.enums.WorkflowScenario;
import com.packsync.domain.enums.WorkflowStage;
import com.packsync.domain.model.BulkInventoryResult;
import com.packsync.domain.model.CandidatePack;
import com.packsync.domain.model.DelistResult;
import com.packsync.domain.model.PerformanceContext;
import com.packsync.domain.model.SeatPack;
import com.packsync.domain.model.SweepResult;
import com.packsync.domain.model.SyncAction;
import com.packsync.domain.model.SyncExecutionSummary;
import com.packsync.domain.model.SyncPlan;
import com.packsync.domain.model.WorkflowResult;
import com.packsync.exception.SyncExecutionException;
import com.packsync.mapper.SeatPackMapper;
import com.packsync.notification.SyncNotification;
import com.packsync.notification.SyncNotifier;
import com.packsync.pos.InventoryPusher;
import com.packsync.reconciliation.PackReconciler;
import com.packsync.repository.jpa.SeatPackJpaRepository;
import com.packsync.sync.SyncExecutor;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one reconcile-and-sync pass for a performance.
 *
 * <p>Stages: START -> RECONCILE -> EXECUTE -> PUSH_POS -> SWEEP_PENDING -> DONE, or FAILED.
 * EXECUTE is one transaction; a failure there rolls everything back. Vendor work after it
 * is best-effort: failures are reported and repaired by later sweeps, never rolled back.
 * No vendor call happens before the EXECUTE commit.
 *
 * <p>Callers must hold the performance lock for the duration of the pass.
 */
@Service
public class WorkflowManager {

    private static final Logger log = LoggerFactory.getLogger(WorkflowManager.class);

    private final PackReconciler packReconciler;
    private final SyncExecutor syncExecutor;
    private final InventoryPusher inventoryPusher;
    private final SeatPackJpaRepository seatPackJpaRepository;
    private final SyncNotifier syncNotifier;
    private final SeatPackMapper seatPackMapper = Mappers.getMapper(SeatPackMapper.class);

    public WorkflowManager(
            PackReconciler packReconciler,
            SyncExecutor syncExecutor,
            InventoryPusher inventoryPusher,
            SeatPackJpaRepository seatPackJpaRepository,
            SyncNotifier syncNotifier) {
        this.packReconciler = packReconciler;
        this.syncExecutor = syncExecutor;
        this.inventoryPusher = inventoryPusher;
        this.seatPackJpaRepository = seatPackJpaRepository;
        this.syncNotifier = syncNotifier;
    }

    /** First scrape of a performance: everything is a creation and nothing is delisted. */
    public WorkflowResult processInitialScrape(List<CandidatePack> newPacks, PerformanceContext performance) {
        return run(WorkflowScenario.INITIAL_SCRAPE, newPacks, performance);
    }

    public WorkflowResult processSubsequentScrape(List<CandidatePack> newPacks, PerformanceContext performance) {
        return run(WorkflowScenario.SUBSEQUENT_SCRAPE, newPacks, performance);
    }

    /** Initial scrape when the performance has no active pack yet, subsequent otherwise. */
    public WorkflowResult processAutoDetectScenario(List<CandidatePack> newPacks, PerformanceContext performance) {
        boolean hasActivePacks =
                seatPackJpaRepository.existsByPerformanceIdAndPackStatus(performance.getPerformanceId(), PackStatus.ACTIVE);
        WorkflowScenario scenario = hasActivePacks ? WorkflowScenario.SUBSEQUENT_SCRAPE : WorkflowScenario.INITIAL_SCRAPE;
        log.info("Performance {} detected as {}", performance.getPerformanceId(), scenario);
        return run(scenario, newPacks, performance);
    }

    private WorkflowResult run(WorkflowScenario scenario, List<CandidatePack> newPacks, PerformanceContext performance) {
        long startTime = System.currentTimeMillis();
        String performanceId = performance.getPerformanceId();
        String operationId = "sync_" + performanceId + "_" + UUID.randomUUID().toString().substring(0, 8);
        boolean initial = scenario == WorkflowScenario.INITIAL_SCRAPE;

        WorkflowResult result = WorkflowResult.builder()
                .performanceId(performanceId)
                .operationId(operationId)
                .scenario(scenario)
                .finalStage(WorkflowStage.START)
                .totalPacksProcessed(newPacks.size())
                .build();
        log.info("[{}] {} for performance {} with {} candidate packs", operationId, scenario, performanceId,
                newPacks.size());
        notify(syncNotifier::syncStarted, notification(NotificationType.SYNC_STARTED, result, performance));

        int posFailures = 0;
        try {
            SyncPlan plan;
            if (initial) {
                // No stored packs to reconcile against; candidates are only deduplicated and overlap-checked.
                plan = packReconciler.initialPlan(newPacks, performanceId);
            } else {
                result.setFinalStage(WorkflowStage.RECONCILE);
                List<SeatPack> existing = seatPackMapper.toDomainList(
                        seatPackJpaRepository.findByPerformanceIdAndPackStatusOrderByInternalPackIdAsc(
                                performanceId, PackStatus.ACTIVE));
                plan = packReconciler.diff(existing, newPacks, inventoryPusher.isPosActive(performance), performanceId);
            }
            result.getWarnings().addAll(plan.getWarnings());
            result.setEmptyScrapeGuarded(plan.isEmptyScrapeGuarded());
            result.setPacksSynced(plan.getSyncs().size());

            result.setFinalStage(WorkflowStage.EXECUTE);
            SyncExecutionSummary summary = syncExecutor.execute(plan.withoutSyncActions(), performance, initial);
            result.setExecutionSummary(summary);
            result.setPacksCreated(summary.getCreatedPacks());
            result.setPacksUpdated(summary.getUpdatedPacks());
            result.setPacksDelisted(summary.getDelistedPacks());
            result.getErrorMessages().addAll(summary.getErrors());

            result.setFinalStage(WorkflowStage.PUSH_POS);
            Set<String> handledPackIds = new HashSet<>();
            if (inventoryPusher.isPosActive(performance)) {
                posFailures += pushNewPacks(plan, summary, performance, result, handledPackIds);
                if (!initial) {
                    posFailures += removeVendorListings(summary, result, handledPackIds);
                }
            } else {
                log.debug("[{}] POS disabled for performance {}, skipping vendor stages", operationId, performanceId);
            }

            result.setFinalStage(WorkflowStage.SWEEP_PENDING);
            SweepResult sweep = inventoryPusher.syncPendingPacks(performance, handledPackIds);
            result.setPacksSyncedToPos(result.getPacksSyncedToPos() + sweep.getPushed());
            result.setPosDelistings(result.getPosDelistings() + sweep.getVendorDeletes());
            if (sweep.getFailed() > 0) {
                posFailures += sweep.getFailed();
                result.getWarnings().add(String.format(
                        "%d earlier pending packs failed again in the sweep", sweep.getFailed()));
                result.getErrorMessages().addAll(sweep.getErrors());
            }

            result.setFinalStage(WorkflowStage.DONE);
        } catch (SyncExecutionException e) {
            result.setFinalStage(WorkflowStage.FAILED);
            result.getErrorMessages().add(e.getMessage());
        } catch (RuntimeException e) {
            log.error("[{}] Pass for performance {} failed in stage {}", operationId, performanceId,
                    result.getFinalStage(), e);
            result.getErrorMessages().add("Failed in stage " + result.getFinalStage() + ": " + e.getMessage());
            result.setFinalStage(WorkflowStage.FAILED);
        }

        SyncExecutionSummary summary = result.getExecutionSummary();
        boolean executed = summary == null || summary.isSuccess();
        result.setSuccess(result.getFinalStage() == WorkflowStage.DONE && executed && posFailures == 0);
        result.setExecutionTimeMs(System.currentTimeMillis() - startTime);

        if (result.getFinalStage() == WorkflowStage.FAILED) {
            notify(syncNotifier::syncFailed, notification(NotificationType.SYNC_FAILED, result, performance));
        } else {
            notify(syncNotifier::syncCompleted, notification(NotificationType.SYNC_COMPLETED, result, performance));
        }

        log.info(
                "[{}] {} for performance {} finished: success={}, stage={}, created={}, updated={}, delisted={},"
                        + " posCreated={}, warnings={}, errors={} ({}ms)",
                operationId,
                scenario,
                performanceId,
                result.isSuccess(),
                result.getFinalStage(),
                result.getPacksCreated(),
                result.getPacksUpdated(),
                result.getPacksDelisted(),
                result.getPosInventoriesCreated(),
                result.getWarnings().size(),
                result.getErrorMessages().size(),
                result.getExecutionTimeMs());
        return result;
    }

    /** Pushes the packs created in EXECUTE plus the plan's pending packs. Returns the failure count. */
    private int pushNewPacks(
            SyncPlan plan,
            SyncExecutionSummary summary,
            PerformanceContext performance,
            WorkflowResult result,
            Set<String> handledPackIds) {
        Set<String> pushIds = new LinkedHashSet<>(summary.createdPackIds());
        for (SyncAction sync : plan.getSyncs()) {
            pushIds.add(sync.getPackId());
        }
        if (pushIds.isEmpty()) {
            return 0;
        }

        List<SeatPack> packs = new ArrayList<>(seatPackMapper.toDomainList(seatPackJpaRepository.findAllById(pushIds)));
        packs.sort(Comparator.comparing(SeatPack::getInternalPackId));
        BulkInventoryResult pushed = inventoryPusher.createBulkInventory(packs, performance);
        handledPackIds.addAll(pushed.getAttemptedPackIds());

        result.setPosInventoriesCreated(pushed.getSuccessfulCreations());
        result.setPacksSyncedToPos(result.getPacksSyncedToPos() + pushed.getSuccessfulCreations());
        if (pushed.hasFailures()) {
            result.getWarnings().add(String.format(
                    "%d of %d POS pushes failed; packs stay pending for the next sweep",
                    pushed.getFailedCreations(), pushed.getAttempted()));
            result.getErrorMessages().addAll(pushed.getErrors());
        }
        return pushed.getFailedCreations();
    }

    private int removeVendorListings(SyncExecutionSummary summary, WorkflowResult result, Set<String> handledPackIds) {
        List<String> delistedIds = summary.delistedPackIds();
        if (delistedIds.isEmpty()) {
            return 0;
        }
        DelistResult removed = inventoryPusher.delistSeatPacksById(delistedIds);
        handledPackIds.addAll(delistedIds);
        result.setPosDelistings(result.getPosDelistings() + removed.getDelistedCount());
        if (removed.getFailedCount() > 0) {
            result.getWarnings().add(String.format(
                    "%d vendor deletes failed; listings stay queued for cleanup", removed.getFailedCount()));
            result.getErrorMessages().addAll(removed.getErrors());
        }
        return removed.getFailedCount();
    }

    private SyncNotification notification(NotificationType type, WorkflowResult result, PerformanceContext performance) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        if (type != NotificationType.SYNC_STARTED) {
            counts.put("created", result.getPacksCreated());
            counts.put("updated", result.getPacksUpdated());
            counts.put("delisted", result.getPacksDelisted());
            counts.put("posCreated", result.getPosInventoriesCreated());
            counts.put("posDelisted", result.getPosDelistings());
        } else {
            counts.put("candidates", result.getTotalPacksProcessed());
        }
        return SyncNotification.builder()
                .operationId(result.getOperationId())
                .type(type)
                .performanceId(result.getPerformanceId())
                .eventName(performance.getEvent() != null ? performance.getEvent().getName() : null)
                .scenario(result.getScenario())
                .counts(counts)
                .errors(new ArrayList<>(result.getErrorMessages()))
                .message(type == NotificationType.SYNC_STARTED ? "Sync started" : "Sync finished: " + result.getFinalStage())
                .timestamp(LocalDateTime.now())
                .build();
    }

    private void notify(Consumer<SyncNotification> channel, SyncNotification notification) {
        try {
            channel.accept(notification);
        } catch (RuntimeException e) {
            log.warn("Notification {} for operation {} failed: {}", notification.getType(),
                    notification.getOperationId(), e.getMessage());
        }
    }
}
