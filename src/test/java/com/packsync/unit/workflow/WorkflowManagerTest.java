package com.packsync.unit.workflow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.packsync.domain.enums.CreationType;
import com.packsync.domain.enums.DelistReason;
import com.packsync.domain.enums.PackState;
import com.packsync.domain.enums.PackStatus;
import com.packsync.domain.enums.PosStatus;
import com.packsync.domain.enums.SyncActionType;
import com.packsync.domain.enums.WorkflowScenario;
import com.packsync.domain.enums.WorkflowStage;
import com.packsync.domain.model.BulkInventoryResult;
import com.packsync.domain.model.CandidatePack;
import com.packsync.domain.model.DelistAction;
import com.packsync.domain.model.DelistResult;
import com.packsync.domain.model.ExecutionResult;
import com.packsync.domain.model.PerformanceContext;
import com.packsync.domain.model.SeatPack;
import com.packsync.domain.model.SweepResult;
import com.packsync.domain.model.SyncExecutionSummary;
import com.packsync.domain.model.SyncPlan;
import com.packsync.domain.model.WorkflowResult;
import com.packsync.entity.SeatPackEntity;
import com.packsync.exception.SyncExecutionException;
import com.packsync.notification.SyncNotification;
import com.packsync.notification.SyncNotifier;
import com.packsync.pos.InventoryPusher;
import com.packsync.reconciliation.PackReconciler;
import com.packsync.repository.jpa.SeatPackJpaRepository;
import com.packsync.sync.SyncExecutor;
import com.packsync.workflow.WorkflowManager;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Tests for WorkflowManager covering scenario dispatch, stage progression,
 * POS failure reporting and notification isolation.
 */
@ExtendWith(MockitoExtension.class)
class WorkflowManagerTest {

    private static final PerformanceContext PERFORMANCE = PerformanceContext.builder()
            .performanceId("PERF1")
            .eventId("EVT1")
            .posEnabled(true)
            .event(PerformanceContext.EventInfo.builder().eventId("EVT1").name("Summer Tour").build())
            .build();

    @Mock
    private PackReconciler packReconciler;

    @Mock
    private SyncExecutor syncExecutor;

    @Mock
    private InventoryPusher inventoryPusher;

    @Mock
    private SeatPackJpaRepository seatPackJpaRepository;

    @Mock
    private SyncNotifier syncNotifier;

    private WorkflowManager workflowManager;

    @BeforeEach
    void setUp() {
        workflowManager = new WorkflowManager(
                packReconciler, syncExecutor, inventoryPusher, seatPackJpaRepository, syncNotifier);
        lenient().when(packReconciler.initialPlan(anyList(), anyString()))
                .thenAnswer(invocation -> SyncPlan.creationsOnly(invocation.getArgument(0)));
    }

    @Nested
    @DisplayName("Initial scrape")
    class InitialScrape {

        @Test
        @DisplayName("Partial POS failure: 3 created, 2 listed, unsuccessful with exactly one warning")
        void partialPosFailure() {
            List<CandidatePack> candidates = List.of(candidate("1", "2"), candidate("3", "4"), candidate("5", "6"));
            when(syncExecutor.execute(any(SyncPlan.class), eq(PERFORMANCE), eq(true)))
                    .thenReturn(createdSummary("P1", "P2", "P3"));
            when(inventoryPusher.isPosActive(PERFORMANCE)).thenReturn(true);
            when(seatPackJpaRepository.findAllById(any()))
                    .thenReturn(List.of(entity("P3"), entity("P1"), entity("P2")));
            BulkInventoryResult pushed = BulkInventoryResult.builder()
                    .attempted(3)
                    .successfulCreations(2)
                    .failedCreations(1)
                    .build();
            pushed.getAttemptedPackIds().addAll(List.of("P1", "P2", "P3"));
            pushed.getErrors().add("P2: HTTP 503");
            when(inventoryPusher.createBulkInventory(anyList(), eq(PERFORMANCE))).thenReturn(pushed);
            when(inventoryPusher.syncPendingPacks(eq(PERFORMANCE), anySet())).thenReturn(SweepResult.empty("PERF1"));

            WorkflowResult result = workflowManager.processInitialScrape(candidates, PERFORMANCE);

            assertThat(result.getScenario()).isEqualTo(WorkflowScenario.INITIAL_SCRAPE);
            assertThat(result.getFinalStage()).isEqualTo(WorkflowStage.DONE);
            assertThat(result.getPacksCreated()).isEqualTo(3);
            assertThat(result.getPosInventoriesCreated()).isEqualTo(2);
            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getWarnings()).hasSize(1);
            assertThat(result.getErrorMessages()).contains("P2: HTTP 503");

            @SuppressWarnings("unchecked")
            ArgumentCaptor<List<SeatPack>> packs = ArgumentCaptor.forClass(List.class);
            verify(inventoryPusher).createBulkInventory(packs.capture(), eq(PERFORMANCE));
            assertThat(packs.getValue()).extracting(SeatPack::getInternalPackId)
                    .containsExactly("P1", "P2", "P3");

            @SuppressWarnings("unchecked")
            ArgumentCaptor<Set<String>> excluded = ArgumentCaptor.forClass(Set.class);
            verify(inventoryPusher).syncPendingPacks(eq(PERFORMANCE), excluded.capture());
            assertThat(excluded.getValue()).containsExactlyInAnyOrder("P1", "P2", "P3");
            verify(packReconciler, never()).diff(anyList(), anyList(), anyBoolean(), any());
        }

        @Test
        @DisplayName("The first scrape is planned by the reconciler, never diffed")
        void initialPlanComesFromReconciler() {
            when(syncExecutor.execute(any(SyncPlan.class), eq(PERFORMANCE), eq(true)))
                    .thenReturn(SyncExecutionSummary.empty());
            when(inventoryPusher.isPosActive(PERFORMANCE)).thenReturn(false);
            when(inventoryPusher.syncPendingPacks(eq(PERFORMANCE), anySet())).thenReturn(SweepResult.empty("PERF1"));

            List<CandidatePack> candidates = List.of(candidate("1", "2"), candidate("3", "4"));
            WorkflowResult result = workflowManager.processInitialScrape(candidates, PERFORMANCE);

            ArgumentCaptor<SyncPlan> plan = ArgumentCaptor.forClass(SyncPlan.class);
            verify(syncExecutor).execute(plan.capture(), eq(PERFORMANCE), eq(true));
            assertThat(plan.getValue().getCreations()).hasSize(2)
                    .allSatisfy(c -> assertThat(c.getActionType()).isEqualTo(CreationType.CREATE));
            assertThat(result.isSuccess()).isTrue();
            verify(packReconciler).initialPlan(candidates, "PERF1");
            verify(packReconciler, never()).diff(anyList(), anyList(), anyBoolean(), any());
            verify(inventoryPusher, never()).createBulkInventory(anyList(), any());
        }
    }

    @Nested
    @DisplayName("Subsequent scrape")
    class SubsequentScrape {

        @Test
        @DisplayName("Delisted packs have their vendor listings removed after commit")
        void delistedPacksRemovedAtVendor() {
            when(seatPackJpaRepository.findByPerformanceIdAndPackStatusOrderByInternalPackIdAsc(
                            "PERF1", PackStatus.ACTIVE))
                    .thenReturn(List.of(entity("P1")));
            when(inventoryPusher.isPosActive(PERFORMANCE)).thenReturn(true);
            SyncPlan plan = SyncPlan.delistOnly(List.of(
                    DelistAction.builder().packId("P1").reason(DelistReason.VANISHED).build()));
            when(packReconciler.diff(anyList(), anyList(), eq(true), eq("PERF1"))).thenReturn(plan);
            SyncExecutionSummary summary = SyncExecutionSummary.builder()
                    .totalActions(1)
                    .successfulActions(1)
                    .delistedPacks(1)
                    .results(new ArrayList<>(List.of(ExecutionResult.success(SyncActionType.DELIST, "P1"))))
                    .build();
            when(syncExecutor.execute(any(SyncPlan.class), eq(PERFORMANCE), eq(false))).thenReturn(summary);
            when(inventoryPusher.delistSeatPacksById(List.of("P1")))
                    .thenReturn(DelistResult.builder().delistedCount(1).build());
            when(inventoryPusher.syncPendingPacks(eq(PERFORMANCE), anySet())).thenReturn(SweepResult.empty("PERF1"));

            WorkflowResult result = workflowManager.processSubsequentScrape(List.of(candidate("9", "10")), PERFORMANCE);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getPacksDelisted()).isEqualTo(1);
            assertThat(result.getPosDelistings()).isEqualTo(1);
        }

        @Test
        @DisplayName("Empty-scrape guard is reported as a warning, not an error")
        void emptyScrapeWarning() {
            when(seatPackJpaRepository.findByPerformanceIdAndPackStatusOrderByInternalPackIdAsc(
                            "PERF1", PackStatus.ACTIVE))
                    .thenReturn(List.of(entity("P1")));
            when(inventoryPusher.isPosActive(PERFORMANCE)).thenReturn(false);
            SyncPlan guarded = SyncPlan.builder()
                    .warnings(List.of("Empty scrape for performance PERF1"))
                    .emptyScrapeGuarded(true)
                    .build();
            when(packReconciler.diff(anyList(), anyList(), eq(false), eq("PERF1"))).thenReturn(guarded);
            when(syncExecutor.execute(any(SyncPlan.class), eq(PERFORMANCE), eq(false)))
                    .thenReturn(SyncExecutionSummary.empty());
            when(inventoryPusher.syncPendingPacks(eq(PERFORMANCE), anySet())).thenReturn(SweepResult.empty("PERF1"));

            WorkflowResult result = workflowManager.processSubsequentScrape(List.of(), PERFORMANCE);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.isEmptyScrapeGuarded()).isTrue();
            assertThat(result.getWarnings()).containsExactly("Empty scrape for performance PERF1");
            assertThat(result.getErrorMessages()).isEmpty();
        }

        @Test
        @DisplayName("A rolled-back EXECUTE fails the pass and skips vendor stages")
        void executeFailureFailsPass() {
            when(seatPackJpaRepository.findByPerformanceIdAndPackStatusOrderByInternalPackIdAsc(
                            "PERF1", PackStatus.ACTIVE))
                    .thenReturn(List.of(entity("P1")));
            when(inventoryPusher.isPosActive(PERFORMANCE)).thenReturn(true);
            when(packReconciler.diff(anyList(), anyList(), eq(true), eq("PERF1")))
                    .thenReturn(SyncPlan.creationsOnly(List.of(candidate("9", "10"))));
            when(syncExecutor.execute(any(SyncPlan.class), eq(PERFORMANCE), eq(false)))
                    .thenThrow(new SyncExecutionException("rolled back", "PERF1", new IllegalStateException()));

            WorkflowResult result = workflowManager.processSubsequentScrape(List.of(candidate("9", "10")), PERFORMANCE);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getFinalStage()).isEqualTo(WorkflowStage.FAILED);
            assertThat(result.getErrorMessages()).containsExactly("rolled back");
            verify(inventoryPusher, never()).createBulkInventory(anyList(), any());
            verify(syncNotifier).syncFailed(any(SyncNotification.class));
        }
    }

    @Nested
    @DisplayName("Dispatch and notifications")
    class Dispatch {

        @Test
        @DisplayName("Auto-detect picks the initial scenario when no active pack exists")
        void autoDetectInitial() {
            when(seatPackJpaRepository.existsByPerformanceIdAndPackStatus("PERF1", PackStatus.ACTIVE))
                    .thenReturn(false);
            when(syncExecutor.execute(any(SyncPlan.class), eq(PERFORMANCE), eq(true)))
                    .thenReturn(SyncExecutionSummary.empty());
            when(inventoryPusher.syncPendingPacks(eq(PERFORMANCE), anySet())).thenReturn(SweepResult.empty("PERF1"));

            WorkflowResult result = workflowManager.processAutoDetectScenario(List.of(candidate("1", "2")), PERFORMANCE);

            assertThat(result.getScenario()).isEqualTo(WorkflowScenario.INITIAL_SCRAPE);
        }

        @Test
        @DisplayName("Auto-detect picks the subsequent scenario when active packs exist")
        void autoDetectSubsequent() {
            when(seatPackJpaRepository.existsByPerformanceIdAndPackStatus("PERF1", PackStatus.ACTIVE))
                    .thenReturn(true);
            when(packReconciler.diff(anyList(), anyList(), anyBoolean(), eq("PERF1"))).thenReturn(SyncPlan.empty());
            when(syncExecutor.execute(any(SyncPlan.class), eq(PERFORMANCE), eq(false)))
                    .thenReturn(SyncExecutionSummary.empty());
            when(inventoryPusher.syncPendingPacks(eq(PERFORMANCE), anySet())).thenReturn(SweepResult.empty("PERF1"));

            WorkflowResult result = workflowManager.processAutoDetectScenario(List.of(candidate("1", "2")), PERFORMANCE);

            assertThat(result.getScenario()).isEqualTo(WorkflowScenario.SUBSEQUENT_SCRAPE);
        }

        @Test
        @DisplayName("A failing notifier never changes the result")
        void notifierFailureIgnored() {
            doThrow(new IllegalStateException("webhook down")).when(syncNotifier).syncStarted(any());
            doThrow(new IllegalStateException("webhook down")).when(syncNotifier).syncCompleted(any());
            when(syncExecutor.execute(any(SyncPlan.class), eq(PERFORMANCE), eq(true)))
                    .thenReturn(SyncExecutionSummary.empty());
            when(inventoryPusher.syncPendingPacks(eq(PERFORMANCE), anySet())).thenReturn(SweepResult.empty("PERF1"));

            WorkflowResult result = workflowManager.processInitialScrape(List.of(candidate("1", "2")), PERFORMANCE);

            assertThat(result.isSuccess()).isTrue();
            ArgumentCaptor<SyncNotification> completed = ArgumentCaptor.forClass(SyncNotification.class);
            verify(syncNotifier).syncCompleted(completed.capture());
            assertThat(completed.getValue().getOperationId()).startsWith("sync_PERF1_");
            assertThat(completed.getValue().getEventName()).isEqualTo("Summer Tour");
        }
    }

    private static SyncExecutionSummary createdSummary(String... packIds) {
        List<ExecutionResult> results = new ArrayList<>();
        for (String packId : packIds) {
            results.add(ExecutionResult.builder()
                    .success(true)
                    .actionType(SyncActionType.CREATE)
                    .creationType(CreationType.CREATE)
                    .packId(packId)
                    .build());
        }
        return SyncExecutionSummary.builder()
                .totalActions(packIds.length)
                .successfulActions(packIds.length)
                .createdPacks(packIds.length)
                .results(results)
                .build();
    }

    private static CandidatePack candidate(String start, String end) {
        return CandidatePack.builder()
                .zoneId("Z")
                .rowLabel("A")
                .startSeatNumber(start)
                .endSeatNumber(end)
                .packSize(2)
                .packPrice(new BigDecimal("50"))
                .seatKeys(List.of("k-" + start, "k-" + end))
                .build();
    }

    private static SeatPackEntity entity(String id) {
        return SeatPackEntity.builder()
                .internalPackId(id)
                .performanceId("PERF1")
                .zoneId("Z")
                .rowLabel("A")
                .startSeatNumber("1")
                .endSeatNumber("2")
                .packSize(2)
                .packPrice(new BigDecimal("50"))
                .seatKeys("[\"k1\",\"k2\"]")
                .packStatus(PackStatus.ACTIVE)
                .posStatus(PosStatus.PENDING)
                .packState(PackState.CREATE)
                .build();
    }
}
