package com.packsync.unit.pos;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.packsync.config.SweepConfig;
import com.packsync.domain.model.PerformanceContext;
import com.packsync.domain.model.SweepResult;
import com.packsync.lock.PerformanceLockService;
import com.packsync.pos.InventoryPusher;
import com.packsync.pos.PendingPackSweeper;
import com.packsync.service.PerformanceLookupService;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PendingPackSweeperTest {

    private static final PerformanceContext PERF1 =
            PerformanceContext.builder().performanceId("PERF1").posEnabled(true).build();
    private static final PerformanceContext PERF2 =
            PerformanceContext.builder().performanceId("PERF2").posEnabled(true).build();

    @Mock
    private InventoryPusher inventoryPusher;

    @Mock
    private PerformanceLookupService performanceLookupService;

    @Mock
    private PerformanceLockService performanceLockService;

    private SweepConfig sweepConfig;
    private PendingPackSweeper sweeper;

    @BeforeEach
    void setUp() {
        sweepConfig = new SweepConfig();
        sweeper = new PendingPackSweeper(inventoryPusher, performanceLookupService, performanceLockService, sweepConfig);
    }

    @Test
    @DisplayName("Sweeps every POS-enabled performance whose lock is free")
    void sweepsUnlockedPerformances() {
        when(performanceLookupService.findPosEnabled()).thenReturn(List.of(PERF1, PERF2));
        runWhenFree("PERF1");
        when(performanceLockService.executeIfFree(eq("PERF2"), any())).thenReturn(Optional.empty());
        when(inventoryPusher.syncPendingPacks(eq(PERF1), anySet())).thenReturn(SweepResult.empty("PERF1"));

        List<SweepResult> results = sweeper.runSweep();

        assertThat(results).extracting(SweepResult::getPerformanceId).containsExactly("PERF1");
        verify(inventoryPusher, never()).syncPendingPacks(eq(PERF2), anySet());
    }

    @Test
    @DisplayName("A failing performance does not stop the others")
    void failureIsolated() {
        when(performanceLookupService.findPosEnabled()).thenReturn(List.of(PERF1, PERF2));
        runWhenFree("PERF1");
        runWhenFree("PERF2");
        when(inventoryPusher.syncPendingPacks(eq(PERF1), anySet())).thenThrow(new IllegalStateException("db"));
        when(inventoryPusher.syncPendingPacks(eq(PERF2), anySet())).thenReturn(SweepResult.empty("PERF2"));

        List<SweepResult> results = sweeper.runSweep();

        assertThat(results).extracting(SweepResult::getPerformanceId).containsExactly("PERF2");
    }

    @Test
    @DisplayName("Disabled sweep does nothing")
    void disabled() {
        sweepConfig.setEnabled(false);

        assertThat(sweeper.runSweep()).isEmpty();
        verifyNoInteractions(performanceLookupService, performanceLockService, inventoryPusher);
    }

    private void runWhenFree(String performanceId) {
        when(performanceLockService.executeIfFree(eq(performanceId), any()))
                .thenAnswer(invocation -> {
                    Supplier<SweepResult> work = invocation.getArgument(1);
                    return Optional.ofNullable(work.get());
                });
    }
}
