package com.packsync.unit.pos;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

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
import com.packsync.entity.SeatPackEntity;
import com.packsync.exception.PosVendorException;
import com.packsync.exception.SyncExecutionException;
import com.packsync.pos.InventoryPusher;
import com.packsync.pos.PosGateway;
import com.packsync.pos.PosPushValidator;
import com.packsync.repository.jpa.SeatPackJpaRepository;
import com.packsync.sync.SyncExecutor;
import java.math.BigDecimal;
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
 * Tests for InventoryPusher: per-pack outcome recording, commit of confirmed pushes,
 * best-effort vendor deletes and the pending sweep.
 */
@ExtendWith(MockitoExtension.class)
class InventoryPusherTest {

    private static final PerformanceContext PERFORMANCE =
            PerformanceContext.builder().performanceId("PERF1").posEnabled(true).build();

    @Mock
    private PosGateway posGateway;

    @Mock
    private SyncExecutor syncExecutor;

    @Mock
    private SeatPackJpaRepository seatPackJpaRepository;

    private PosApiConfig posApiConfig;
    private SweepConfig sweepConfig;
    private InventoryPusher inventoryPusher;

    @BeforeEach
    void setUp() {
        posApiConfig = new PosApiConfig();
        sweepConfig = new SweepConfig();
        inventoryPusher = new InventoryPusher(
                posGateway, new PosPushValidator(), syncExecutor, seatPackJpaRepository, posApiConfig, sweepConfig);
    }

    @Nested
    @DisplayName("Bulk push")
    class BulkPush {

        @Test
        @DisplayName("One failed push is recorded per pack and the others are committed as synced")
        void partialFailure() {
            SeatPack p1 = pending("P1");
            SeatPack p2 = pending("P2");
            SeatPack p3 = pending("P3");
            when(posGateway.push(p1, PERFORMANCE)).thenReturn("INV-1");
            when(posGateway.push(p2, PERFORMANCE)).thenThrow(new PosVendorException("HTTP 503", 503));
            when(posGateway.push(p3, PERFORMANCE)).thenReturn("INV-3");
            when(syncExecutor.execute(any(), eq(PERFORMANCE), eq(false))).thenReturn(SyncExecutionSummary.empty());

            BulkInventoryResult result = inventoryPusher.createBulkInventory(List.of(p1, p2, p3), PERFORMANCE);

            assertThat(result.getAttempted()).isEqualTo(3);
            assertThat(result.getSuccessfulCreations()).isEqualTo(2);
            assertThat(result.getFailedCreations()).isEqualTo(1);
            assertThat(result.getErrors()).singleElement().asString().startsWith("P2");
            verify(seatPackJpaRepository).recordPosSyncFailure(eq("P2"), eq("HTTP 503"), any());

            ArgumentCaptor<SyncPlan> captor = ArgumentCaptor.forClass(SyncPlan.class);
            verify(syncExecutor).execute(captor.capture(), eq(PERFORMANCE), eq(false));
            assertThat(captor.getValue().getSyncs())
                    .extracting(SyncAction::getPackId, SyncAction::getVendorInventoryId)
                    .containsExactly(
                            tuple("P1", "INV-1"),
                            tuple("P3", "INV-3"));
        }

        @Test
        @DisplayName("Invalid packs fail without a vendor call")
        void invalidPackNotPushed() {
            SeatPack invalid = pending("P1");
            invalid.setPackPrice(BigDecimal.ZERO);

            BulkInventoryResult result = inventoryPusher.createBulkInventory(List.of(invalid), PERFORMANCE);

            assertThat(result.getFailedCreations()).isEqualTo(1);
            verifyNoInteractions(posGateway, syncExecutor);
        }

        @Test
        @DisplayName("Nothing is pushed when POS is disabled for the performance")
        void posDisabledPerformance() {
            PerformanceContext disabled = PerformanceContext.builder().performanceId("PERF1").build();

            BulkInventoryResult result = inventoryPusher.createBulkInventory(List.of(pending("P1")), disabled);

            assertThat(result.getAttempted()).isZero();
            verifyNoInteractions(posGateway);
        }

        @Test
        @DisplayName("Confirmed pushes that cannot be recorded are reported as failures")
        void commitFailureReported() {
            SeatPack p1 = pending("P1");
            when(posGateway.push(p1, PERFORMANCE)).thenReturn("INV-1");
            when(syncExecutor.execute(any(), eq(PERFORMANCE), eq(false)))
                    .thenThrow(new SyncExecutionException("db down", "PERF1", new IllegalStateException("db down")));

            BulkInventoryResult result = inventoryPusher.createBulkInventory(List.of(p1), PERFORMANCE);

            assertThat(result.getSuccessfulCreations()).isZero();
            assertThat(result.getFailedCreations()).isEqualTo(1);
            assertThat(result.getErrors()).singleElement().asString().contains("INV-1");
        }
    }

    @Nested
    @DisplayName("Vendor deletes")
    class VendorDeletes {

        @Test
        @DisplayName("Only packs owing a vendor delete are called; success clears the debt")
        void deletesOwedOnly() {
            SeatPack owed = retired("P1", true);
            SeatPack clean = retired("P2", false);

            DelistResult result = inventoryPusher.delistSeatPacks(List.of(owed, clean));

            assertThat(result.getDelistedCount()).isEqualTo(1);
            verify(posGateway).delist(owed);
            verify(posGateway, never()).delist(clean);
            verify(seatPackJpaRepository).markVendorDeleted(eq("P1"), any());
        }

        @Test
        @DisplayName("A failed vendor delete keeps the pack inactive and owed")
        void failedDeleteRecorded() {
            SeatPack owed = retired("P1", true);
            doThrow(new PosVendorException("HTTP 500", 500)).when(posGateway).delist(owed);

            DelistResult result = inventoryPusher.delistSeatPacks(List.of(owed));

            assertThat(result.getFailedCount()).isEqualTo(1);
            verify(seatPackJpaRepository).recordPosSyncFailure(eq("P1"), eq("HTTP 500"), any());
            verify(seatPackJpaRepository, never()).markVendorDeleted(anyString(), any());
        }

        @Test
        @DisplayName("With the POS API disabled deletes are deferred")
        void apiDisabledDefers() {
            posApiConfig.setEnabled(false);

            DelistResult result = inventoryPusher.delistSeatPacks(List.of(retired("P1", true)));

            assertThat(result.getDelistedCount()).isZero();
            verifyNoInteractions(posGateway);
        }
    }

    @Nested
    @DisplayName("Sweep")
    class Sweep {

        @Test
        @DisplayName("Sweep skips excluded packs and packs at the attempt limit")
        void sweepSelection() {
            SeatPackEntity fresh = entity("P1", PackStatus.ACTIVE, PosStatus.PENDING, 0);
            SeatPackEntity attempted = entity("P2", PackStatus.ACTIVE, PosStatus.PENDING, 1);
            SeatPackEntity exhausted = entity("P3", PackStatus.ACTIVE, PosStatus.PENDING, 5);
            when(seatPackJpaRepository.findSweepCandidates(eq("PERF1"), eq(PackStatus.ACTIVE), eq(PosStatus.PENDING),
                            any()))
                    .thenReturn(List.of(fresh, attempted, exhausted));
            when(seatPackJpaRepository.findVendorCleanupCandidates(eq("PERF1"), eq(PackStatus.INACTIVE), any()))
                    .thenReturn(List.of());
            when(posGateway.push(any(), eq(PERFORMANCE))).thenReturn("INV-1");
            when(syncExecutor.execute(any(), eq(PERFORMANCE), eq(false))).thenReturn(SyncExecutionSummary.empty());

            SweepResult sweep = inventoryPusher.syncPendingPacks(PERFORMANCE, Set.of("P2"));

            assertThat(sweep.getPushed()).isEqualTo(1);
            assertThat(sweep.getSkippedMaxAttempts()).isEqualTo(1);
            ArgumentCaptor<SeatPack> pushed = ArgumentCaptor.forClass(SeatPack.class);
            verify(posGateway).push(pushed.capture(), eq(PERFORMANCE));
            assertThat(pushed.getValue().getInternalPackId()).isEqualTo("P1");
        }

        @Test
        @DisplayName("Sweep deletes listings still owed by inactive packs")
        void sweepCleansUp() {
            SeatPackEntity owed = entity("P9", PackStatus.INACTIVE, PosStatus.INACTIVE, 0);
            owed.setPosInventoryId("INV-9");
            owed.setSyncedToPos(false);
            when(seatPackJpaRepository.findSweepCandidates(any(), any(), any(), any())).thenReturn(List.of());
            when(seatPackJpaRepository.findVendorCleanupCandidates(eq("PERF1"), eq(PackStatus.INACTIVE), any()))
                    .thenReturn(List.of(owed));

            SweepResult sweep = inventoryPusher.syncPendingPacks(PERFORMANCE, Set.of());

            assertThat(sweep.getVendorDeletes()).isEqualTo(1);
            verify(seatPackJpaRepository).markVendorDeleted(eq("P9"), any());
        }
    }

    private static SeatPack pending(String id) {
        return SeatPack.builder()
                .internalPackId(id)
                .performanceId("PERF1")
                .zoneId("Z")
                .rowLabel("A")
                .startSeatNumber("1")
                .endSeatNumber("2")
                .packSize(2)
                .packPrice(new BigDecimal("50"))
                .seatKeys(List.of("k1", "k2"))
                .packStatus(PackStatus.ACTIVE)
                .posStatus(PosStatus.PENDING)
                .build();
    }

    private static SeatPack retired(String id, boolean cleanupOwed) {
        SeatPack pack = pending(id);
        pack.setPackStatus(PackStatus.INACTIVE);
        pack.setPosStatus(PosStatus.INACTIVE);
        pack.setVendorCleanupOwed(cleanupOwed);
        pack.setPosInventoryId(cleanupOwed ? "INV-" + id : null);
        return pack;
    }

    private static SeatPackEntity entity(String id, PackStatus packStatus, PosStatus posStatus, int attempts) {
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
                .packStatus(packStatus)
                .posStatus(posStatus)
                .posSyncAttempts(attempts)
                .build();
    }
}
