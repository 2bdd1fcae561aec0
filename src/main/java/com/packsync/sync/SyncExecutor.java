package com.packsync.sync;

import com.packsync.config.SyncExecutorConfig;
import com.packsync.domain.enums.DelistReason;
import com.packsync.domain.enums.PackField;
import com.packsync.domain.enums.PackStatus;
import com.packsync.domain.enums.PosStatus;
import com.packsync.domain.enums.SyncActionType;
import com.packsync.domain.model.CandidatePack;
import com.packsync.domain.model.CreationAction;
import com.packsync.domain.model.DelistAction;
import com.packsync.domain.model.ExecutionResult;
import com.packsync.domain.model.PerformanceContext;
import com.packsync.domain.model.SeatPack;
import com.packsync.domain.model.SyncAction;
import com.packsync.domain.model.SyncExecutionSummary;
import com.packsync.domain.model.SyncPlan;
import com.packsync.domain.model.UpdateAction;
import com.packsync.entity.SeatPackEntity;
import com.packsync.exception.IdentityCollisionException;
import com.packsync.exception.PackNotFoundException;
import com.packsync.exception.PackValidationException;
import com.packsync.exception.SyncExecutionException;
import com.packsync.mapper.JsonHelper;
import com.packsync.mapper.PosSyncFlagAdapter;
import com.packsync.mapper.SeatPackMapper;
import com.packsync.repository.jpa.SeatPackJpaRepository;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Applies a {@link SyncPlan} to the seat_packs table inside one transaction.
 *
 * <p>Actions run in a fixed order: creations, updates, delists, syncs. Each action is
 * validated and checked for existence before anything is written, so a rejected action
 * (bad data, id collision, missing pack) is recorded and its siblings still apply. Any
 * other failure rolls back the whole plan and surfaces as {@link SyncExecutionException}.
 *
 * <p>Delist transitions:
 * <ul>
 *   <li>listed at the vendor (ACTIVE/SYNCED) becomes INACTIVE with a vendor delete owed</li>
 *   <li>never listed (PENDING) becomes INACTIVE with nothing owed</li>
 *   <li>already INACTIVE is a successful no-op</li>
 * </ul>
 * A pack is never moved from INACTIVE back to ACTIVE.
 */
@Service
public class SyncExecutor {

    private static final Logger log = LoggerFactory.getLogger(SyncExecutor.class);

    private final SeatPackJpaRepository seatPackJpaRepository;
    private final PackIdGenerator packIdGenerator;
    private final SyncExecutorConfig syncExecutorConfig;
    private final TransactionTemplate transactionTemplate;
    private final SeatPackMapper seatPackMapper = Mappers.getMapper(SeatPackMapper.class);

    public SyncExecutor(
            SeatPackJpaRepository seatPackJpaRepository,
            PackIdGenerator packIdGenerator,
            SyncExecutorConfig syncExecutorConfig,
            PlatformTransactionManager transactionManager) {
        this.seatPackJpaRepository = seatPackJpaRepository;
        this.packIdGenerator = packIdGenerator;
        this.syncExecutorConfig = syncExecutorConfig;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout(syncExecutorConfig.getTransactionTimeoutSeconds());
    }

    /**
     * Applies the plan atomically.
     *
     * @param initialScrape when true every delist action is skipped
     * @throws SyncExecutionException when the transaction had to be rolled back
     */
    public SyncExecutionSummary execute(SyncPlan plan, PerformanceContext performance, boolean initialScrape) {
        long startTime = System.currentTimeMillis();
        String performanceId = performance.getPerformanceId();
        if (plan.isEmpty()) {
            log.debug("Nothing to execute for performance {}", performanceId);
            return SyncExecutionSummary.empty();
        }

        SyncExecutionSummary summary;
        try {
            summary = transactionTemplate.execute(status -> applyPlan(plan, performance, initialScrape));
        } catch (RuntimeException e) {
            log.error("Plan execution for performance {} rolled back: {}", performanceId, e.getMessage(), e);
            throw new SyncExecutionException(
                    "Plan execution rolled back for performance " + performanceId + ": " + e.getMessage(),
                    performanceId,
                    e);
        }

        summary.setExecutionTimeMs(System.currentTimeMillis() - startTime);
        log.info(
                "Executed plan for performance {}: {} created, {} updated, {} delisted, {} synced, {} failed ({}ms)",
                performanceId,
                summary.getCreatedPacks(),
                summary.getUpdatedPacks(),
                summary.getDelistedPacks(),
                summary.getSyncedPacks(),
                summary.getFailedActions(),
                summary.getExecutionTimeMs());
        return summary;
    }

    private SyncExecutionSummary applyPlan(SyncPlan plan, PerformanceContext performance, boolean initialScrape) {
        LocalDateTime now = LocalDateTime.now();
        List<ExecutionResult> results = new ArrayList<>();
        int skippedDelists = 0;

        if (!plan.getCreations().isEmpty()) {
            PackIdGenerator.Sequence sequence = packIdGenerator.sequenceFor(performance.getPerformanceId());
            for (CreationAction action : plan.getCreations()) {
                results.add(applyCreation(action, performance, sequence, now));
            }
        }
        for (UpdateAction action : plan.getUpdates()) {
            results.add(applyUpdate(action, now));
        }
        if (initialScrape) {
            skippedDelists = plan.getDelists().size();
            if (skippedDelists > 0) {
                log.info("Initial scrape: skipping {} delist actions", skippedDelists);
            }
        } else {
            for (DelistAction action : plan.getDelists()) {
                results.add(applyDelist(action, now));
            }
        }
        for (SyncAction action : plan.getSyncs()) {
            results.add(applySync(action, now));
        }

        return summarize(results, skippedDelists);
    }

    private ExecutionResult applyCreation(
            CreationAction action, PerformanceContext performance, PackIdGenerator.Sequence sequence,
            LocalDateTime now) {
        try {
            CandidatePack data = action.getPackData();
            validateCandidate(data);
            String packId = sequence.nextId();

            SeatPack pack = SeatPack.builder()
                    .internalPackId(packId)
                    .performanceId(performance.getPerformanceId())
                    .eventId(performance.getEventId())
                    .zoneId(data.getZoneId())
                    .levelId(data.getLevelId())
                    .sectionId(data.getSectionId())
                    .rowLabel(data.getRowLabel())
                    .startSeatNumber(data.getStartSeatNumber())
                    .endSeatNumber(data.getEndSeatNumber())
                    .packSize(data.getPackSize())
                    .packPrice(data.getPackPrice())
                    .totalPrice(data.effectiveTotalPrice())
                    .seatKeys(new ArrayList<>(data.getSeatKeys()))
                    .sourcePackIds(new ArrayList<>(action.getSourcePackIds()))
                    .sourceWebsite(syncExecutorConfig.getSourceWebsite())
                    .packStatus(PackStatus.ACTIVE)
                    .posStatus(PosStatus.PENDING)
                    .packState(action.getActionType().toPackState())
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            seatPackJpaRepository.save(seatPackMapper.toEntity(pack));

            log.debug("Created pack {} ({}, sources {})", packId, action.getActionType(), action.getSourcePackIds());
            return ExecutionResult.builder()
                    .success(true)
                    .actionType(SyncActionType.CREATE)
                    .creationType(action.getActionType())
                    .packId(packId)
                    .build();
        } catch (PackValidationException | IdentityCollisionException e) {
            log.warn("Creation rejected ({}): {}", action.getActionType(), e.describe());
            return ExecutionResult.builder()
                    .success(false)
                    .actionType(SyncActionType.CREATE)
                    .creationType(action.getActionType())
                    .errorMessage(e.describe())
                    .build();
        }
    }

    private ExecutionResult applyUpdate(UpdateAction action, LocalDateTime now) {
        try {
            SeatPackEntity entity = loadActive(action.getPackId());
            CandidatePack data = action.getUpdatedData();
            validateChanges(action, data);
            for (PackField field : action.getChanges().keySet()) {
                switch (field) {
                    case PACK_PRICE -> entity.setPackPrice(data.getPackPrice());
                    case TOTAL_PRICE -> entity.setTotalPrice(data.effectiveTotalPrice());
                    case PACK_SIZE -> entity.setPackSize(data.getPackSize());
                    case SEAT_KEYS -> entity.setSeatKeys(JsonHelper.stringListToJson(data.getSeatKeys()));
                }
            }
            entity.setUpdatedAt(now);
            seatPackJpaRepository.save(entity);
            log.debug("Updated pack {}: {}", action.getPackId(), action.getChanges().keySet());
            return ExecutionResult.success(SyncActionType.UPDATE, action.getPackId());
        } catch (PackValidationException | PackNotFoundException e) {
            log.warn("Update of pack {} rejected: {}", action.getPackId(), e.describe());
            return ExecutionResult.failure(SyncActionType.UPDATE, action.getPackId(), e.describe());
        }
    }

    private ExecutionResult applyDelist(DelistAction action, LocalDateTime now) {
        SeatPackEntity entity = seatPackJpaRepository.findById(action.getPackId()).orElse(null);
        if (entity == null) {
            return ExecutionResult.failure(
                    SyncActionType.DELIST, action.getPackId(), "Seat pack not found: " + action.getPackId());
        }
        if (entity.getPackStatus() == PackStatus.INACTIVE) {
            return ExecutionResult.builder()
                    .success(true)
                    .actionType(SyncActionType.DELIST)
                    .packId(action.getPackId())
                    .message("Pack already inactive")
                    .build();
        }

        boolean vendorCleanupOwed = entity.getPosStatus().isListedAtVendor() || entity.getPosInventoryId() != null;
        DelistReason reason = action.getReason();
        entity.setPackStatus(PackStatus.INACTIVE);
        entity.setPosStatus(PosStatus.INACTIVE);
        entity.setDelistReason(reason);
        entity.setPackState(reason.toPackState());
        entity.setDelistedAt(now);
        entity.setUpdatedAt(now);
        if (reason == DelistReason.MANUAL_DELIST) {
            entity.setManuallyDelisted(true);
            entity.setManuallyDelistedBy(action.getRequestedBy());
            entity.setManuallyDelistedAt(now);
        }
        PosSyncFlagAdapter.apply(entity, vendorCleanupOwed);
        seatPackJpaRepository.save(entity);

        log.debug("Delisted pack {} ({}), vendor cleanup owed: {}", action.getPackId(), reason, vendorCleanupOwed);
        return ExecutionResult.success(SyncActionType.DELIST, action.getPackId());
    }

    private ExecutionResult applySync(SyncAction action, LocalDateTime now) {
        SeatPackEntity entity = seatPackJpaRepository.findById(action.getPackId()).orElse(null);
        if (entity == null) {
            return ExecutionResult.failure(
                    SyncActionType.SYNC, action.getPackId(), "Seat pack not found: " + action.getPackId());
        }

        String inventoryId = action.getVendorInventoryId() != null
                ? action.getVendorInventoryId()
                : entity.getPosInventoryId();

        if (entity.getPackStatus() == PackStatus.INACTIVE) {
            // Listed after the pack was retired: the new vendor listing has to be removed again.
            entity.setPosInventoryId(inventoryId);
            entity.setLastPosSyncAttempt(now);
            PosSyncFlagAdapter.apply(entity, true);
            seatPackJpaRepository.save(entity);
            return ExecutionResult.builder()
                    .success(true)
                    .actionType(SyncActionType.SYNC)
                    .packId(action.getPackId())
                    .message("Pack inactive, vendor listing queued for deletion")
                    .build();
        }

        if (entity.getPosStatus() == PosStatus.SYNCED && Objects.equals(entity.getPosInventoryId(), inventoryId)) {
            return ExecutionResult.builder()
                    .success(true)
                    .actionType(SyncActionType.SYNC)
                    .packId(action.getPackId())
                    .message("Pack already synced")
                    .build();
        }

        entity.setPosStatus(PosStatus.SYNCED);
        entity.setPosInventoryId(inventoryId);
        entity.setPosSyncError(null);
        entity.setLastPosSyncAttempt(now);
        entity.setUpdatedAt(now);
        PosSyncFlagAdapter.apply(entity, false);
        seatPackJpaRepository.save(entity);
        return ExecutionResult.success(SyncActionType.SYNC, action.getPackId());
    }

    private SeatPackEntity loadActive(String packId) {
        SeatPackEntity entity =
                seatPackJpaRepository.findById(packId).orElseThrow(() -> new PackNotFoundException(packId));
        if (entity.getPackStatus() != PackStatus.ACTIVE) {
            throw new PackValidationException("Pack " + packId + " is inactive", Map.of("packId", packId));
        }
        return entity;
    }

    /** Checked before the managed entity is touched, so a rejected update leaves it clean. */
    private void validateChanges(UpdateAction action, CandidatePack data) {
        if (data == null || action.getChanges() == null || action.getChanges().isEmpty()) {
            throw new PackValidationException("Update carries no changes");
        }
        if (action.getChanges().containsKey(PackField.PACK_PRICE)) {
            requirePositive(data.getPackPrice(), "pack price");
            requireStorable(data.getPackPrice(), "pack price");
        }
        if (action.getChanges().containsKey(PackField.TOTAL_PRICE)) {
            requireStorable(data.effectiveTotalPrice(), "total price");
        }
        if (action.getChanges().containsKey(PackField.PACK_SIZE) && data.getPackSize() <= 0) {
            throw new PackValidationException("Pack size must be positive", Map.of("packSize", data.getPackSize()));
        }
    }

    private void validateCandidate(CandidatePack data) {
        if (data == null) {
            throw new PackValidationException("Pack data is missing");
        }
        if (isBlank(data.getZoneId()) || isBlank(data.getRowLabel())) {
            throw new PackValidationException("Zone and row are required");
        }
        if (isBlank(data.getStartSeatNumber()) || isBlank(data.getEndSeatNumber())) {
            throw new PackValidationException("Start and end seat are required");
        }
        if (data.getPackSize() <= 0) {
            throw new PackValidationException("Pack size must be positive", Map.of("packSize", data.getPackSize()));
        }
        requirePositive(data.getPackPrice(), "pack price");
        requireStorable(data.getPackPrice(), "pack price");
        requireStorable(data.effectiveTotalPrice(), "total price");
        requireLength(data.getZoneId(), SeatPackEntity.LOCATION_ID_LENGTH, "zoneId");
        requireLength(data.getLevelId(), SeatPackEntity.LOCATION_ID_LENGTH, "levelId");
        requireLength(data.getSectionId(), SeatPackEntity.LOCATION_ID_LENGTH, "sectionId");
        requireLength(data.getRowLabel(), SeatPackEntity.ROW_LABEL_LENGTH, "rowLabel");
        requireLength(data.getStartSeatNumber(), SeatPackEntity.SEAT_NUMBER_LENGTH, "startSeatNumber");
        requireLength(data.getEndSeatNumber(), SeatPackEntity.SEAT_NUMBER_LENGTH, "endSeatNumber");
    }

    /** Values the seat_packs columns would reject at flush time, failing the whole plan. */
    private static void requireLength(String value, int maxLength, String field) {
        if (value != null && value.length() > maxLength) {
            throw new PackValidationException(
                    field + " exceeds " + maxLength + " characters", Map.of(field, value));
        }
    }

    private static void requireStorable(BigDecimal amount, String label) {
        if (amount == null) {
            return;
        }
        BigDecimal normalized = amount.stripTrailingZeros();
        int integerDigits = normalized.precision() - normalized.scale();
        if (normalized.scale() > SeatPackEntity.PRICE_SCALE
                || integerDigits > SeatPackEntity.PRICE_PRECISION - SeatPackEntity.PRICE_SCALE) {
            throw new PackValidationException("Unstorable " + label + ": " + amount, Map.of(label, amount));
        }
    }

    private static void requirePositive(BigDecimal amount, String label) {
        if (amount == null || amount.signum() <= 0) {
            throw new PackValidationException("Invalid " + label + ": " + amount);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private SyncExecutionSummary summarize(List<ExecutionResult> results, int skippedDelists) {
        SyncExecutionSummary summary = SyncExecutionSummary.builder()
                .totalActions(results.size())
                .skippedDelists(skippedDelists)
                .results(results)
                .build();
        for (ExecutionResult result : results) {
            if (!result.isSuccess()) {
                summary.setFailedActions(summary.getFailedActions() + 1);
                summary.getErrors().add(describeFailure(result));
                continue;
            }
            summary.setSuccessfulActions(summary.getSuccessfulActions() + 1);
            if (result.getMessage() != null) {
                continue;
            }
            switch (result.getActionType()) {
                case CREATE -> summary.setCreatedPacks(summary.getCreatedPacks() + 1);
                case UPDATE -> summary.setUpdatedPacks(summary.getUpdatedPacks() + 1);
                case DELIST -> summary.setDelistedPacks(summary.getDelistedPacks() + 1);
                case SYNC -> summary.setSyncedPacks(summary.getSyncedPacks() + 1);
            }
        }
        return summary;
    }

    private static String describeFailure(ExecutionResult result) {
        String target = result.getPackId() != null ? " " + result.getPackId() : "";
        return result.getActionType() + target + ": " + result.getErrorMessage();
    }
}
