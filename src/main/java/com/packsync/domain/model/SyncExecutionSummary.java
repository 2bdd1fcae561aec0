package com.packsync.domain.model;

import com.packsync.domain.enums.SyncActionType;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Aggregate outcome of one {@code SyncExecutor.execute} call.
 *
 * <p>Success means zero failed actions. Delists skipped on an initial scrape are
 * counted separately and are not failures.
 */
@Data
@Builder
public class SyncExecutionSummary {

    private int totalActions;
    private int successfulActions;
    private int failedActions;

    private int createdPacks;
    private int updatedPacks;
    private int delistedPacks;
    private int syncedPacks;
    private int skippedDelists;

    @Builder.Default
    private List<ExecutionResult> results = new ArrayList<>();

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    private long executionTimeMs;

    public boolean isSuccess() {
        return failedActions == 0;
    }

    public List<String> createdPackIds() {
        return packIds(SyncActionType.CREATE);
    }

    public List<String> delistedPackIds() {
        return packIds(SyncActionType.DELIST);
    }

    private List<String> packIds(SyncActionType type) {
        List<String> ids = new ArrayList<>();
        for (ExecutionResult result : results) {
            if (result.isSuccess() && result.getActionType() == type && result.getMessage() == null) {
                ids.add(result.getPackId());
            }
        }
        return ids;
    }

    public static SyncExecutionSummary empty() {
        return SyncExecutionSummary.builder().build();
    }
}
