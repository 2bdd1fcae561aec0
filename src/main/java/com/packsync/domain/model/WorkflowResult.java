package com.packsync.domain.model;

import com.packsync.domain.enums.WorkflowScenario;
import com.packsync.domain.enums.WorkflowStage;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Unified result of one reconcile-and-sync pass for a performance.
 *
 * <p>{@code success} is false when an executor action failed, a vendor push or delete
 * failed, or the pass ended in {@link WorkflowStage#FAILED}. Warnings never affect it.
 */
@Data
@Builder
public class WorkflowResult {

    private boolean success;
    private String performanceId;
    private String operationId;
    private WorkflowScenario scenario;
    private WorkflowStage finalStage;

    private int totalPacksProcessed;
    private int packsCreated;
    private int packsUpdated;
    private int packsDelisted;
    private int packsSynced;

    private int posInventoriesCreated;
    private int packsSyncedToPos;
    private int posDelistings;

    /** Set when the scrape came back empty and delists were withheld. */
    private boolean emptyScrapeGuarded;

    private SyncExecutionSummary executionSummary;
    private long executionTimeMs;

    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    @Builder.Default
    private List<String> errorMessages = new ArrayList<>();

    public static WorkflowResult failed(String performanceId, String operationId, String errorMessage) {
        WorkflowResult result = WorkflowResult.builder()
                .success(false)
                .performanceId(performanceId)
                .operationId(operationId)
                .finalStage(WorkflowStage.FAILED)
                .build();
        result.getErrorMessages().add(errorMessage);
        return result;
    }
}
