package com.packsync.domain.model;

import com.packsync.domain.enums.CreationType;
import com.packsync.domain.enums.SyncActionType;
import lombok.Builder;
import lombok.Value;

/** Outcome of applying one plan action. */
@Value
@Builder
public class ExecutionResult {

    boolean success;
    SyncActionType actionType;

    /** Set for CREATE results only. */
    CreationType creationType;

    /** The pack acted on. For creations, the id that was allocated. */
    String packId;

    /** Informational note on successful no-op outcomes, e.g. an already inactive pack. */
    String message;

    String errorMessage;

    public static ExecutionResult success(SyncActionType type, String packId) {
        return ExecutionResult.builder().success(true).actionType(type).packId(packId).build();
    }

    public static ExecutionResult failure(SyncActionType type, String packId, String errorMessage) {
        return ExecutionResult.builder()
                .success(false)
                .actionType(type)
                .packId(packId)
                .errorMessage(errorMessage)
                .build();
    }
}
