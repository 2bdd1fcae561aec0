package com.packsync.domain.enums;

/**
 * Progress marker of one workflow run.
 *
 * <p>Transitions: START -> RECONCILE -> EXECUTE -> PUSH_POS -> SWEEP_PENDING -> DONE.
 * Any stage may move to FAILED. Initial scrapes skip RECONCILE.
 */
public enum WorkflowStage {
    START,
    RECONCILE,
    EXECUTE,
    PUSH_POS,
    SWEEP_PENDING,
    DONE,
    FAILED
}
