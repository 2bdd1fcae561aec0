package com.packsync.domain.enums;

public enum WorkflowScenario {
    /** No active packs exist for the performance yet. Never produces delists. */
    INITIAL_SCRAPE,
    SUBSEQUENT_SCRAPE
}
