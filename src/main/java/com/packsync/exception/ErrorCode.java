package com.packsync.exception;

/** Failure categories. Per-action failures are recorded; the rest abort their stage. */
public enum ErrorCode {
    /** Candidate or stored pack data that cannot be written or pushed. */
    PACK_VALIDATION_ERROR,
    PACK_NOT_FOUND,
    /** No free pack id within the retry limit. */
    IDENTITY_COLLISION,
    /** Another worker holds the performance, or this worker lost its hold. */
    PERFORMANCE_LOCKED,
    SYNC_EXECUTION_ERROR,
    POS_VENDOR_ERROR
}
