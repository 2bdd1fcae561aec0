package com.packsync.exception;

import java.util.Map;

public class PerformanceLockException extends BaseException {

    public PerformanceLockException(String performanceId, long waitedMs) {
        super(
                ErrorCode.PERFORMANCE_LOCKED,
                "Performance " + performanceId + " is being reconciled by another worker",
                Map.of("performanceId", performanceId, "waitedMs", waitedMs));
    }
}
