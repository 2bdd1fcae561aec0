package com.packsync.exception;

import java.util.Map;

/** Plan execution hit a storage fault and the whole transaction was rolled back. */
public class SyncExecutionException extends BaseException {

    public SyncExecutionException(String message, String performanceId, Throwable cause) {
        super(ErrorCode.SYNC_EXECUTION_ERROR, message, Map.of("performanceId", performanceId), cause);
    }
}
