package com.packsync.exception;

import java.util.Map;

/**
 * A pack (candidate or persisted) failed a structural check: non-numeric seat numbers,
 * inverted seat range, missing price, empty seat keys. Handled per action or per pack.
 */
public class PackValidationException extends BaseException {

    public PackValidationException(String message) {
        super(ErrorCode.PACK_VALIDATION_ERROR, message);
    }

    public PackValidationException(String message, Map<String, Object> details) {
        super(ErrorCode.PACK_VALIDATION_ERROR, message, details);
    }
}
