package com.packsync.exception;

import java.util.Map;
import lombok.Getter;

/** A POS vendor call failed, timed out, or returned a response without an inventory id. */
@Getter
public class PosVendorException extends BaseException {

    private final Integer statusCode;

    public PosVendorException(String message) {
        super(ErrorCode.POS_VENDOR_ERROR, message);
        this.statusCode = null;
    }

    public PosVendorException(String message, int statusCode) {
        super(ErrorCode.POS_VENDOR_ERROR, message, Map.of("statusCode", statusCode));
        this.statusCode = statusCode;
    }

    public PosVendorException(String message, Throwable cause) {
        super(ErrorCode.POS_VENDOR_ERROR, message, Map.of(), cause);
        this.statusCode = null;
    }
}
