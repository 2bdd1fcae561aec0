package com.packsync.exception;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import lombok.Getter;

/**
 * Root of the packsync failures. Carries an {@link ErrorCode} and the context values
 * (pack id, performance id, offending field) that {@link #describe()} appends to the message.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of(), null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        this(errorCode, message, details, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details == null || details.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(details));
    }

    /** Message followed by the details in key order, e.g. {@code Pack size must be positive [packSize=0]}. */
    public String describe() {
        if (details.isEmpty()) {
            return getMessage();
        }
        StringBuilder sb = new StringBuilder(getMessage()).append(" [");
        details.forEach((key, value) -> sb.append(key).append('=').append(value).append(", "));
        sb.setLength(sb.length() - 2);
        return sb.append(']').toString();
    }
}
