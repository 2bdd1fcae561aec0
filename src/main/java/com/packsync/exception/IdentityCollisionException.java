package com.packsync.exception;

import java.util.Map;

/** No free pack identifier could be allocated within the configured retry limit. */
public class IdentityCollisionException extends BaseException {

    public IdentityCollisionException(String performanceId, int attempts) {
        super(
                ErrorCode.IDENTITY_COLLISION,
                "Could not allocate a unique pack id for performance " + performanceId + " after " + attempts
                        + " attempts",
                Map.of("performanceId", performanceId, "attempts", attempts));
    }
}
