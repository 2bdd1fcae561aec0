package com.packsync.exception;

import java.util.Map;

public class PackNotFoundException extends BaseException {

    public PackNotFoundException(String packId) {
        super(ErrorCode.PACK_NOT_FOUND, "Seat pack not found: " + packId, Map.of("packId", packId));
    }
}
