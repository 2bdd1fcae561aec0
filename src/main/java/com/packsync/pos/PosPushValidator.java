package com.packsync.pos;

import com.packsync.domain.model.SeatPack;
import com.packsync.exception.PackValidationException;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Rejects packs that must not be listed, before any vendor call is made. */
@Component
public class PosPushValidator {

    public void validate(SeatPack pack) {
        String packId = pack.getInternalPackId();
        if (!pack.isActive()) {
            throw invalid(packId, "pack is not active (" + pack.getPackStatus() + ")");
        }
        if (pack.isManuallyDelisted()) {
            throw invalid(packId, "pack was manually delisted by " + pack.getManuallyDelistedBy());
        }
        if (pack.getPackPrice() == null || pack.getPackPrice().signum() <= 0) {
            throw invalid(packId, "invalid pack price " + pack.getPackPrice());
        }
        if (pack.getPackSize() <= 0) {
            throw invalid(packId, "invalid pack size " + pack.getPackSize());
        }
        if (pack.getSeatKeys().isEmpty()) {
            throw invalid(packId, "no seat keys");
        }
        if (isBlank(pack.getRowLabel()) || isBlank(pack.getStartSeatNumber())) {
            throw invalid(packId, "missing row or seat number");
        }
    }

    private static PackValidationException invalid(String packId, String reason) {
        return new PackValidationException(
                "Pack " + packId + " failed POS validation: " + reason, Map.of("packId", String.valueOf(packId)));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
