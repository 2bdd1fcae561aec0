package com.packsync.pos;

import com.packsync.domain.model.PerformanceContext;
import com.packsync.domain.model.SeatPack;
import com.packsync.exception.PosVendorException;

/**
 * The POS vendor's inventory API. No consistency with local storage is assumed:
 * every call may fail or time out independently.
 */
public interface PosGateway {

    /**
     * Lists the pack at the vendor.
     *
     * @return the vendor's inventory id
     * @throws PosVendorException when the call fails, times out or returns no inventory id
     */
    String push(SeatPack pack, PerformanceContext performance);

    /**
     * Removes the pack's vendor listing. A listing the vendor no longer knows counts as removed.
     *
     * @throws PosVendorException when the vendor refuses or cannot be reached
     */
    void delist(SeatPack pack);
}
