package com.packsync.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * A pack that needs, or has just received, a vendor listing.
 *
 * <p>Emitted by the reconciler without {@link #vendorInventoryId} as a push request.
 * Applied by the executor once the push is confirmed, carrying the vendor's id.
 */
@Value
@Builder
public class SyncAction {

    String packId;
    CandidatePack packData;
    String vendorInventoryId;
}
