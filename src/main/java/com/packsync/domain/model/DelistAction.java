package com.packsync.domain.model;

import com.packsync.domain.enums.DelistReason;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DelistAction {

    String packId;
    DelistReason reason;

    /** Operator name for manual delists, null otherwise. */
    String requestedBy;
}
