package com.packsync.reconciliation;

import com.packsync.domain.enums.PackField;
import com.packsync.domain.model.CandidatePack;
import com.packsync.domain.model.FieldChange;
import com.packsync.domain.model.SeatPack;
import java.util.Map;
import lombok.Value;

/** An existing pack and the candidate with the same identity key. */
@Value
public class PackMatch {

    SeatPack existing;
    CandidatePack candidate;

    /** Empty when the structural signature is unchanged. */
    Map<PackField, FieldChange> changes;

    public boolean isUnchanged() {
        return changes.isEmpty();
    }
}
