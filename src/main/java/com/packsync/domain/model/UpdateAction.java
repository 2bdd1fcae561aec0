package com.packsync.domain.model;

import com.packsync.domain.enums.PackField;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** In-place change of an existing pack. Only the fields in {@link #changes} are written. */
@Value
@Builder
public class UpdateAction {

    String packId;
    CandidatePack updatedData;
    Map<PackField, FieldChange> changes;
}
