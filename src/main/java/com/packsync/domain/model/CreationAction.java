package com.packsync.domain.model;

import com.packsync.domain.enums.CreationType;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CreationAction {

    CandidatePack packData;
    CreationType actionType;

    /** Lineage. Empty for {@link CreationType#CREATE}. */
    @Builder.Default
    List<String> sourcePackIds = List.of();
}
