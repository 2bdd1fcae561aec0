package com.packsync.domain.model;

import com.packsync.domain.enums.TransformationType;
import com.packsync.domain.vo.PackLocation;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** A structural relationship between vanished packs and the new packs that replace them. */
@Value
@Builder
public class PackTransformation {

    TransformationType type;
    PackLocation location;

    /** Ids of the existing packs consumed, sorted. */
    List<String> consumedPackIds;

    List<CandidatePack> resultingPacks;
}
