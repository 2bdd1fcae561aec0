package com.packsync.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SweepResult {

    private String performanceId;
    private int pushed;
    private int vendorDeletes;
    private int failed;

    /** Packs left alone because they reached the attempt ceiling. */
    private int skippedMaxAttempts;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public static SweepResult empty(String performanceId) {
        return SweepResult.builder().performanceId(performanceId).build();
    }
}
