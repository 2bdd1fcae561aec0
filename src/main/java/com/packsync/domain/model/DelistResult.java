package com.packsync.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/** Outcome of removing vendor listings. Local records are inactive regardless. */
@Data
@Builder
public class DelistResult {

    private int delistedCount;
    private int failedCount;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public static DelistResult empty() {
        return DelistResult.builder().build();
    }
}
