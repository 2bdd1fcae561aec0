package com.packsync.domain.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.Data;

/** Outcome of pushing a batch of packs to the vendor. Never thrown as a batch failure. */
@Data
@Builder
public class BulkInventoryResult {

    private int attempted;
    private int successfulCreations;
    private int failedCreations;

    /** Pack id to vendor inventory id, for confirmed pushes. */
    @Builder.Default
    private Map<String, String> inventoryIds = new LinkedHashMap<>();

    @Builder.Default
    private Set<String> attemptedPackIds = new LinkedHashSet<>();

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public boolean hasFailures() {
        return failedCreations > 0;
    }

    public static BulkInventoryResult empty() {
        return BulkInventoryResult.builder().build();
    }
}
