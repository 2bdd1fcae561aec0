package com.packsync.domain.model;

import com.packsync.domain.enums.CreationType;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * The ordered set of changes that brings stored packs in line with one scrape.
 *
 * <p>Creations and the delists they replace come from the same transformation pass,
 * so lineage ids on a creation always name packs that exist when the plan is applied.
 * Immutable once built.
 */
@Getter
@Builder(toBuilder = true)
public class SyncPlan {

    @Builder.Default
    private final List<CreationAction> creations = List.of();

    @Builder.Default
    private final List<UpdateAction> updates = List.of();

    @Builder.Default
    private final List<DelistAction> delists = List.of();

    @Builder.Default
    private final List<SyncAction> syncs = List.of();

    @Builder.Default
    private final List<String> warnings = List.of();

    /** Set when the scrape came back empty and delists were withheld. */
    private final boolean emptyScrapeGuarded;

    public static SyncPlan empty() {
        return SyncPlan.builder().build();
    }

    /** Plain organic creations, no filtering. The reconciler builds real first-scrape plans. */
    public static SyncPlan creationsOnly(List<CandidatePack> candidates) {
        List<CreationAction> creations = new ArrayList<>(candidates.size());
        for (CandidatePack candidate : candidates) {
            creations.add(CreationAction.builder()
                    .packData(candidate)
                    .actionType(CreationType.CREATE)
                    .build());
        }
        return SyncPlan.builder().creations(List.copyOf(creations)).build();
    }

    public static SyncPlan syncOnly(List<SyncAction> syncs) {
        return SyncPlan.builder().syncs(List.copyOf(syncs)).build();
    }

    public static SyncPlan delistOnly(List<DelistAction> delists) {
        return SyncPlan.builder().delists(List.copyOf(delists)).build();
    }

    /** The structural part of the plan, applied in the EXECUTE stage. */
    public SyncPlan withoutSyncActions() {
        return toBuilder().syncs(List.of()).build();
    }

    public int totalActions() {
        return creations.size() + updates.size() + delists.size() + syncs.size();
    }

    public int structuralActions() {
        return creations.size() + updates.size() + delists.size();
    }

    public boolean isEmpty() {
        return totalActions() == 0;
    }
}
