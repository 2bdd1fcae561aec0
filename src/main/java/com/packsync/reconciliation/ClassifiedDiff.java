package com.packsync.reconciliation;

import com.packsync.domain.model.CandidatePack;
import com.packsync.domain.model.PackTransformation;
import com.packsync.domain.model.SeatPack;
import java.util.List;
import lombok.Getter;

/**
 * Output of the classification phase of {@link PackReconciler}.
 *
 * <p>Only {@link PackReconciler#classify} creates instances, so a plan can only be built
 * after every vanished and new pack has been assigned to exactly one bucket.
 */
@Getter
public final class ClassifiedDiff {

    private final String performanceId;
    private final boolean posEnabled;
    private final boolean emptyScrape;

    private final List<PackMatch> matches;
    private final List<PackTransformation> transformations;

    /** Existing packs with no counterpart and no transformation. */
    private final List<SeatPack> vanished;

    /** Existing active packs that repeat another pack's seat range. */
    private final List<SeatPack> duplicates;

    /** New packs with no predecessor. */
    private final List<CandidatePack> organic;

    private final List<String> warnings;

    ClassifiedDiff(
            String performanceId,
            boolean posEnabled,
            boolean emptyScrape,
            List<PackMatch> matches,
            List<PackTransformation> transformations,
            List<SeatPack> vanished,
            List<SeatPack> duplicates,
            List<CandidatePack> organic,
            List<String> warnings) {
        this.performanceId = performanceId;
        this.posEnabled = posEnabled;
        this.emptyScrape = emptyScrape;
        this.matches = List.copyOf(matches);
        this.transformations = List.copyOf(transformations);
        this.vanished = List.copyOf(vanished);
        this.duplicates = List.copyOf(duplicates);
        this.organic = List.copyOf(organic);
        this.warnings = List.copyOf(warnings);
    }
}
