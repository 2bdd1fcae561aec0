package com.packsync.reconciliation;

import com.packsync.domain.enums.CreationType;
import com.packsync.domain.enums.DelistReason;
import com.packsync.domain.enums.PackField;
import com.packsync.domain.enums.PosStatus;
import com.packsync.domain.model.CandidatePack;
import com.packsync.domain.model.CreationAction;
import com.packsync.domain.model.DelistAction;
import com.packsync.domain.model.FieldChange;
import com.packsync.domain.model.PackTransformation;
import com.packsync.domain.model.SeatPack;
import com.packsync.domain.model.SyncAction;
import com.packsync.domain.model.SyncPlan;
import com.packsync.domain.model.UpdateAction;
import com.packsync.domain.vo.PackKey;
import com.packsync.domain.vo.PackLocation;
import com.packsync.domain.vo.SeatRange;
import com.packsync.exception.PackValidationException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Computes the minimal, lineage-preserving {@link SyncPlan} between the stored active
 * packs of a performance and the packs produced by its newest scrape.
 *
 * <p>Two phases, both pure:
 * <ol>
 *   <li>{@link #classify} puts every existing pack and every candidate in exactly one bucket:
 *       matched by identity key (zone, row, start seat, end seat), consumed or produced by a
 *       {@link PackTransformation}, vanished, duplicate, or organic.</li>
 *   <li>{@link #buildPlan} turns the buckets into actions. Creations and the delists they
 *       replace come from the same transformation, so lineage ids always point at packs
 *       that exist when the plan is applied.</li>
 * </ol>
 *
 * <p>An empty scrape against a non-empty performance is treated as a failed scrape:
 * the plan carries a warning and no delists.
 *
 * <p>Active packs never overlap. A new candidate that overlaps a retained pack, or an
 * earlier candidate in the same row, is dropped with a warning.
 */
@Component
public class PackReconciler {

    private static final Logger log = LoggerFactory.getLogger(PackReconciler.class);

    private static final Comparator<CandidatePack> CANDIDATE_ORDER = Comparator.comparing(
                    (CandidatePack c) -> nullToEmpty(c.getZoneId()))
            .thenComparing(c -> nullToEmpty(c.getRowLabel()))
            .thenComparing(c -> c.key().getStartSeatNumber(), PackReconciler::compareSeatNumbers)
            .thenComparing(c -> c.key().getEndSeatNumber(), PackReconciler::compareSeatNumbers);

    private final PackComparator packComparator;

    public PackReconciler(PackComparator packComparator) {
        this.packComparator = packComparator;
    }

    /** Classifies and builds in one call. Same inputs always give the same plan. */
    public SyncPlan diff(
            List<SeatPack> existingActivePacks,
            List<CandidatePack> newlyGeneratedPacks,
            boolean posEnabled,
            String performanceId) {
        return buildPlan(classify(existingActivePacks, newlyGeneratedPacks, posEnabled, performanceId));
    }

    /**
     * Plan for the first scrape of a performance: every accepted candidate is an organic
     * creation. Duplicate and overlapping candidates are filtered exactly as in {@link #diff}.
     */
    public SyncPlan initialPlan(List<CandidatePack> candidates, String performanceId) {
        return buildPlan(classify(List.of(), candidates, false, performanceId));
    }

    public ClassifiedDiff classify(
            List<SeatPack> existingActivePacks,
            List<CandidatePack> newlyGeneratedPacks,
            boolean posEnabled,
            String performanceId) {
        List<String> warnings = new ArrayList<>();

        List<SeatPack> existing = new ArrayList<>();
        for (SeatPack pack : existingActivePacks) {
            if (pack.isActive()) {
                existing.add(pack);
            } else {
                log.debug("Ignoring inactive pack {} passed as existing", pack.getInternalPackId());
            }
        }
        existing.sort(Comparator.comparing(SeatPack::getInternalPackId));

        boolean emptyScrape = newlyGeneratedPacks.isEmpty() && !existing.isEmpty();
        if (emptyScrape) {
            warnings.add(String.format(
                    "Empty scrape for performance %s: %d active packs kept, delists suppressed",
                    performanceId, existing.size()));
            log.warn(
                    "Empty scrape for performance {} with {} active packs, treating as failed scrape",
                    performanceId,
                    existing.size());
        }

        Map<PackKey, SeatPack> existingByKey = new LinkedHashMap<>();
        List<SeatPack> duplicates = new ArrayList<>();
        for (SeatPack pack : existing) {
            SeatPack kept = existingByKey.putIfAbsent(pack.key(), pack);
            if (kept != null) {
                duplicates.add(pack);
                warnings.add(String.format(
                        "Pack %s duplicates seat range of %s and will be delisted",
                        pack.getInternalPackId(), kept.getInternalPackId()));
            }
        }

        List<CandidatePack> candidates = new ArrayList<>(newlyGeneratedPacks);
        candidates.sort(CANDIDATE_ORDER.thenComparing(
                CandidatePack::getPackPrice, Comparator.nullsLast(Comparator.<BigDecimal>naturalOrder())));
        Map<PackKey, CandidatePack> candidatesByKey = new LinkedHashMap<>();
        for (CandidatePack candidate : candidates) {
            if (candidatesByKey.putIfAbsent(candidate.key(), candidate) != null) {
                warnings.add("Duplicate candidate for " + describe(candidate.key()) + " ignored");
            }
        }

        List<PackMatch> matches = new ArrayList<>();
        List<CandidatePack> added = new ArrayList<>();
        Set<String> matchedIds = new HashSet<>();
        for (CandidatePack candidate : candidatesByKey.values()) {
            SeatPack match = existingByKey.get(candidate.key());
            if (match != null) {
                matches.add(new PackMatch(match, candidate, detectChanges(match, candidate)));
                matchedIds.add(match.getInternalPackId());
            } else {
                added.add(candidate);
            }
        }

        List<SeatPack> vanished = new ArrayList<>();
        for (SeatPack pack : existingByKey.values()) {
            if (!matchedIds.contains(pack.getInternalPackId())) {
                vanished.add(pack);
            }
        }

        List<PackMatch> retained = retainNonOverlapping(matches, duplicates, warnings);
        List<CandidatePack> accepted = dropOverlapping(added, retained, warnings);

        List<PackTransformation> transformations = packComparator.compare(vanished, accepted);
        Set<String> consumedIds = new HashSet<>();
        Set<CandidatePack> produced = Collections.newSetFromMap(new IdentityHashMap<>());
        for (PackTransformation transformation : transformations) {
            consumedIds.addAll(transformation.getConsumedPackIds());
            produced.addAll(transformation.getResultingPacks());
        }

        List<SeatPack> unexplainedVanished = new ArrayList<>();
        for (SeatPack pack : vanished) {
            if (!consumedIds.contains(pack.getInternalPackId())) {
                unexplainedVanished.add(pack);
            }
        }
        List<CandidatePack> organic = new ArrayList<>();
        for (CandidatePack candidate : accepted) {
            if (!produced.contains(candidate)) {
                organic.add(candidate);
            }
        }

        return new ClassifiedDiff(
                performanceId,
                posEnabled,
                emptyScrape,
                retained,
                transformations,
                unexplainedVanished,
                duplicates,
                organic,
                warnings);
    }

    public SyncPlan buildPlan(ClassifiedDiff diff) {
        List<CreationAction> creations = new ArrayList<>();
        List<UpdateAction> updates = new ArrayList<>();
        List<DelistAction> delists = new ArrayList<>();
        List<SyncAction> syncs = new ArrayList<>();

        for (PackMatch match : diff.getMatches()) {
            SeatPack existing = match.getExisting();
            if (!match.isUnchanged()) {
                updates.add(UpdateAction.builder()
                        .packId(existing.getInternalPackId())
                        .updatedData(match.getCandidate())
                        .changes(match.getChanges())
                        .build());
            } else if (diff.isPosEnabled() && existing.getPosStatus() == PosStatus.PENDING) {
                syncs.add(SyncAction.builder()
                        .packId(existing.getInternalPackId())
                        .packData(match.getCandidate())
                        .build());
            }
        }

        for (PackTransformation transformation : diff.getTransformations()) {
            CreationType creationType = transformation.getType().toCreationType();
            for (CandidatePack resulting : transformation.getResultingPacks()) {
                creations.add(CreationAction.builder()
                        .packData(resulting)
                        .actionType(creationType)
                        .sourcePackIds(transformation.getConsumedPackIds())
                        .build());
            }
            for (String consumedId : transformation.getConsumedPackIds()) {
                delists.add(DelistAction.builder()
                        .packId(consumedId)
                        .reason(DelistReason.TRANSFORMED)
                        .build());
            }
        }

        for (CandidatePack candidate : diff.getOrganic()) {
            creations.add(CreationAction.builder()
                    .packData(candidate)
                    .actionType(CreationType.CREATE)
                    .build());
        }

        List<SeatPack> retired = new ArrayList<>(diff.getVanished());
        retired.addAll(diff.getDuplicates());
        retired.sort(Comparator.comparing(SeatPack::getInternalPackId));
        for (SeatPack pack : retired) {
            delists.add(DelistAction.builder()
                    .packId(pack.getInternalPackId())
                    .reason(DelistReason.VANISHED)
                    .build());
        }

        if (diff.isEmptyScrape()) {
            delists.clear();
        }

        SyncPlan plan = SyncPlan.builder()
                .creations(List.copyOf(creations))
                .updates(List.copyOf(updates))
                .delists(List.copyOf(delists))
                .syncs(List.copyOf(syncs))
                .warnings(diff.getWarnings())
                .emptyScrapeGuarded(diff.isEmptyScrape())
                .build();

        log.info(
                "Plan for performance {}: {} creations, {} updates, {} delists, {} syncs, {} warnings",
                diff.getPerformanceId(),
                creations.size(),
                updates.size(),
                delists.size(),
                syncs.size(),
                plan.getWarnings().size());
        return plan;
    }

    Map<PackField, FieldChange> detectChanges(SeatPack existing, CandidatePack candidate) {
        Map<PackField, FieldChange> changes = new EnumMap<>(PackField.class);
        if (!sameAmount(existing.getPackPrice(), candidate.getPackPrice())) {
            changes.put(PackField.PACK_PRICE, FieldChange.of(existing.getPackPrice(), candidate.getPackPrice()));
        }
        if (!sameAmount(existing.getTotalPrice(), candidate.effectiveTotalPrice())) {
            changes.put(
                    PackField.TOTAL_PRICE, FieldChange.of(existing.getTotalPrice(), candidate.effectiveTotalPrice()));
        }
        if (existing.getPackSize() != candidate.getPackSize()) {
            changes.put(PackField.PACK_SIZE, FieldChange.of(existing.getPackSize(), candidate.getPackSize()));
        }
        if (!new HashSet<>(existing.getSeatKeys()).equals(new HashSet<>(candidate.getSeatKeys()))) {
            changes.put(PackField.SEAT_KEYS, FieldChange.of(existing.getSeatKeys(), candidate.getSeatKeys()));
        }
        return changes;
    }

    /**
     * Stored packs that match the scrape but overlap an earlier match in the same row are
     * moved to {@code duplicates}, so the table converges back to non-overlapping packs.
     */
    private List<PackMatch> retainNonOverlapping(
            List<PackMatch> matches, List<SeatPack> duplicates, List<String> warnings) {
        Map<PackLocation, List<SeatRange>> occupied = new HashMap<>();
        List<PackMatch> retained = new ArrayList<>();
        for (PackMatch match : matches) {
            CandidatePack candidate = match.getCandidate();
            Optional<SeatRange> range = parse(candidate);
            if (range.isPresent()) {
                List<SeatRange> rowRanges = occupied.computeIfAbsent(candidate.location(), k -> new ArrayList<>());
                if (rowRanges.stream().anyMatch(range.get()::overlaps)) {
                    SeatPack existing = match.getExisting();
                    duplicates.add(existing);
                    warnings.add(String.format(
                            "Pack %s overlaps another active pack and will be delisted", existing.getInternalPackId()));
                    log.warn("Stored pack {} overlaps another active pack in {}", existing.getInternalPackId(),
                            candidate.location());
                    continue;
                }
                rowRanges.add(range.get());
            }
            retained.add(match);
        }
        return retained;
    }

    /**
     * Removes candidates that would overlap a retained pack or a candidate accepted before
     * them in the same row. Candidates without a numeric range cannot be checked and pass.
     */
    private List<CandidatePack> dropOverlapping(
            List<CandidatePack> added, List<PackMatch> matches, List<String> warnings) {
        Map<PackLocation, List<SeatRange>> occupied = new HashMap<>();
        for (PackMatch match : matches) {
            CandidatePack retained = match.getCandidate();
            parse(retained).ifPresent(range -> occupied
                    .computeIfAbsent(retained.location(), k -> new ArrayList<>())
                    .add(range));
        }

        List<CandidatePack> accepted = new ArrayList<>();
        for (CandidatePack candidate : added) {
            Optional<SeatRange> range = parse(candidate);
            if (range.isEmpty()) {
                accepted.add(candidate);
                continue;
            }
            List<SeatRange> rowRanges = occupied.computeIfAbsent(candidate.location(), k -> new ArrayList<>());
            boolean overlaps = rowRanges.stream().anyMatch(range.get()::overlaps);
            if (overlaps) {
                warnings.add("Candidate " + describe(candidate.key()) + " overlaps an active pack and was dropped");
                log.warn("Dropping overlapping candidate {}", candidate.key());
            } else {
                rowRanges.add(range.get());
                accepted.add(candidate);
            }
        }
        return accepted;
    }

    private Optional<SeatRange> parse(CandidatePack candidate) {
        try {
            return Optional.of(SeatRange.of(candidate.getStartSeatNumber(), candidate.getEndSeatNumber()));
        } catch (PackValidationException e) {
            return Optional.empty();
        }
    }

    private static boolean sameAmount(BigDecimal left, BigDecimal right) {
        if (left == null || right == null) {
            return Objects.equals(left, right);
        }
        return left.compareTo(right) == 0;
    }

    /** Numeric seats sort numerically and before non-numeric ones. */
    private static int compareSeatNumbers(String left, String right) {
        Integer leftNumber = toNumber(left);
        Integer rightNumber = toNumber(right);
        if (leftNumber != null && rightNumber != null) {
            return Integer.compare(leftNumber, rightNumber);
        }
        if (leftNumber != null) {
            return -1;
        }
        if (rightNumber != null) {
            return 1;
        }
        return left.compareTo(right);
    }

    private static Integer toNumber(String seat) {
        try {
            return Integer.valueOf(seat);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String describe(PackKey key) {
        return String.format(
                "zone %s row %s seats %s-%s",
                key.getZoneId(), key.getRowLabel(), key.getStartSeatNumber(), key.getEndSeatNumber());
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
