package com.packsync.reconciliation;

import com.packsync.domain.enums.TransformationType;
import com.packsync.domain.model.CandidatePack;
import com.packsync.domain.model.PackTransformation;
import com.packsync.domain.model.SeatPack;
import com.packsync.domain.vo.PackLocation;
import com.packsync.domain.vo.SeatRange;
import com.packsync.exception.PackValidationException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Detects structural relationships between packs that vanished since the last scrape
 * and packs that newly appeared.
 *
 * <p>Packs are only compared within the same (zone, row). Inside a row, vanished and new
 * packs form a bipartite graph whose edges are seat-range overlaps; each connected
 * component with at least one edge becomes one {@link PackTransformation}:
 * <ul>
 *   <li>SPLIT: one vanished pack whose range is covered by the union of two or more new packs</li>
 *   <li>MERGE: two or more vanished packs all contained in a single new pack</li>
 *   <li>SHRINK: one vanished pack, one new pack that is a strict subset of it</li>
 *   <li>TRANSFORMED: any other overlapping shape</li>
 * </ul>
 *
 * <p>Packs whose seat numbers do not parse as a range take no part in any relationship.
 * Pure: no I/O, and the output order depends only on the input values.
 */
@Component
public class PackComparator {

    private static final Logger log = LoggerFactory.getLogger(PackComparator.class);

    private static final Comparator<PackLocation> LOCATION_ORDER = Comparator.comparing(
                    (PackLocation location) -> nullToEmpty(location.getZoneId()))
            .thenComparing(location -> nullToEmpty(location.getRowLabel()));

    public List<PackTransformation> compare(List<SeatPack> vanishedPacks, List<CandidatePack> newPacks) {
        Map<PackLocation, List<RangedPack<SeatPack>>> vanishedByLocation = new TreeMap<>(LOCATION_ORDER);
        for (SeatPack pack : vanishedPacks) {
            rangeOf(pack.getStartSeatNumber(), pack.getEndSeatNumber(), pack.getInternalPackId())
                    .ifPresent(range -> vanishedByLocation
                            .computeIfAbsent(pack.location(), k -> new ArrayList<>())
                            .add(new RangedPack<>(pack, range)));
        }

        Map<PackLocation, List<RangedPack<CandidatePack>>> newByLocation = new TreeMap<>(LOCATION_ORDER);
        for (CandidatePack pack : newPacks) {
            rangeOf(pack.getStartSeatNumber(), pack.getEndSeatNumber(), "candidate " + pack.key())
                    .ifPresent(range -> newByLocation
                            .computeIfAbsent(pack.location(), k -> new ArrayList<>())
                            .add(new RangedPack<>(pack, range)));
        }

        List<PackTransformation> transformations = new ArrayList<>();
        for (Map.Entry<PackLocation, List<RangedPack<SeatPack>>> entry : vanishedByLocation.entrySet()) {
            List<RangedPack<CandidatePack>> rowCandidates = newByLocation.get(entry.getKey());
            if (rowCandidates == null) {
                continue;
            }
            List<RangedPack<SeatPack>> rowVanished = new ArrayList<>(entry.getValue());
            rowVanished.sort(Comparator.comparing(p -> p.pack().getInternalPackId()));
            List<RangedPack<CandidatePack>> rowNew = new ArrayList<>(rowCandidates);
            rowNew.sort(Comparator.comparingInt((RangedPack<CandidatePack> p) -> p.range().getStart())
                    .thenComparingInt(p -> p.range().getEndExclusive()));
            transformations.addAll(compareRow(entry.getKey(), rowVanished, rowNew));
        }

        log.debug(
                "Compared {} vanished and {} new packs: {} transformations",
                vanishedPacks.size(),
                newPacks.size(),
                transformations.size());
        return transformations;
    }

    /** Classifies one connected component. Both lists are non-empty and sorted. */
    TransformationType classify(List<SeatRange> vanishedRanges, List<SeatRange> newRanges) {
        if (vanishedRanges.size() == 1 && newRanges.size() >= 2) {
            return SeatRange.unionCovers(newRanges, vanishedRanges.get(0))
                    ? TransformationType.SPLIT
                    : TransformationType.TRANSFORMED;
        }
        if (vanishedRanges.size() >= 2 && newRanges.size() == 1) {
            SeatRange merged = newRanges.get(0);
            return vanishedRanges.stream().allMatch(merged::contains)
                    ? TransformationType.MERGE
                    : TransformationType.TRANSFORMED;
        }
        if (vanishedRanges.size() == 1 && newRanges.size() == 1) {
            return newRanges.get(0).isStrictSubsetOf(vanishedRanges.get(0))
                    ? TransformationType.SHRINK
                    : TransformationType.TRANSFORMED;
        }
        return TransformationType.TRANSFORMED;
    }

    private List<PackTransformation> compareRow(
            PackLocation location, List<RangedPack<SeatPack>> vanished, List<RangedPack<CandidatePack>> added) {
        int vanishedCount = vanished.size();
        int total = vanishedCount + added.size();
        // Nodes 0..vanishedCount-1 are vanished packs, the rest are new packs.
        List<List<Integer>> edges = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            edges.add(new ArrayList<>());
        }
        for (int v = 0; v < vanishedCount; v++) {
            for (int n = 0; n < added.size(); n++) {
                if (vanished.get(v).range().overlaps(added.get(n).range())) {
                    edges.get(v).add(vanishedCount + n);
                    edges.get(vanishedCount + n).add(v);
                }
            }
        }

        List<PackTransformation> transformations = new ArrayList<>();
        boolean[] visited = new boolean[total];
        for (int start = 0; start < vanishedCount; start++) {
            if (visited[start] || edges.get(start).isEmpty()) {
                continue;
            }
            List<Integer> vanishedNodes = new ArrayList<>();
            List<Integer> newNodes = new ArrayList<>();
            Deque<Integer> queue = new ArrayDeque<>();
            queue.add(start);
            visited[start] = true;
            while (!queue.isEmpty()) {
                int node = queue.poll();
                if (node < vanishedCount) {
                    vanishedNodes.add(node);
                } else {
                    newNodes.add(node - vanishedCount);
                }
                for (int next : edges.get(node)) {
                    if (!visited[next]) {
                        visited[next] = true;
                        queue.add(next);
                    }
                }
            }
            vanishedNodes.sort(Integer::compareTo);
            newNodes.sort(Integer::compareTo);
            transformations.add(toTransformation(location, vanished, added, vanishedNodes, newNodes));
        }
        return transformations;
    }

    private PackTransformation toTransformation(
            PackLocation location,
            List<RangedPack<SeatPack>> vanished,
            List<RangedPack<CandidatePack>> added,
            List<Integer> vanishedNodes,
            List<Integer> newNodes) {
        List<SeatRange> vanishedRanges = new ArrayList<>();
        List<String> consumedIds = new ArrayList<>();
        for (int index : vanishedNodes) {
            vanishedRanges.add(vanished.get(index).range());
            consumedIds.add(vanished.get(index).pack().getInternalPackId());
        }
        List<SeatRange> newRanges = new ArrayList<>();
        List<CandidatePack> resulting = new ArrayList<>();
        for (int index : newNodes) {
            newRanges.add(added.get(index).range());
            resulting.add(added.get(index).pack());
        }

        TransformationType type = classify(vanishedRanges, newRanges);
        log.debug("{} in zone {} row {}: {} -> {} new packs", type, location.getZoneId(), location.getRowLabel(),
                consumedIds, resulting.size());
        return PackTransformation.builder()
                .type(type)
                .location(location)
                .consumedPackIds(List.copyOf(consumedIds))
                .resultingPacks(List.copyOf(resulting))
                .build();
    }

    private Optional<SeatRange> rangeOf(String startSeat, String endSeat, String label) {
        try {
            return Optional.of(SeatRange.of(startSeat, endSeat));
        } catch (PackValidationException e) {
            log.debug("Seat range of {} not comparable ({}), treating as unrelated", label, e.getMessage());
            return Optional.empty();
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private record RangedPack<T>(T pack, SeatRange range) {}
}
