package com.packsync.domain.vo;

import com.packsync.exception.PackValidationException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import lombok.Value;

/**
 * Half-open range of seat numbers {@code [start, endExclusive)} within one row.
 *
 * <p>A pack listing seats 101..104 is {@code [101, 105)}. Seat numbers are stored as
 * strings on packs, so {@link #of(String, String)} rejects anything non-numeric.
 */
@Value
public class SeatRange {

    int start;
    int endExclusive;

    /**
     * Parses an inclusive start/end seat pair into a range.
     *
     * @throws PackValidationException when either value is not an integer, end precedes start,
     *     or end is the largest int
     */
    public static SeatRange of(String startSeat, String endSeat) {
        int first = parseSeat(startSeat);
        int last = parseSeat(endSeat);
        if (last < first) {
            throw new PackValidationException(
                    "End seat precedes start seat", Map.of("startSeat", startSeat, "endSeat", endSeat));
        }
        try {
            return new SeatRange(first, Math.addExact(last, 1));
        } catch (ArithmeticException e) {
            throw new PackValidationException("End seat out of range: " + endSeat, Map.of("endSeat", endSeat));
        }
    }

    public int size() {
        return endExclusive - start;
    }

    public boolean overlaps(SeatRange other) {
        return start < other.endExclusive && other.start < endExclusive;
    }

    public boolean contains(SeatRange other) {
        return start <= other.start && other.endExclusive <= endExclusive;
    }

    /** True when this range lies inside {@code other} and is not equal to it. */
    public boolean isStrictSubsetOf(SeatRange other) {
        return other.contains(this) && !equals(other);
    }

    /** True when the union of {@code ranges} covers every seat of {@code target}. */
    public static boolean unionCovers(Collection<SeatRange> ranges, SeatRange target) {
        List<SeatRange> sorted = new ArrayList<>(ranges);
        sorted.sort(Comparator.comparingInt(SeatRange::getStart));
        int reached = target.start;
        for (SeatRange range : sorted) {
            if (range.start > reached) {
                break;
            }
            reached = Math.max(reached, range.endExclusive);
            if (reached >= target.endExclusive) {
                return true;
            }
        }
        return reached >= target.endExclusive;
    }

    private static int parseSeat(String seat) {
        if (seat == null || seat.isBlank()) {
            throw new PackValidationException("Seat number is missing");
        }
        try {
            return Integer.parseInt(seat.trim());
        } catch (NumberFormatException e) {
            throw new PackValidationException("Seat number is not numeric: " + seat, Map.of("seat", seat));
        }
    }
}
