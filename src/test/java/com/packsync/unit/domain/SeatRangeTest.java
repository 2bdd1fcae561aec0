package com.packsync.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.packsync.domain.vo.SeatRange;
import com.packsync.exception.PackValidationException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SeatRangeTest {

    @Test
    @DisplayName("Inclusive seats become a half-open range")
    void parsesInclusiveSeats() {
        SeatRange range = SeatRange.of("101", " 104 ");

        assertThat(range.getStart()).isEqualTo(101);
        assertThat(range.getEndExclusive()).isEqualTo(105);
        assertThat(range.size()).isEqualTo(4);
    }

    @Test
    @DisplayName("The largest int as end seat is rejected instead of wrapping around")
    void maxIntEndSeatRejected() {
        assertThatThrownBy(() -> SeatRange.of("2147483600", "2147483647"))
                .isInstanceOf(PackValidationException.class)
                .hasMessageContaining("out of range");
    }

    @Test
    @DisplayName("Inverted and non-numeric seats are rejected")
    void invalidSeatsRejected() {
        assertThatThrownBy(() -> SeatRange.of("5", "2")).isInstanceOf(PackValidationException.class);
        assertThatThrownBy(() -> SeatRange.of("1", "4B")).isInstanceOf(PackValidationException.class);
        assertThatThrownBy(() -> SeatRange.of(" ", "4")).isInstanceOf(PackValidationException.class);
    }

    @Test
    @DisplayName("Adjacent ranges do not overlap; a union with a gap does not cover")
    void overlapAndCoverage() {
        SeatRange left = SeatRange.of("1", "2");
        SeatRange right = SeatRange.of("3", "4");

        assertThat(left.overlaps(right)).isFalse();
        assertThat(left.overlaps(SeatRange.of("2", "3"))).isTrue();
        assertThat(SeatRange.unionCovers(List.of(right, left), SeatRange.of("1", "4"))).isTrue();
        assertThat(SeatRange.unionCovers(List.of(left, SeatRange.of("4", "4")), SeatRange.of("1", "4"))).isFalse();
        assertThat(left.isStrictSubsetOf(SeatRange.of("1", "4"))).isTrue();
    }
}
