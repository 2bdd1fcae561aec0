package com.packsync.unit.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.packsync.config.SyncExecutorConfig;
import com.packsync.exception.ErrorCode;
import com.packsync.exception.IdentityCollisionException;
import com.packsync.repository.jpa.SeatPackJpaRepository;
import com.packsync.sync.PackIdGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PackIdGeneratorTest {

    @Mock
    private SeatPackJpaRepository seatPackJpaRepository;

    private SyncExecutorConfig config;
    private PackIdGenerator packIdGenerator;

    @BeforeEach
    void setUp() {
        config = new SyncExecutorConfig();
        packIdGenerator = new PackIdGenerator(seatPackJpaRepository, config);
    }

    @Test
    @DisplayName("Ids are prefixed, upper-cased and zero-padded to four digits")
    void formatId() {
        assertThat(PackIdGenerator.formatId("sh", "PERF7", 12)).isEqualTo("SH_PACK_PERF7_0012");
        assertThat(PackIdGenerator.formatId("SH", "PERF7", 12345)).isEqualTo("SH_PACK_PERF7_12345");
    }

    @Test
    @DisplayName("Sequence starts after every row ever stored and increments per id")
    void sequenceContinuesAfterStoredRows() {
        when(seatPackJpaRepository.countByPerformanceId("PERF1")).thenReturn(7L);
        when(seatPackJpaRepository.existsById(anyString())).thenReturn(false);

        PackIdGenerator.Sequence sequence = packIdGenerator.sequenceFor("PERF1");

        assertThat(sequence.nextId()).isEqualTo("SH_PACK_PERF1_0008");
        assertThat(sequence.nextId()).isEqualTo("SH_PACK_PERF1_0009");
    }

    @Test
    @DisplayName("Exhausting the retry limit raises an identity collision")
    void retryLimitExhausted() {
        config.setIdRetryLimit(3);
        when(seatPackJpaRepository.countByPerformanceId("PERF1")).thenReturn(0L);
        when(seatPackJpaRepository.existsById(anyString())).thenReturn(true);

        PackIdGenerator.Sequence sequence = packIdGenerator.sequenceFor("PERF1");

        assertThatThrownBy(sequence::nextId)
                .isInstanceOf(IdentityCollisionException.class)
                .satisfies(e -> assertThat(((IdentityCollisionException) e).getErrorCode())
                        .isEqualTo(ErrorCode.IDENTITY_COLLISION));
        verify(seatPackJpaRepository, times(3)).existsById(anyString());
    }
}
