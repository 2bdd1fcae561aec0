package com.packsync.sync;

import com.packsync.config.SyncExecutorConfig;
import com.packsync.exception.IdentityCollisionException;
import com.packsync.repository.jpa.SeatPackJpaRepository;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Allocates {@code internal_pack_id}s of the form {@code {PREFIX}_PACK_{performanceId}_{seq}}.
 *
 * <p>The sequence of a performance starts at the number of rows ever stored for it plus one,
 * so ids of inactive packs are never reused. Each candidate id is probed for existence; a
 * taken id moves to the next sequence value, up to the configured retry limit.
 *
 * <p>Callers must hold the performance lock. The probe alone does not stop two concurrent
 * passes from picking the same free id.
 */
@Component
public class PackIdGenerator {

    private static final Logger log = LoggerFactory.getLogger(PackIdGenerator.class);

    private final SeatPackJpaRepository seatPackJpaRepository;
    private final SyncExecutorConfig syncExecutorConfig;

    public PackIdGenerator(SeatPackJpaRepository seatPackJpaRepository, SyncExecutorConfig syncExecutorConfig) {
        this.seatPackJpaRepository = seatPackJpaRepository;
        this.syncExecutorConfig = syncExecutorConfig;
    }

    /** Opens a sequence for one plan execution. Must be used inside the executing transaction. */
    public Sequence sequenceFor(String performanceId) {
        long start = seatPackJpaRepository.countByPerformanceId(performanceId) + 1;
        return new Sequence(performanceId, start);
    }

    public static String formatId(String prefix, String performanceId, long sequence) {
        return String.format("%s_PACK_%s_%04d", prefix.toUpperCase(Locale.ROOT), performanceId, sequence);
    }

    public final class Sequence {

        private final String performanceId;
        private long next;

        private Sequence(String performanceId, long start) {
            this.performanceId = performanceId;
            this.next = start;
        }

        /**
         * @throws IdentityCollisionException when every probed id is taken
         */
        public String nextId() {
            int limit = syncExecutorConfig.getIdRetryLimit();
            for (int attempt = 1; attempt <= limit; attempt++) {
                String candidate = formatId(syncExecutorConfig.getSourcePrefix(), performanceId, next++);
                if (!seatPackJpaRepository.existsById(candidate)) {
                    return candidate;
                }
                log.debug("Pack id {} already taken (attempt {}/{})", candidate, attempt, limit);
            }
            throw new IdentityCollisionException(performanceId, limit);
        }
    }
}
