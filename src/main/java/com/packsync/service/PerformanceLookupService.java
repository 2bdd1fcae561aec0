package com.packsync.service;

import com.packsync.domain.model.PerformanceContext;
import com.packsync.entity.PerformanceEntity;
import com.packsync.repository.jpa.PerformanceJpaRepository;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;

/** Read-only access to performance, event and venue data. A missing performance is an empty Optional. */
@Service
public class PerformanceLookupService {

    private final PerformanceJpaRepository performanceJpaRepository;

    public PerformanceLookupService(PerformanceJpaRepository performanceJpaRepository) {
        this.performanceJpaRepository = performanceJpaRepository;
    }

    public Optional<PerformanceContext> findContext(String performanceId) {
        return performanceJpaRepository.findById(performanceId).map(PerformanceLookupService::toContext);
    }

    public List<PerformanceContext> findPosEnabled() {
        return performanceJpaRepository.findByPosEnabledTrue().stream()
                .map(PerformanceLookupService::toContext)
                .toList();
    }

    /** @return false when the performance does not exist */
    public boolean disablePos(String performanceId) {
        return performanceJpaRepository.updatePosEnabled(performanceId, false) > 0;
    }

    static PerformanceContext toContext(PerformanceEntity entity) {
        return PerformanceContext.builder()
                .performanceId(entity.getInternalPerformanceId())
                .eventId(entity.getInternalEventId())
                .posEnabled(entity.isPosEnabled())
                .performanceDatetimeUtc(entity.getPerformanceDatetimeUtc())
                .event(PerformanceContext.EventInfo.builder()
                        .eventId(entity.getInternalEventId())
                        .name(entity.getEventName())
                        .build())
                .venue(PerformanceContext.VenueInfo.builder()
                        .name(entity.getVenueName())
                        .city(entity.getVenueCity())
                        .state(entity.getVenueState())
                        .country(entity.getVenueCountry())
                        .timezone(entity.getVenueTimezone())
                        .build())
                .build();
    }
}
