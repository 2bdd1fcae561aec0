package com.packsync.domain.model;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/** Read-only performance, event and venue data needed to reconcile and label inventory. */
@Value
@Builder
public class PerformanceContext {

    String performanceId;
    String eventId;
    boolean posEnabled;

    /** Performance start in UTC. */
    LocalDateTime performanceDatetimeUtc;

    EventInfo event;
    VenueInfo venue;

    @Value
    @Builder
    public static class EventInfo {
        String eventId;
        String name;
    }

    @Value
    @Builder
    public static class VenueInfo {
        String name;
        String city;
        String state;
        String country;

        /** IANA zone id, e.g. America/New_York. */
        String timezone;
    }
}
