package com.packsync.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** JPA entity for the performances table. Maintained by the scraping side; read here. */
@Entity
@Table(name = "performances")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PerformanceEntity {

    @Id
    @Column(name = "internal_performance_id", length = 100)
    private String internalPerformanceId;

    @Column(name = "internal_event_id", length = 100)
    private String internalEventId;

    @Column(name = "event_name")
    private String eventName;

    @Column(name = "venue_name")
    private String venueName;

    @Column(name = "venue_city", length = 100)
    private String venueCity;

    @Column(name = "venue_state", length = 100)
    private String venueState;

    @Column(name = "venue_country", length = 10)
    private String venueCountry;

    @Column(name = "venue_timezone", length = 64)
    private String venueTimezone;

    @Column(name = "performance_datetime_utc")
    private LocalDateTime performanceDatetimeUtc;

    /** Gates every vendor operation for this performance. */
    @Column(name = "pos_enabled")
    private boolean posEnabled;
}
