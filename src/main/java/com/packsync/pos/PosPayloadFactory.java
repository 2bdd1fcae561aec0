package com.packsync.pos;

import com.packsync.config.PosApiConfig;
import com.packsync.domain.model.PerformanceContext;
import com.packsync.domain.model.SeatPack;
import com.packsync.exception.PackValidationException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds the vendor listing body for a seat pack.
 *
 * <p>Event dates are sent in the venue's local time without offset. An unknown or missing
 * venue timezone falls back to UTC.
 */
@Component
public class PosPayloadFactory {

    private static final Logger log = LoggerFactory.getLogger(PosPayloadFactory.class);

    private static final DateTimeFormatter EVENT_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");
    private static final String DEFAULT_COUNTRY = "US";

    private final PosApiConfig posApiConfig;

    public PosPayloadFactory(PosApiConfig posApiConfig) {
        this.posApiConfig = posApiConfig;
    }

    public Map<String, Object> build(SeatPack pack, PerformanceContext performance) {
        if (performance.getPerformanceDatetimeUtc() == null) {
            throw new PackValidationException("Performance " + performance.getPerformanceId() + " has no start time");
        }
        String eventTime = localEventTime(performance);
        PerformanceContext.VenueInfo venue = performance.getVenue();
        PerformanceContext.EventInfo event = performance.getEvent();

        Map<String, Object> seating = new LinkedHashMap<>();
        seating.put("section", sectionName(pack));
        seating.put("row", pack.getRowLabel());

        Map<String, Object> eventMapping = new LinkedHashMap<>();
        eventMapping.put("eventName", event != null ? event.getName() : null);
        eventMapping.put("eventDate", eventTime);
        eventMapping.put("venueName", venue != null ? venue.getName() : null);
        eventMapping.put("isEventDateConfirmed", true);
        eventMapping.put("city", venue != null ? venue.getCity() : null);
        eventMapping.put("stateProvince", venue != null ? venue.getState() : null);
        eventMapping.put("countryCode", venue != null && venue.getCountry() != null ? venue.getCountry() : DEFAULT_COUNTRY);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("currencyCode", posApiConfig.getCurrencyCode());
        payload.put("unitCost", unitCost(pack));
        payload.put("deliveryType", posApiConfig.getDeliveryType());
        payload.put("inHandAt", eventTime);
        payload.put("seating", seating);
        payload.put("eventMapping", eventMapping);
        payload.put("externalId", pack.getInternalPackId());
        payload.put("ticketCount", pack.getPackSize());
        payload.put("autoBroadcast", true);
        payload.put("internalNotes", "Auto-created by pack sync at " + LocalDateTime.now(ZoneOffset.UTC).format(EVENT_TIME));
        return payload;
    }

    BigDecimal unitCost(SeatPack pack) {
        return pack.getPackPrice().divide(BigDecimal.valueOf(pack.getPackSize()), 2, RoundingMode.HALF_UP);
    }

    private String localEventTime(PerformanceContext performance) {
        LocalDateTime utc = performance.getPerformanceDatetimeUtc();
        String timezone = performance.getVenue() != null ? performance.getVenue().getTimezone() : null;
        if (timezone == null || timezone.isBlank()) {
            return utc.format(EVENT_TIME);
        }
        try {
            return utc.atOffset(ZoneOffset.UTC).atZoneSameInstant(ZoneId.of(timezone)).format(EVENT_TIME);
        } catch (DateTimeException e) {
            log.warn("Unknown venue timezone {} for performance {}, using UTC", timezone, performance.getPerformanceId());
            return utc.format(EVENT_TIME);
        }
    }

    /** Section, then level, then zone. */
    private static String sectionName(SeatPack pack) {
        if (pack.getSectionId() != null && !pack.getSectionId().isBlank()) {
            return pack.getSectionId();
        }
        if (pack.getLevelId() != null && !pack.getLevelId().isBlank()) {
            return pack.getLevelId();
        }
        return pack.getZoneId();
    }
}
