package com.packsync.event;

import com.packsync.domain.model.CandidatePack;
import java.util.List;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Published when the scraping layer has finished a performance and produced its candidate packs.
 * Handled asynchronously by {@link com.packsync.workflow.PackSyncCoordinator}.
 */
@Getter
public class ScrapeCompletedEvent extends ApplicationEvent {

    private final String performanceId;
    private final List<CandidatePack> candidatePacks;

    public ScrapeCompletedEvent(Object source, String performanceId, List<CandidatePack> candidatePacks) {
        super(source);
        this.performanceId = performanceId;
        this.candidatePacks = List.copyOf(candidatePacks);
    }
}
