package com.packsync.event;

import com.packsync.domain.model.WorkflowResult;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Published after every reconcile-and-sync pass, successful or not.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>PackSyncMetrics: pass and action counters</li>
 * </ul>
 */
@Getter
public class PackSyncEvent extends ApplicationEvent {

    private final WorkflowResult result;

    public PackSyncEvent(Object source, WorkflowResult result) {
        super(source);
        this.result = result;
    }
}
