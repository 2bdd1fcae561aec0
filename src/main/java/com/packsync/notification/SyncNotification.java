package com.packsync.notification;

import com.packsync.domain.enums.NotificationType;
import com.packsync.domain.enums.WorkflowScenario;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/** One sync lifecycle message, keyed by the pass's operation id. */
@Data
@Builder
public class SyncNotification {

    private String operationId;
    private NotificationType type;
    private String performanceId;
    private String eventName;
    private WorkflowScenario scenario;

    /** Action counts for completion messages, e.g. {@code created -> 3}. */
    @Builder.Default
    private Map<String, Integer> counts = new LinkedHashMap<>();

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    private String message;
    private LocalDateTime timestamp;
}
