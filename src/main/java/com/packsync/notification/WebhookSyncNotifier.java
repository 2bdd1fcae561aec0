package com.packsync.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Posts sync notifications as JSON to a configured webhook.
 *
 * <p>Delivery runs on the event executor. A failed delivery is logged and dropped; there
 * is no queue and no retry.
 */
@Component
public class WebhookSyncNotifier implements SyncNotifier {

    private static final Logger log = LoggerFactory.getLogger(WebhookSyncNotifier.class);

    private final NotificationConfig notificationConfig;
    private final RestTemplate restTemplate;

    public WebhookSyncNotifier(
            NotificationConfig notificationConfig, @Qualifier("notificationRestTemplate") RestTemplate restTemplate) {
        this.notificationConfig = notificationConfig;
        this.restTemplate = restTemplate;
    }

    @Async("eventExecutor")
    @Override
    public void syncStarted(SyncNotification notification) {
        deliver(notification);
    }

    @Async("eventExecutor")
    @Override
    public void syncCompleted(SyncNotification notification) {
        deliver(notification);
    }

    @Async("eventExecutor")
    @Override
    public void syncFailed(SyncNotification notification) {
        deliver(notification);
    }

    void deliver(SyncNotification notification) {
        if (!notificationConfig.isEnabled()) {
            log.debug("Sync notifications disabled, dropping {}", notification.getType());
            return;
        }
        String url = notificationConfig.getWebhookUrl();
        if (url == null || url.isBlank()) {
            log.warn("Sync notifications enabled but no webhook URL configured");
            return;
        }

        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            restTemplate.postForEntity(url, new HttpEntity<>(notification, headers), String.class);
            log.debug("Delivered {} notification for operation {}", notification.getType(),
                    notification.getOperationId());
        } catch (RestClientException e) {
            log.warn(
                    "Failed to deliver {} notification for operation {}: {}",
                    notification.getType(),
                    notification.getOperationId(),
                    e.getMessage());
        }
    }
}
