package com.packsync.notification;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration for sync notifications.
 *
 * <p>Reads from application.yml:
 * <pre>
 * packsync.notifications.enabled=false
 * packsync.notifications.webhook-url=${PACKSYNC_WEBHOOK_URL:}
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "packsync.notifications")
public class NotificationConfig {

    private boolean enabled = false;
    private String webhookUrl;
}
