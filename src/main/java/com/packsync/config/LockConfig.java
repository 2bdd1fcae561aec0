package com.packsync.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the per-performance lock ({@code packsync.lock}). */
@Configuration
@ConfigurationProperties(prefix = "packsync.lock")
@Getter
@Setter
public class LockConfig {

    /** Lock expiry. Renewed while a pass runs, so it only bounds how long a crashed worker blocks others. */
    private long ttlSeconds = 300;

    /** Watchdog period. Zero or less means a third of the TTL. */
    private long renewIntervalMs = 0;

    private long waitSeconds = 30;

    private long pollIntervalMs = 200;
}
