package com.packsync.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the pending pack sweep ({@code packsync.sweep}). */
@Configuration
@ConfigurationProperties(prefix = "packsync.sweep")
@Getter
@Setter
public class SweepConfig {

    /** Whether the scheduled sweep runs. The in-pass sweep runs regardless. */
    private boolean enabled = true;

    private long intervalMs = 300_000;

    /** Packs handled per performance per sweep run. */
    private int batchSize = 50;

    /** Packs with this many failed attempts are left for manual follow-up. */
    private int maxAttempts = 5;
}
