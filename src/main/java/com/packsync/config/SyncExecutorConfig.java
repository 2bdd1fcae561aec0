package com.packsync.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for plan execution and pack id allocation.
 * Properties are read from the {@code packsync.executor} prefix.
 */
@Configuration
@ConfigurationProperties(prefix = "packsync.executor")
@Validated
@Getter
@Setter
public class SyncExecutorConfig {

    /** First segment of every pack id, e.g. {@code SH} gives {@code SH_PACK_<perf>_0001}. */
    @NotBlank
    private String sourcePrefix = "SH";

    /** Recorded on every created pack. */
    private String sourceWebsite = "stubhub";

    /** Ids probed per creation before giving up with an identity collision. */
    @Min(1)
    private int idRetryLimit = 100;

    /** Upper bound for the EXECUTE transaction. */
    @Min(1)
    private int transactionTimeoutSeconds = 30;
}
