package com.packsync.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the POS vendor API.
 *
 * <p>When {@code enabled} is false no vendor call is made for any performance, regardless
 * of its own {@code pos_enabled} flag. Properties are read from {@code packsync.pos.api}.
 */
@Configuration
@ConfigurationProperties(prefix = "packsync.pos.api")
@Getter
@Setter
public class PosApiConfig {

    private boolean enabled = true;

    /** Base URL of the vendor inventory API, without trailing slash. */
    private String baseUrl = "https://pointofsaleapi.stubhub.net";

    private String authToken;

    private int connectTimeoutMs = 5000;

    /** A read timeout fails that pack's call only. */
    private int readTimeoutMs = 15000;

    private String currencyCode = "USD";

    private String deliveryType = "ELECTRONIC";
}
