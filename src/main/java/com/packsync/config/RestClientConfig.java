package com.packsync.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/** HTTP clients for the POS vendor and the notification webhook, each with its own timeouts. */
@Configuration
public class RestClientConfig {

    private static final int WEBHOOK_TIMEOUT_MS = 5000;

    @Bean("posRestTemplate")
    public RestTemplate posRestTemplate(PosApiConfig posApiConfig) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(posApiConfig.getConnectTimeoutMs());
        requestFactory.setReadTimeout(posApiConfig.getReadTimeoutMs());
        return new RestTemplate(requestFactory);
    }

    @Bean("notificationRestTemplate")
    public RestTemplate notificationRestTemplate() {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(WEBHOOK_TIMEOUT_MS);
        requestFactory.setReadTimeout(WEBHOOK_TIMEOUT_MS);
        return new RestTemplate(requestFactory);
    }
}
