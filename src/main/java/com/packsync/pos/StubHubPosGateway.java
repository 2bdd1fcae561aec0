package com.packsync.pos;

import com.fasterxml.jackson.databind.JsonNode;
import com.packsync.config.PosApiConfig;
import com.packsync.domain.model.PerformanceContext;
import com.packsync.domain.model.SeatPack;
import com.packsync.exception.PosVendorException;
import com.packsync.mapper.JsonHelper;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

/**
 * {@link PosGateway} backed by the StubHub point-of-sale inventory API.
 *
 * <p>Resilience:
 * <ul>
 *   <li><b>Timeouts</b>: connect/read timeouts on {@code posRestTemplate}; a timeout fails that pack only</li>
 *   <li><b>Circuit breaker</b> ({@code posApi}): stops calling a vendor that keeps failing; refused calls
 *       surface as {@link PosVendorException}</li>
 * </ul>
 * There is no synchronous retry. Failed packs stay pending and the sweep picks them up.
 */
@Service
public class StubHubPosGateway implements PosGateway {

    private static final Logger log = LoggerFactory.getLogger(StubHubPosGateway.class);

    private static final String INVENTORY_PATH = "/inventory/";
    private static final List<String> INVENTORY_ID_FIELDS =
            List.of("id", "inventoryId", "inventory_id", "listingId", "listing_id");
    private static final List<String> ALREADY_GONE_PHRASES =
            List.of("not found", "does not exist", "already deleted");

    private final RestTemplate restTemplate;
    private final PosApiConfig posApiConfig;
    private final PosPayloadFactory posPayloadFactory;

    public StubHubPosGateway(
            @Qualifier("posRestTemplate") RestTemplate restTemplate,
            PosApiConfig posApiConfig,
            PosPayloadFactory posPayloadFactory) {
        this.restTemplate = restTemplate;
        this.posApiConfig = posApiConfig;
        this.posPayloadFactory = posPayloadFactory;
    }

    @Override
    @CircuitBreaker(name = "posApi", fallbackMethod = "pushRefused")
    public String push(SeatPack pack, PerformanceContext performance) {
        Map<String, Object> payload = posPayloadFactory.build(pack, performance);
        String url = posApiConfig.getBaseUrl() + INVENTORY_PATH;
        log.info("Creating vendor inventory for pack {}", pack.getInternalPackId());
        log.debug("Vendor payload for pack {}: {}", pack.getInternalPackId(), payload);

        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(url, HttpMethod.POST, new HttpEntity<>(payload, headers()), String.class);
        } catch (RestClientResponseException e) {
            throw new PosVendorException(
                    "Vendor rejected pack " + pack.getInternalPackId() + ": HTTP " + e.getStatusCode().value() + " "
                            + e.getResponseBodyAsString(),
                    e.getStatusCode().value());
        } catch (ResourceAccessException e) {
            throw new PosVendorException(
                    "Vendor unreachable for pack " + pack.getInternalPackId() + ": " + e.getMessage(), e);
        }

        String inventoryId = extractInventoryId(JsonHelper.readTree(response.getBody()));
        if (inventoryId == null) {
            throw new PosVendorException("Vendor response for pack " + pack.getInternalPackId()
                    + " carries no inventory id: " + response.getBody());
        }
        log.info("Pack {} listed at vendor as {}", pack.getInternalPackId(), inventoryId);
        return inventoryId;
    }

    @Override
    @CircuitBreaker(name = "posApi", fallbackMethod = "delistRefused")
    public void delist(SeatPack pack) {
        String inventoryId = pack.getPosInventoryId();
        if (inventoryId == null || inventoryId.isBlank()) {
            log.info("Pack {} has no vendor inventory id, nothing to delete", pack.getInternalPackId());
            return;
        }

        String url = posApiConfig.getBaseUrl() + INVENTORY_PATH + inventoryId;
        try {
            restTemplate.exchange(url, HttpMethod.DELETE, new HttpEntity<>(headers()), String.class);
            log.info("Deleted vendor inventory {} for pack {}", inventoryId, pack.getInternalPackId());
        } catch (RestClientResponseException e) {
            if (isAlreadyGone(e)) {
                log.warn("Vendor inventory {} for pack {} already gone", inventoryId, pack.getInternalPackId());
                return;
            }
            throw new PosVendorException(
                    "Vendor refused delete of " + inventoryId + ": HTTP " + e.getStatusCode().value() + " "
                            + e.getResponseBodyAsString(),
                    e.getStatusCode().value());
        } catch (ResourceAccessException e) {
            throw new PosVendorException("Vendor unreachable deleting " + inventoryId + ": " + e.getMessage(), e);
        }
    }

    /** Looks for the id at the top level, then under {@code data}. */
    static String extractInventoryId(JsonNode body) {
        if (body == null || !body.isObject()) {
            return null;
        }
        String id = findIdField(body);
        if (id == null && body.has("data")) {
            id = findIdField(body.get("data"));
        }
        return id;
    }

    private static String findIdField(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        for (String field : INVENTORY_ID_FIELDS) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }

    private boolean isAlreadyGone(RestClientResponseException e) {
        if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
            return true;
        }
        String body = e.getResponseBodyAsString().toLowerCase(Locale.ROOT);
        return ALREADY_GONE_PHRASES.stream().anyMatch(body::contains);
    }

    private HttpHeaders headers() {
        String token = posApiConfig.getAuthToken();
        if (token == null || token.isBlank()) {
            throw new PosVendorException("POS API auth token is not configured");
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.setBearerAuth(token);
        return headers;
    }

    private String pushRefused(SeatPack pack, PerformanceContext performance, CallNotPermittedException e) {
        throw new PosVendorException("POS API circuit open, push of " + pack.getInternalPackId() + " not attempted", e);
    }

    private void delistRefused(SeatPack pack, CallNotPermittedException e) {
        throw new PosVendorException(
                "POS API circuit open, delete of " + pack.getInternalPackId() + " not attempted", e);
    }
}
