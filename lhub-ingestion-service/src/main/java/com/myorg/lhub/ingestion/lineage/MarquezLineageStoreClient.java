package com.myorg.lhub.ingestion.lineage;

import com.fasterxml.jackson.databind.JsonNode;
import com.myorg.lhub.contracts.core.exception.HubNonRetryableException;
import com.myorg.lhub.kafka.HubDlqReason;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

/**
 * Posts OpenLineage run events to Marquez. Server errors, 408, 429 and I/O failures are transient;
 * any other 4xx means Marquez will never accept the event.
 */
@Slf4j
public class MarquezLineageStoreClient implements LineageStoreClient {

    public static final String STORE_REJECTED = HubDlqReason.STORE_REJECTED.code();

    private final RestTemplate rest;
    private final String lineageUrl;

    public MarquezLineageStoreClient(RestTemplate rest, String baseUrl, String endpoint) {
        this.rest = rest;
        this.lineageUrl = stripTrailingSlash(baseUrl) + endpoint;
    }

    @Override
    public void send(JsonNode lineageEvent) throws ForwardException {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            ResponseEntity<Void> resp = rest.postForEntity(lineageUrl, new HttpEntity<>(lineageEvent, headers), Void.class);
            log.debug("Marquez accepted event status={}", resp.getStatusCode().value());
        } catch (RestClientResponseException e) {
            HttpStatusCode status = e.getStatusCode();
            if (isTransient(status)) {
                throw new ForwardException("Marquez returned " + status.value(), e);
            }
            throw new HubNonRetryableException(STORE_REJECTED,
                    "Marquez rejected event with " + status.value() + ": " + e.getResponseBodyAsString(), e);
        } catch (ResourceAccessException e) {
            throw new ForwardException("Marquez unreachable at " + lineageUrl + ": " + e.getMessage(), e);
        }
    }

    static boolean isTransient(HttpStatusCode status) {
        int s = status.value();
        return status.is5xxServerError() || s == 408 || s == 429 || !status.isError();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
