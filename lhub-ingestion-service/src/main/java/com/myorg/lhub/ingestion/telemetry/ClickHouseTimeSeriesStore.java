package com.myorg.lhub.ingestion.telemetry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.lhub.contracts.core.exception.HubNonRetryableException;
import com.myorg.lhub.kafka.HubDlqReason;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes rows through the ClickHouse HTTP interface as {@code INSERT ... FORMAT JSONEachRow}, one
 * JSON object per line. A single request carries the whole batch.
 */
@Slf4j
public class ClickHouseTimeSeriesStore implements TimeSeriesStore {

    public static final String STORE_REJECTED = HubDlqReason.STORE_REJECTED.code();

    private final RestTemplate rest;
    private final ObjectMapper mapper;
    private final String url;
    private final String database;
    private final String username;
    private final String password;

    public ClickHouseTimeSeriesStore(RestTemplate rest, ObjectMapper mapper, String url, String database,
                                     String username, String password) {
        this.rest = rest;
        this.mapper = mapper;
        this.url = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.database = database;
        this.username = username;
        this.password = password;
    }

    @Override
    public void bulkInsert(String table, List<?> rows) throws BulkWriteException {
        if (rows.isEmpty()) return;
        String query = "INSERT INTO " + database + "." + table + " FORMAT JSONEachRow";

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8));
        if (username != null && !username.isEmpty()) headers.set("X-ClickHouse-User", username);
        if (password != null && !password.isEmpty()) headers.set("X-ClickHouse-Key", password);

        try {
            rest.postForEntity(url + "/?query={query}", new HttpEntity<>(ndjson(rows), headers), String.class, query);
            log.debug("Inserted rows={} table={}.{}", rows.size(), database, table);
        } catch (RestClientResponseException e) {
            HttpStatusCode status = e.getStatusCode();
            if (status.is5xxServerError() || status.value() == 408 || status.value() == 429) {
                throw new BulkWriteException("ClickHouse returned " + status.value() + " for " + table, e);
            }
            throw new HubNonRetryableException(STORE_REJECTED,
                    "ClickHouse rejected insert into " + table + " with " + status.value() + ": " + e.getResponseBodyAsString(), e);
        } catch (ResourceAccessException e) {
            throw new BulkWriteException("ClickHouse unreachable at " + url + ": " + e.getMessage(), e);
        }
    }

    private String ndjson(List<?> rows) {
        StringBuilder sb = new StringBuilder();
        for (Object row : rows) {
            try {
                sb.append(mapper.writeValueAsString(row)).append('\n');
            } catch (JsonProcessingException e) {
                throw new HubNonRetryableException(STORE_REJECTED, "cannot serialize row " + row.getClass().getSimpleName(), e);
            }
        }
        return sb.toString();
    }
}
