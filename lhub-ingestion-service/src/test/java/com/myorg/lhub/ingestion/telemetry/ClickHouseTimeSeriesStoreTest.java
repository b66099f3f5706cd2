package com.myorg.lhub.ingestion.telemetry;

import com.fasterxml.jackson.databind.JsonNode;
import com.myorg.lhub.contracts.core.exception.HubNonRetryableException;
import com.myorg.lhub.ingestion.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.client.MockClientHttpRequest;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.client.ExpectedCount.never;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.anything;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class ClickHouseTimeSeriesStoreTest {

    private MockRestServiceServer server;
    private ClickHouseTimeSeriesStore store;

    private final List<MetricRow> rows = List.of(
            new MetricRow("2024-03-01 10:00:00.000000000", "rows", "counter", 1.0, "1", "etl", "team-a", Map.of(), Map.of()),
            new MetricRow("2024-03-01 10:00:01.000000000", "rows", "counter", 2.0, "1", "etl", "team-a", Map.of("k", "v"), Map.of()));

    @BeforeEach
    void setUp() {
        RestTemplate rest = new RestTemplate();
        server = MockRestServiceServer.bindTo(rest).build();
        store = new ClickHouseTimeSeriesStore(rest, Fixtures.MAPPER, "http://ch:8123", "otel", "default", "secret");
    }

    @Test
    void postsOneJsonObjectPerLine() throws Exception {
        AtomicReference<String> body = new AtomicReference<>();
        server.expect(requestTo(containsString("INSERT%20INTO%20otel.metrics%20FORMAT%20JSONEachRow")))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("X-ClickHouse-User", "default"))
                .andExpect(header("X-ClickHouse-Key", "secret"))
                .andExpect(request -> body.set(((MockClientHttpRequest) request).getBodyAsString()))
                .andRespond(withSuccess());

        assertThatCode(() -> store.bulkInsert("metrics", rows)).doesNotThrowAnyException();
        server.verify();

        String[] lines = body.get().split("\n");
        assertThat(body.get()).endsWith("\n");
        assertThat(lines).hasSize(2);
        JsonNode first = Fixtures.MAPPER.readTree(lines[0]);
        JsonNode second = Fixtures.MAPPER.readTree(lines[1]);
        assertThat(first.path("metric_name").asText()).isEqualTo("rows");
        assertThat(first.path("metric_type").asText()).isEqualTo("counter");
        assertThat(first.path("timestamp").asText()).isEqualTo("2024-03-01 10:00:00.000000000");
        assertThat(first.path("attributes").isObject()).isTrue();
        assertThat(second.path("value").asDouble()).isEqualTo(2.0);
        assertThat(second.path("attributes").path("k").asText()).isEqualTo("v");
    }

    @Test
    void emptyBatchSendsNothing() throws Exception {
        server.expect(never(), anything());

        store.bulkInsert("metrics", List.of());
        server.verify();
    }

    @Test
    void serverErrorsAndIoFailuresAreTransient() {
        server.expect(anything()).andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));
        server.expect(anything()).andRespond(withException(new IOException("reset")));

        assertThatThrownBy(() -> store.bulkInsert("metrics", rows)).isInstanceOf(BulkWriteException.class);
        assertThatThrownBy(() -> store.bulkInsert("metrics", rows)).isInstanceOf(BulkWriteException.class);
    }

    @Test
    void badRequestIsPermanent() {
        server.expect(anything()).andRespond(withStatus(HttpStatus.BAD_REQUEST).body("Code: 27. Cannot parse input"));

        assertThatThrownBy(() -> store.bulkInsert("metrics", rows))
                .isInstanceOf(HubNonRetryableException.class)
                .hasMessageContaining("Cannot parse input");
    }
}
