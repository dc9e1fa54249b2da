package io.trading.optionchain.metrics;

import io.prometheus.client.CollectorRegistry;
import io.trading.optionchain.core.SamplerStats;
import io.trading.optionchain.feed.OrchestratorStats;
import io.trading.optionchain.feed.ShardState;
import io.trading.optionchain.persistence.WriterStats;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.LocalDate;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class MetricsServerTest {

    private final HttpClient client = HttpClient.newHttpClient();
    private final AtomicReference<RecorderStatus> status = new AtomicReference<>();
    private RecorderMetrics metrics;
    private MetricsServer server;

    @BeforeEach
    void setUp() throws Exception {
        metrics = new RecorderMetrics(new CollectorRegistry(), false);
        status.set(status(ShardState.CONNECTED));
        server = new MetricsServer(0, metrics, status::get);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private static RecorderStatus status(ShardState state) {
        WriterStats writer = new WriterStats("NIFTY", "/data/NIFTY_NSEFO_20250102_20250102.csv",
            240, 12, LocalDate.of(2025, 1, 2), 2, 0, 0);
        return new RecorderStatus("NSE-FO", 60_000,
            new OrchestratorStats(1200, 0, 0, 1, 0, 0),
            Map.of("Shard-1", state),
            new SamplerStats(2, 252, 0, 1_735_792_200_000L, 0, 0),
            Map.of("NIFTY", writer));
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + server.getPort() + path)).build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void testBindsEphemeralPort() {
        assertTrue(server.getPort() > 0);
    }

    @Test
    void testMetricsEndpoint() throws Exception {
        metrics.onCycle(126, 3_000);

        HttpResponse<String> response = get("/metrics");

        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("recorder_sampling_cycles_total 1.0"));
        assertTrue(response.body().contains("recorder_rows_produced_total 126.0"));
    }

    @Test
    void testHealthEndpoint() throws Exception {
        HttpResponse<String> healthy = get("/health");
        assertEquals(200, healthy.statusCode());
        assertEquals("OK", healthy.body());

        status.set(status(ShardState.RECONNECTING));
        HttpResponse<String> degraded = get("/health");
        assertEquals(503, degraded.statusCode());
        assertEquals("DEGRADED", degraded.body());
    }

    @Test
    void testStatusEndpoint() throws Exception {
        HttpResponse<String> response = get("/api/status");

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("application/json"));
        String body = response.body();
        assertTrue(body.contains("\"venue\" : \"NSE-FO\""));
        assertTrue(body.contains("\"Shard-1\" : \"CONNECTED\""));
        assertTrue(body.contains("\"startDate\" : \"2025-01-02\""));
        assertTrue(body.contains("\"healthy\" : true"));
    }
}
