package jp.tradelog.metrics;

import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the Prometheus /metrics endpoint.
 */
public class MetricsEndpointTest {

    private static final int TEST_PORT = 19191;
    private Undertow server;
    private PrometheusTradeLogMetrics metrics;
    private HttpClient httpClient;

    @BeforeEach
    public void setUp() {
        CollectorRegistry registry = new CollectorRegistry();
        metrics = new PrometheusTradeLogMetrics(registry);

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(
                Handlers.path()
                    .addPrefixPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()))
            )
            .build();
        server.start();

        httpClient = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private HttpResponse<String> scrape() throws Exception {
        return scrape("");
    }

    private HttpResponse<String> scrape(String query) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + "/metrics" + query))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    public void testMetricsEndpointReturns200() throws Exception {
        HttpResponse<String> response = scrape();

        assertEquals(200, response.statusCode(), "Metrics endpoint should return HTTP 200");
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        assertTrue(contentType.contains("text/plain"), "Content-Type should be text/plain");
        assertTrue(response.body().contains("# HELP"), "Should contain HELP declarations");
        assertTrue(response.body().contains("# TYPE tradelog_round_trip_trades gauge"));
    }

    @Test
    public void testImportCounters() throws Exception {
        metrics.recordImport("DOMESTIC", "success");
        metrics.recordImport("DOMESTIC", "success");
        metrics.recordImport("UNKNOWN", "FORMAT_UNDETECTED");
        metrics.recordImportedRows(12, 3);

        String body = scrape().body();

        assertTrue(body.contains("tradelog_imports_total{layout=\"DOMESTIC\",outcome=\"success\",} 2.0"), body);
        assertTrue(body.contains("tradelog_imports_total{layout=\"UNKNOWN\",outcome=\"FORMAT_UNDETECTED\",} 1.0"));
        assertTrue(body.contains("tradelog_import_rows_total{result=\"parsed\",} 12.0"));
        assertTrue(body.contains("tradelog_import_rows_total{result=\"skipped\",} 3.0"));
    }

    @Test
    public void testRecalculationMetrics() throws Exception {
        metrics.recordRecalculation(Duration.ofMillis(20), 7);

        String body = scrape().body();

        assertTrue(body.contains("tradelog_round_trip_trades 7.0"));
        assertTrue(body.contains("tradelog_recalculation_duration_seconds_count 1.0"));
        assertTrue(body.contains("le=\"0.05\""), "Should have 0.05s bucket");
        assertTrue(body.contains("le=\"+Inf\""), "Should have +Inf bucket");
    }

    @Test
    public void testQuoteFetchMetrics() throws Exception {
        metrics.recordQuoteFetch("success", Duration.ofMillis(300));
        metrics.recordQuoteFetch("RATE_LIMITED", Duration.ofMillis(100));

        String body = scrape().body();

        assertTrue(body.contains("tradelog_quote_fetches_total{outcome=\"success\",} 1.0"));
        assertTrue(body.contains("tradelog_quote_fetches_total{outcome=\"RATE_LIMITED\",} 1.0"));
        assertTrue(body.contains("tradelog_quote_fetch_latency_seconds_count 2.0"));
    }

    @Test
    public void testNameFilter() throws Exception {
        metrics.recordImport("FOREIGN", "success");
        metrics.recordRecalculation(Duration.ofMillis(5), 4);

        String body = scrape("?name%5B%5D=tradelog_round_trip_trades").body();

        assertTrue(body.contains("tradelog_round_trip_trades 4.0"), body);
        assertFalse(body.contains("tradelog_imports_total"), body);
    }
}
