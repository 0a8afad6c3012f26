package jp.tradelog.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of TradeLogMetrics.
 *
 * Key Metrics:
 * - tradelog_imports_total{layout, outcome} - CSV import attempts
 * - tradelog_import_rows_total{result} - parsed / skipped data rows
 * - tradelog_recalculation_duration_seconds - full round-trip rebuild time
 * - tradelog_round_trip_trades - round trips currently stored
 * - tradelog_quote_fetches_total{outcome} - quote source calls
 * - tradelog_quote_fetch_latency_seconds - quote source latency
 *
 * Exposed at /metrics by {@link PrometheusMetricsHandler}.
 */
public class PrometheusTradeLogMetrics implements TradeLogMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusTradeLogMetrics.class);

    private final CollectorRegistry registry;

    private final Counter importCounter;
    private final Counter importRowCounter;
    private final Histogram recalculationDuration;
    private final Gauge roundTripTrades;
    private final Counter quoteFetchCounter;
    private final Histogram quoteFetchLatency;

    public PrometheusTradeLogMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusTradeLogMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.importCounter = Counter.build()
            .name("tradelog_imports_total")
            .help("Total number of CSV import attempts")
            .labelNames("layout", "outcome")
            .register(registry);

        this.importRowCounter = Counter.build()
            .name("tradelog_import_rows_total")
            .help("Total number of CSV data rows seen by successful imports")
            .labelNames("result")
            .register(registry);

        this.recalculationDuration = Histogram.build()
            .name("tradelog_recalculation_duration_seconds")
            .help("Round-trip trade rebuild duration in seconds")
            .buckets(0.005, 0.01, 0.05, 0.1, 0.5, 1.0, 5.0)
            .register(registry);

        this.roundTripTrades = Gauge.build()
            .name("tradelog_round_trip_trades")
            .help("Number of round-trip trades after the last rebuild")
            .register(registry);

        this.quoteFetchCounter = Counter.build()
            .name("tradelog_quote_fetches_total")
            .help("Total number of quote source requests")
            .labelNames("outcome")
            .register(registry);

        this.quoteFetchLatency = Histogram.build()
            .name("tradelog_quote_fetch_latency_seconds")
            .help("Quote source request latency in seconds")
            .buckets(0.1, 0.25, 0.5, 1.0, 2.0, 5.0, 10.0)
            .register(registry);

        log.info("[PrometheusTradeLogMetrics] Initialized");
    }

    @Override
    public void recordImport(String layout, String outcome) {
        importCounter.labels(layout, outcome).inc();
    }

    @Override
    public void recordImportedRows(int parsed, int skipped) {
        importRowCounter.labels("parsed").inc(parsed);
        importRowCounter.labels("skipped").inc(skipped);
    }

    @Override
    public void recordRecalculation(Duration duration, int tradeCount) {
        recalculationDuration.observe(duration.toNanos() / 1_000_000_000.0);
        roundTripTrades.set(tradeCount);
    }

    @Override
    public void recordQuoteFetch(String outcome, Duration latency) {
        quoteFetchCounter.labels(outcome).inc();
        quoteFetchLatency.observe(latency.toMillis() / 1000.0);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
