package jp.tradelog.metrics;

import java.time.Duration;

/**
 * Trade log metrics interface for monitoring.
 *
 * Key metrics:
 * - Import outcomes per layout
 * - Parsed and skipped row counts
 * - Round-trip rebuild latency and result size
 * - Quote source fetch outcomes
 */
public interface TradeLogMetrics {

    /**
     * Record one import attempt.
     *
     * @param layout  detected layout name, or "UNKNOWN" if detection failed
     * @param outcome "success" or the failure code
     */
    void recordImport(String layout, String outcome);

    /**
     * Record row counts of a successful parse.
     */
    void recordImportedRows(int parsed, int skipped);

    /**
     * Record a full round-trip rebuild.
     *
     * @param duration   time spent scanning, aggregating and replacing
     * @param tradeCount number of round trips after the rebuild
     */
    void recordRecalculation(Duration duration, int tradeCount);

    /**
     * Record one quote source call.
     *
     * @param outcome "success" or the failure code
     */
    void recordQuoteFetch(String outcome, Duration latency);
}
