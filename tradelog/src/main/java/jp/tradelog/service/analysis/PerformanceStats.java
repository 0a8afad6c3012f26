package jp.tradelog.service.analysis;

import java.math.BigDecimal;

/**
 * Summary statistics over a set of round trips.
 *
 * @param winRate       percentage of trades with positive P/L (0-100)
 * @param profitFactor  gross profit / |gross loss|, or gross profit when nothing lost
 */
public record PerformanceStats(
    BigDecimal totalProfitLoss,
    BigDecimal winRate,
    BigDecimal avgHoldingDays,
    BigDecimal profitFactor,
    int tradeCount
) {
    public static PerformanceStats empty() {
        return new PerformanceStats(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, 0);
    }
}
