package jp.tradelog.service.analysis;

import java.math.BigDecimal;

/**
 * One P/L percent histogram bucket covering [lowerBound, lowerBound + size).
 */
public record PnlBucket(
    int lowerBound,
    String label,
    BigDecimal mainProfitLoss,
    BigDecimal comparisonProfitLoss
) {}
