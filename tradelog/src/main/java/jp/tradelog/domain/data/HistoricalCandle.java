package jp.tradelog.domain.data;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Historical OHLCV candle. For resampled timeframes the date is the bucket start.
 */
public record HistoricalCandle(
                String symbol,
                TimeframeType timeframe,
                LocalDate date,
                BigDecimal open,
                BigDecimal high,
                BigDecimal low,
                BigDecimal close,
                long volume) {

    /**
     * Create a daily candle from raw values.
     */
    public static HistoricalCandle daily(String symbol, LocalDate date, double o, double h, double l, double c, long v) {
        return new HistoricalCandle(
            symbol, TimeframeType.DAILY, date,
            BigDecimal.valueOf(o),
            BigDecimal.valueOf(h),
            BigDecimal.valueOf(l),
            BigDecimal.valueOf(c),
            v
        );
    }
}
