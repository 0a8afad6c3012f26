package jp.tradelog.service.candle;

import jp.tradelog.domain.data.HistoricalCandle;
import jp.tradelog.domain.data.TimeframeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Candle Resampler - Build weekly and monthly candles from daily candles.
 *
 * Pattern: bucket every daily candle by {@link TimeframeType#bucketStart}, then
 * recompute OHLCV per bucket from the candles in it.
 *
 * Alignment: weeks start on Monday (ISO), months on the 1st. A bucket's candle is
 * dated at that start even if the first trading day is later.
 */
public final class CandleResampler {
    private static final Logger log = LoggerFactory.getLogger(CandleResampler.class);

    /**
     * Resample candles to a coarser timeframe.
     *
     * @param candles daily candles (any order; sorted by date inside each bucket)
     * @param target  target timeframe
     * @return one candle per bucket, ascending by bucket start
     */
    public List<HistoricalCandle> resample(List<HistoricalCandle> candles, TimeframeType target) {
        if (candles.isEmpty()) {
            return List.of();
        }

        Map<LocalDate, List<HistoricalCandle>> buckets = new TreeMap<>();
        for (HistoricalCandle candle : candles) {
            buckets.computeIfAbsent(target.bucketStart(candle.date()), k -> new ArrayList<>()).add(candle);
        }

        List<HistoricalCandle> resampled = new ArrayList<>(buckets.size());
        for (Map.Entry<LocalDate, List<HistoricalCandle>> bucket : buckets.entrySet()) {
            resampled.add(aggregate(bucket.getValue(), target, bucket.getKey()));
        }

        log.debug("Resampled {} candles into {} {} candles", candles.size(), resampled.size(), target);
        return resampled;
    }

    private HistoricalCandle aggregate(List<HistoricalCandle> bucket, TimeframeType target, LocalDate bucketStart) {
        List<HistoricalCandle> ordered = new ArrayList<>(bucket);
        ordered.sort(Comparator.comparing(HistoricalCandle::date));

        // Aggregate OHLCV
        HistoricalCandle first = ordered.get(0);
        BigDecimal open = first.open(); // First candle's open
        BigDecimal close = ordered.get(ordered.size() - 1).close(); // Last candle's close
        BigDecimal high = ordered.stream()
                .map(HistoricalCandle::high)
                .max(BigDecimal::compareTo)
                .orElse(BigDecimal.ZERO);
        BigDecimal low = ordered.stream()
                .map(HistoricalCandle::low)
                .min(BigDecimal::compareTo)
                .orElse(BigDecimal.ZERO);
        long volume = ordered.stream()
                .mapToLong(HistoricalCandle::volume)
                .sum();

        return new HistoricalCandle(
                first.symbol(),
                target,
                bucketStart,
                open,
                high,
                low,
                close,
                volume);
    }
}
