package jp.tradelog.service.candle;

import jp.tradelog.domain.common.Country;
import jp.tradelog.domain.data.HistoricalCandle;
import jp.tradelog.domain.data.TimeframeType;
import jp.tradelog.quote.QuoteSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Chart candles for a symbol: daily bars from the quote source, resampled on request.
 */
public class ChartDataService {
    private static final Logger log = LoggerFactory.getLogger(ChartDataService.class);

    private final QuoteSource quoteSource;
    private final CandleResampler resampler;

    public ChartDataService(QuoteSource quoteSource, CandleResampler resampler) {
        this.quoteSource = quoteSource;
        this.resampler = resampler;
    }

    public CompletableFuture<List<HistoricalCandle>> candles(String symbol, Country country,
                                                             LocalDate from, LocalDate to,
                                                             TimeframeType timeframe) {
        if (from != null && to != null && from.isAfter(to)) {
            return CompletableFuture.failedFuture(
                new IllegalArgumentException("from must not be after to: " + from + " > " + to));
        }
        return quoteSource.fetchDaily(symbol, country, from, to)
            .thenApply(daily -> {
                if (timeframe == TimeframeType.DAILY) {
                    return daily;
                }
                List<HistoricalCandle> resampled = resampler.resample(daily, timeframe);
                log.debug("[CHART] {} {}: {} daily -> {} {} candles",
                    symbol, country, daily.size(), resampled.size(), timeframe);
                return resampled;
            });
    }
}
