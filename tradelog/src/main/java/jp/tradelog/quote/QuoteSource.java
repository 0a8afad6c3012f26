package jp.tradelog.quote;

import jp.tradelog.domain.common.Country;
import jp.tradelog.domain.data.HistoricalCandle;

import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Source of daily OHLCV bars for chart display.
 */
public interface QuoteSource {

    /**
     * Fetch daily candles for a symbol.
     *
     * @param symbol  ticker or security code as stored on executions
     * @param country market the symbol trades on
     * @param from    first date to keep, or null for no lower bound
     * @param to      last date to keep, or null for no upper bound
     * @return daily candles in ascending date order; completes exceptionally with
     *         {@link QuoteSourceException} on failure
     */
    CompletableFuture<List<HistoricalCandle>> fetchDaily(String symbol, Country country, LocalDate from, LocalDate to);

    String getSourceCode();
}
