package jp.tradelog.domain.data;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/**
 * Candle timeframes supported by the chart data path.
 *
 * Quote sources only deliver {@link #DAILY}; the coarser timeframes are
 * resampled from daily candles.
 */
public enum TimeframeType {
    /**
     * One candle per trading day.
     */
    DAILY,

    /**
     * One candle per ISO week, keyed by the Monday of that week.
     * Sunday belongs to the week that started six days earlier.
     */
    WEEKLY,

    /**
     * One candle per calendar month, keyed by the 1st.
     */
    MONTHLY;

    /**
     * Canonical start date of the bucket containing {@code date}.
     */
    public LocalDate bucketStart(LocalDate date) {
        return switch (this) {
            case DAILY -> date;
            case WEEKLY -> date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTHLY -> date.withDayOfMonth(1);
        };
    }

    /**
     * Lenient lookup for query parameters ("week", "W", "monthly"...). Null or blank means DAILY.
     */
    public static TimeframeType fromParam(String value) {
        if (value == null || value.isBlank()) {
            return DAILY;
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "D", "DAY", "DAILY" -> DAILY;
            case "W", "WEEK", "WEEKLY" -> WEEKLY;
            case "M", "MONTH", "MONTHLY" -> MONTHLY;
            default -> throw new IllegalArgumentException("Unknown timeframe: " + value);
        };
    }
}
