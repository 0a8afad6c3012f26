package jp.tradelog.service.candle;

import jp.tradelog.domain.data.HistoricalCandle;
import jp.tradelog.domain.data.TimeframeType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Candle Resampler Tests")
public class CandleResamplerTest {

    private CandleResampler resampler;

    @BeforeEach
    public void setUp() {
        resampler = new CandleResampler();
    }

    private static HistoricalCandle day(String date, double o, double h, double l, double c, long v) {
        return HistoricalCandle.daily("AAPL", LocalDate.parse(date), o, h, l, c, v);
    }

    private static void assertPrice(double expected, BigDecimal actual) {
        assertEquals(0, BigDecimal.valueOf(expected).compareTo(actual), "expected " + expected + " but was " + actual);
    }

    @Test
    @DisplayName("Monday to Friday collapse into one weekly candle")
    public void testWeeklyBucket() {
        // 2024-01-08 is a Monday
        List<HistoricalCandle> daily = List.of(
            day("2024-01-08", 10, 12, 9, 11, 200),
            day("2024-01-09", 11, 15, 10, 12, 200),
            day("2024-01-10", 12, 13, 8, 10, 200),
            day("2024-01-11", 10, 14, 10, 13, 200),
            day("2024-01-12", 13, 14, 12, 14, 200));

        List<HistoricalCandle> weekly = resampler.resample(daily, TimeframeType.WEEKLY);

        assertEquals(1, weekly.size());
        HistoricalCandle w = weekly.get(0);
        assertEquals(TimeframeType.WEEKLY, w.timeframe());
        assertEquals(LocalDate.of(2024, 1, 8), w.date());
        assertEquals("AAPL", w.symbol());
        assertPrice(10, w.open());
        assertPrice(14, w.close());
        assertPrice(15, w.high());
        assertPrice(8, w.low());
        assertEquals(1000, w.volume());
    }

    @Test
    @DisplayName("Unordered input is ordered inside each bucket")
    public void testUnorderedInput() {
        List<HistoricalCandle> daily = List.of(
            day("2024-01-12", 13, 14, 12, 14, 1),
            day("2024-01-08", 10, 12, 9, 11, 1),
            day("2024-01-15", 20, 21, 19, 20, 1));

        List<HistoricalCandle> weekly = resampler.resample(daily, TimeframeType.WEEKLY);

        assertEquals(2, weekly.size());
        assertEquals(LocalDate.of(2024, 1, 8), weekly.get(0).date());
        assertPrice(10, weekly.get(0).open());
        assertPrice(14, weekly.get(0).close());
        assertEquals(LocalDate.of(2024, 1, 15), weekly.get(1).date());
    }

    @Test
    @DisplayName("Sunday belongs to the week that started the previous Monday")
    public void testSundayBucket() {
        List<HistoricalCandle> weekly = resampler.resample(
            List.of(day("2024-01-14", 1, 1, 1, 1, 1)), TimeframeType.WEEKLY);

        assertEquals(LocalDate.of(2024, 1, 8), weekly.get(0).date());
    }

    @Test
    @DisplayName("Monthly candles are keyed by the first of the month")
    public void testMonthly() {
        List<HistoricalCandle> daily = List.of(
            day("2024-01-31", 5, 6, 4, 5, 10),
            day("2024-02-01", 6, 9, 6, 8, 20),
            day("2024-02-29", 8, 8, 3, 4, 30));

        List<HistoricalCandle> monthly = resampler.resample(daily, TimeframeType.MONTHLY);

        assertEquals(2, monthly.size());
        assertEquals(LocalDate.of(2024, 1, 1), monthly.get(0).date());
        HistoricalCandle feb = monthly.get(1);
        assertEquals(LocalDate.of(2024, 2, 1), feb.date());
        assertPrice(6, feb.open());
        assertPrice(4, feb.close());
        assertPrice(9, feb.high());
        assertPrice(3, feb.low());
        assertEquals(50, feb.volume());
    }

    @Test
    @DisplayName("Resampling monthly output to monthly again changes nothing")
    public void testMonthlyIdempotent() {
        List<HistoricalCandle> daily = new ArrayList<>();
        LocalDate date = LocalDate.of(2023, 11, 1);
        for (int i = 0; i < 120; i++) {
            double base = 100 + (i % 17) - (i % 5);
            daily.add(HistoricalCandle.daily("7203", date, base, base + 3, base - 2, base + 1, 1000L + i));
            date = date.plusDays(1);
        }

        List<HistoricalCandle> once = resampler.resample(daily, TimeframeType.MONTHLY);
        List<HistoricalCandle> twice = resampler.resample(once, TimeframeType.MONTHLY);

        assertEquals(once, twice);
    }

    @Test
    @DisplayName("Empty input yields empty output")
    public void testEmpty() {
        assertTrue(resampler.resample(List.of(), TimeframeType.WEEKLY).isEmpty());
    }
}
