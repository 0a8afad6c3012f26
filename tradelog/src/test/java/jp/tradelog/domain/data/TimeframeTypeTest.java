package jp.tradelog.domain.data;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Timeframe Type Tests")
public class TimeframeTypeTest {

    @Test
    @DisplayName("Bucket starts align to Monday and the 1st")
    public void testBucketStart() {
        LocalDate wednesday = LocalDate.of(2024, 5, 15);
        assertEquals(wednesday, TimeframeType.DAILY.bucketStart(wednesday));
        assertEquals(LocalDate.of(2024, 5, 13), TimeframeType.WEEKLY.bucketStart(wednesday));
        assertEquals(LocalDate.of(2024, 5, 13), TimeframeType.WEEKLY.bucketStart(LocalDate.of(2024, 5, 13)));
        assertEquals(LocalDate.of(2024, 5, 1), TimeframeType.MONTHLY.bucketStart(wednesday));
    }

    @Test
    @DisplayName("Query parameter aliases resolve leniently")
    public void testFromParam() {
        assertEquals(TimeframeType.DAILY, TimeframeType.fromParam(null));
        assertEquals(TimeframeType.DAILY, TimeframeType.fromParam(" "));
        assertEquals(TimeframeType.WEEKLY, TimeframeType.fromParam("w"));
        assertEquals(TimeframeType.WEEKLY, TimeframeType.fromParam("Weekly"));
        assertEquals(TimeframeType.MONTHLY, TimeframeType.fromParam("month"));
        assertThrows(IllegalArgumentException.class, () -> TimeframeType.fromParam("hourly"));
    }
}
