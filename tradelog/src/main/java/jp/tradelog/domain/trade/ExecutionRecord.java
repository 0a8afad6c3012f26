package jp.tradelog.domain.trade;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jp.tradelog.domain.common.Country;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * One fill as reported by the broker (or entered by hand).
 *
 * The id is null until the record has been stored; the store assigns it on insert.
 */
public record ExecutionRecord(
    Long id,
    String symbol,
    String name,
    Country country,
    LocalDate date,
    Side side,
    BigDecimal price,
    BigDecimal quantity,
    Instant createdAt
) {
    /**
     * Create an unsaved record.
     */
    public static ExecutionRecord of(String symbol, String name, Country country, LocalDate date,
                                     Side side, BigDecimal price, BigDecimal quantity) {
        return new ExecutionRecord(null, symbol, name, country, date, side, price, quantity, null);
    }

    public ExecutionRecord withId(Long newId) {
        return new ExecutionRecord(newId, symbol, name, country, date, side, price, quantity, createdAt);
    }

    @JsonIgnore
    public boolean isBuy() {
        return side == Side.BUY;
    }
}
