package jp.tradelog.domain.trade;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jp.tradelog.domain.common.Country;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Closed position: one or more (possibly partial) buys matched against a single sell.
 *
 * Entry side is weighted-average over the matched buy fragments; exit side is the
 * sell's own price since a sell is never split across round trips.
 */
public record RoundTripTrade(
    Long id,
    String symbol,
    String name,
    Country country,

    // Entry
    LocalDate entryDate,
    BigDecimal avgEntryPrice,
    BigDecimal totalQuantity,
    BigDecimal totalEntryCost,

    // Exit
    LocalDate exitDate,
    BigDecimal avgExitPrice,
    BigDecimal totalExitRevenue,

    // Result
    BigDecimal profitLoss,
    BigDecimal profitLossPercent,
    long holdingDays,

    // Source executions
    List<Long> entryExecutionIds,
    List<Long> exitExecutionIds
) {
    public RoundTripTrade {
        entryExecutionIds = entryExecutionIds == null ? List.of() : List.copyOf(entryExecutionIds);
        exitExecutionIds = exitExecutionIds == null ? List.of() : List.copyOf(exitExecutionIds);
    }

    public RoundTripTrade withId(Long newId) {
        return new RoundTripTrade(newId, symbol, name, country, entryDate, avgEntryPrice, totalQuantity,
            totalEntryCost, exitDate, avgExitPrice, totalExitRevenue, profitLoss, profitLossPercent,
            holdingDays, entryExecutionIds, exitExecutionIds);
    }

    @JsonIgnore
    public boolean isWin() {
        return profitLoss.signum() > 0;
    }

    @JsonIgnore
    public boolean isLoss() {
        return profitLoss.signum() < 0;
    }
}
