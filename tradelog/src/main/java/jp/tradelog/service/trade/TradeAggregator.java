package jp.tradelog.service.trade;

import jp.tradelog.domain.trade.ExecutionRecord;
import jp.tradelog.domain.trade.RoundTripTrade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Trade Aggregator - turns raw executions into closed round-trip trades.
 *
 * Pattern: group by (symbol, country), order each group by execution date, then
 * walk it with a FIFO {@link LotQueue}. A buy opens a lot; a sell consumes lots
 * from the head, splitting the head lot when it is larger than what is left to
 * match, and yields one {@link RoundTripTrade}.
 *
 * Matching policy:
 * - Same-day executions keep their input order (stable sort). Executions carry no
 *   time of day, so input order is the only tie-break available.
 * - A sell with no open lots produces no trade. Short positions are not tracked.
 * - The part of a sell larger than all open lots is dropped, not carried forward.
 *
 * The result is a pure function of the input: callers rebuild the full trade set
 * after any change to executions instead of patching it.
 */
public final class TradeAggregator {
    private static final Logger log = LoggerFactory.getLogger(TradeAggregator.class);

    private static final MathContext MC = MathContext.DECIMAL64;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * Aggregate executions into round-trip trades.
     *
     * @param executions executions in any order; not modified
     * @return trades grouped by instrument (first-appearance order), in sell order within an instrument
     */
    public List<RoundTripTrade> aggregate(List<ExecutionRecord> executions) {
        Map<InstrumentKey, List<ExecutionRecord>> groups = new LinkedHashMap<>();
        for (ExecutionRecord execution : executions) {
            groups.computeIfAbsent(InstrumentKey.of(execution), k -> new ArrayList<>()).add(execution);
        }

        List<RoundTripTrade> trades = new ArrayList<>();
        for (Map.Entry<InstrumentKey, List<ExecutionRecord>> entry : groups.entrySet()) {
            List<ExecutionRecord> sorted = new ArrayList<>(entry.getValue());
            sorted.sort(Comparator.comparing(ExecutionRecord::date));
            trades.addAll(match(entry.getKey(), sorted));
        }

        log.debug("[AGGREGATE] {} executions across {} instruments -> {} round trips",
            executions.size(), groups.size(), trades.size());
        return trades;
    }

    private List<RoundTripTrade> match(InstrumentKey key, List<ExecutionRecord> sorted) {
        List<RoundTripTrade> trades = new ArrayList<>();
        LotQueue queue = new LotQueue();

        for (ExecutionRecord execution : sorted) {
            if (execution.isBuy()) {
                queue.add(execution);
                continue;
            }

            List<MatchedLot> matched = queue.consume(execution.quantity());
            if (matched.isEmpty()) {
                log.debug("[AGGREGATE] {} {} sell on {} has no open lots, ignored",
                    key.symbol(), key.country(), execution.date());
                continue;
            }

            RoundTripTrade trade = toRoundTrip(matched, execution);
            BigDecimal unmatched = execution.quantity().subtract(trade.totalQuantity());
            if (unmatched.signum() > 0) {
                log.debug("[AGGREGATE] {} {} sell on {} exceeds open lots, {} dropped",
                    key.symbol(), key.country(), execution.date(), unmatched);
            }
            trades.add(trade);
        }
        return trades;
    }

    /**
     * Build a round trip from the buy lots a single sell consumed.
     */
    static RoundTripTrade toRoundTrip(List<MatchedLot> buys, ExecutionRecord sell) {
        BigDecimal totalQuantity = BigDecimal.ZERO;
        BigDecimal totalEntryCost = BigDecimal.ZERO;
        for (MatchedLot buy : buys) {
            totalQuantity = totalQuantity.add(buy.quantity());
            totalEntryCost = totalEntryCost.add(buy.cost());
        }

        BigDecimal avgEntryPrice = totalQuantity.signum() == 0
            ? BigDecimal.ZERO
            : totalEntryCost.divide(totalQuantity, MC);
        BigDecimal totalExitRevenue = sell.price().multiply(totalQuantity);
        BigDecimal profitLoss = totalExitRevenue.subtract(totalEntryCost);
        BigDecimal profitLossPercent = totalEntryCost.signum() == 0
            ? BigDecimal.ZERO
            : profitLoss.divide(totalEntryCost, MC).multiply(HUNDRED);

        MatchedLot first = buys.get(0);
        long holdingDays = Math.abs(ChronoUnit.DAYS.between(first.date(), sell.date()));

        List<Long> entryIds = buys.stream()
            .map(MatchedLot::sourceId)
            .filter(Objects::nonNull)
            .toList();
        List<Long> exitIds = sell.id() == null ? List.of() : List.of(sell.id());

        return new RoundTripTrade(
            null,
            sell.symbol(),
            sell.name(),
            sell.country(),
            first.date(),
            avgEntryPrice,
            totalQuantity,
            totalEntryCost,
            sell.date(),
            sell.price(),
            totalExitRevenue,
            profitLoss,
            profitLossPercent,
            holdingDays,
            entryIds,
            exitIds
        );
    }
}
