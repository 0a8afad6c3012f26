package jp.tradelog.service.analysis;

import jp.tradelog.domain.common.Country;
import jp.tradelog.domain.trade.RoundTripTrade;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Portfolio analysis over closed round trips.
 *
 * Stats: total P/L, win rate, average holding days, profit factor, trade count.
 * Histogram: P/L summed per P/L-percent bucket, main period beside a comparison period.
 * Both are computed per market since JPY and USD amounts are never mixed.
 */
public final class PerformanceAnalyzer {

    public static final int DEFAULT_BUCKET_SIZE_PCT = 5;

    private static final MathContext MC = MathContext.DECIMAL64;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public PerformanceStats stats(List<RoundTripTrade> trades) {
        if (trades.isEmpty()) {
            return PerformanceStats.empty();
        }

        BigDecimal total = BigDecimal.ZERO;
        BigDecimal grossProfit = BigDecimal.ZERO;
        BigDecimal grossLoss = BigDecimal.ZERO;
        long holdingDays = 0;
        int wins = 0;

        for (RoundTripTrade trade : trades) {
            BigDecimal pl = trade.profitLoss();
            total = total.add(pl);
            holdingDays += trade.holdingDays();
            if (pl.signum() > 0) {
                wins++;
                grossProfit = grossProfit.add(pl);
            } else if (pl.signum() < 0) {
                grossLoss = grossLoss.add(pl.negate());
            }
        }

        BigDecimal count = BigDecimal.valueOf(trades.size());
        BigDecimal winRate = BigDecimal.valueOf(wins).multiply(HUNDRED).divide(count, MC);
        BigDecimal avgHoldingDays = BigDecimal.valueOf(holdingDays).divide(count, MC);
        BigDecimal profitFactor = grossLoss.signum() == 0
            ? grossProfit
            : grossProfit.divide(grossLoss, MC);

        return new PerformanceStats(total, winRate, avgHoldingDays, profitFactor, trades.size());
    }

    public List<PnlBucket> histogram(List<RoundTripTrade> main, List<RoundTripTrade> comparison) {
        return histogram(main, comparison, DEFAULT_BUCKET_SIZE_PCT);
    }

    /**
     * Bucket both trade sets by P/L percent.
     *
     * Buckets span from the one holding min(0, lowest percent) through the one holding
     * max(0, highest percent), so a 0% bucket is always present.
     */
    public List<PnlBucket> histogram(List<RoundTripTrade> main, List<RoundTripTrade> comparison, int bucketSizePct) {
        if (bucketSizePct <= 0) {
            throw new IllegalArgumentException("Bucket size must be positive: " + bucketSizePct);
        }

        int minBucket = 0;
        int maxBucket = 0;
        for (RoundTripTrade trade : concat(main, comparison)) {
            int bucket = bucketOf(trade.profitLossPercent(), bucketSizePct);
            minBucket = Math.min(minBucket, bucket);
            maxBucket = Math.max(maxBucket, bucket);
        }

        TreeMap<Integer, BigDecimal[]> sums = new TreeMap<>();
        for (int lower = minBucket; lower <= maxBucket; lower += bucketSizePct) {
            sums.put(lower, new BigDecimal[] {BigDecimal.ZERO, BigDecimal.ZERO});
        }
        for (RoundTripTrade trade : main) {
            BigDecimal[] slot = sums.get(bucketOf(trade.profitLossPercent(), bucketSizePct));
            slot[0] = slot[0].add(trade.profitLoss());
        }
        for (RoundTripTrade trade : comparison) {
            BigDecimal[] slot = sums.get(bucketOf(trade.profitLossPercent(), bucketSizePct));
            slot[1] = slot[1].add(trade.profitLoss());
        }

        List<PnlBucket> buckets = new ArrayList<>(sums.size());
        for (Map.Entry<Integer, BigDecimal[]> entry : sums.entrySet()) {
            int lower = entry.getKey();
            buckets.add(new PnlBucket(
                lower,
                lower + "% ~ " + (lower + bucketSizePct) + "%",
                entry.getValue()[0],
                entry.getValue()[1]));
        }
        return buckets;
    }

    public Map<Country, PerformanceStats> byCountry(List<RoundTripTrade> trades) {
        Map<Country, PerformanceStats> result = new EnumMap<>(Country.class);
        for (Country country : Country.values()) {
            result.put(country, stats(filter(trades, country)));
        }
        return result;
    }

    /**
     * Full per-market analysis of a main period against a comparison period.
     * Every market is present, with empty stats when it has no trades.
     */
    public Map<Country, CountryAnalysis> analyze(List<RoundTripTrade> main, List<RoundTripTrade> comparison) {
        Map<Country, CountryAnalysis> result = new EnumMap<>(Country.class);
        for (Country country : Country.values()) {
            List<RoundTripTrade> mainTrades = filter(main, country);
            List<RoundTripTrade> compTrades = filter(comparison, country);
            result.put(country, new CountryAnalysis(
                stats(mainTrades),
                stats(compTrades),
                histogram(mainTrades, compTrades)));
        }
        return result;
    }

    static int bucketOf(BigDecimal percent, int bucketSizePct) {
        BigDecimal size = BigDecimal.valueOf(bucketSizePct);
        return percent.divide(size, 0, RoundingMode.FLOOR).intValueExact() * bucketSizePct;
    }

    private static List<RoundTripTrade> filter(List<RoundTripTrade> trades, Country country) {
        return trades.stream().filter(t -> t.country() == country).toList();
    }

    private static List<RoundTripTrade> concat(List<RoundTripTrade> a, List<RoundTripTrade> b) {
        List<RoundTripTrade> all = new ArrayList<>(a.size() + b.size());
        all.addAll(a);
        all.addAll(b);
        return all;
    }
}
