package jp.tradelog.service.analysis;

import java.util.List;

/**
 * Analysis of one market: stats for the main and comparison periods plus their shared histogram.
 */
public record CountryAnalysis(
    PerformanceStats main,
    PerformanceStats comparison,
    List<PnlBucket> histogram
) {
    public CountryAnalysis {
        histogram = List.copyOf(histogram);
    }
}
