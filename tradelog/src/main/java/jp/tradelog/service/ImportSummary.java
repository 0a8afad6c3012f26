package jp.tradelog.service;

import jp.tradelog.domain.common.Country;
import jp.tradelog.importer.CsvLayout;

/**
 * Result of one CSV import.
 *
 * @param imported   executions stored
 * @param skipped    data rows dropped by row filtering
 * @param tradeCount round trips after the rebuild
 */
public record ImportSummary(CsvLayout layout, Country country, int imported, int skipped, int tradeCount) {}
