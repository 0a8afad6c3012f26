package jp.tradelog.importer;

import jp.tradelog.domain.common.Country;
import jp.tradelog.domain.trade.ExecutionRecord;

import java.util.List;

/**
 * Outcome of a successful parse.
 *
 * @param layout      detected export layout
 * @param records     parsed executions, in file order
 * @param skippedRows data rows dropped by row-level filtering
 */
public record ImportResult(CsvLayout layout, List<ExecutionRecord> records, int skippedRows) {

    public ImportResult {
        records = List.copyOf(records);
    }

    public Country country() {
        return layout.country();
    }

    public int size() {
        return records.size();
    }
}
