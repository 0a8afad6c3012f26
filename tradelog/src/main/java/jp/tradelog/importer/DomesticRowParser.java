package jp.tradelog.importer;

import jp.tradelog.domain.common.Country;
import jp.tradelog.domain.trade.ExecutionRecord;
import jp.tradelog.domain.trade.Side;

import java.util.List;
import java.util.Optional;

/**
 * Domestic equities layout.
 *
 * Columns used: 0 trade date (yyyy/MM/dd), 1 name, 2 security code, 4 trade type
 * ("株式現物買" / "株式現物売"), 8 quantity, 9 price.
 */
final class DomesticRowParser extends LayoutRowParser {

    private static final int MIN_CELLS = 10;
    private static final String NO_CODE = "--";

    @Override
    CsvLayout layout() {
        return CsvLayout.DOMESTIC;
    }

    @Override
    boolean isHeader(String line) {
        return line.contains(LayoutDetector.DOMESTIC_DATE_MARKER)
            && line.contains(LayoutDetector.DOMESTIC_CODE_MARKER);
    }

    @Override
    Optional<ExecutionRecord> parseRow(List<String> cells) {
        if (cells.size() < MIN_CELLS) {
            return Optional.empty();
        }

        // Investment trusts carry no security code
        String code = cells.get(2);
        if (code.isEmpty() || NO_CODE.equals(code)) {
            return Optional.empty();
        }

        Optional<Side> side = resolveSide(cells.get(4));
        if (side.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(ExecutionRecord.of(
            code,
            cells.get(1),
            Country.JP,
            parseSlashDate(cells.get(0)),
            side.get(),
            parsePositiveDecimal(cells.get(9)),
            parsePositiveDecimal(cells.get(8))
        ));
    }
}
