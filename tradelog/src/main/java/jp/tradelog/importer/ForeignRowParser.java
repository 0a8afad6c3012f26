package jp.tradelog.importer;

import jp.tradelog.domain.common.Country;
import jp.tradelog.domain.trade.ExecutionRecord;
import jp.tradelog.domain.trade.Side;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Foreign (US) equities layout.
 *
 * Columns used: 0 domestic trade date (yyyy年MM月dd日), 2 "NAME TICKER / Exchange",
 * 3 trade type ("買付" / "売却"), 5 quantity, 6 price.
 */
final class ForeignRowParser extends LayoutRowParser {

    private static final int MIN_CELLS = 7;
    private static final String EXCHANGE_SEPARATOR = " / ";

    private static final Pattern TICKER = Pattern.compile("([A-Z]{1,5}(?:\\.[A-Z])?)\\s*/");
    private static final Pattern TRAILING_TICKER = Pattern.compile("\\s+[A-Z]{1,5}(?:\\.[A-Z])?\\s*$");

    @Override
    CsvLayout layout() {
        return CsvLayout.FOREIGN;
    }

    @Override
    boolean isHeader(String line) {
        return line.contains(LayoutDetector.FOREIGN_DATE_MARKER)
            && line.contains(LayoutDetector.FOREIGN_NAME_MARKER);
    }

    @Override
    Optional<ExecutionRecord> parseRow(List<String> cells) {
        if (cells.size() < MIN_CELLS) {
            return Optional.empty();
        }

        Optional<Side> side = resolveSide(cells.get(3));
        if (side.isEmpty()) {
            return Optional.empty();
        }

        String symbolCell = cells.get(2);
        Optional<String> ticker = extractTicker(symbolCell);
        if (ticker.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(ExecutionRecord.of(
            ticker.get(),
            extractName(symbolCell),
            Country.US,
            parseSlashDate(toSlashDate(cells.get(0))),
            side.get(),
            parsePositiveDecimal(cells.get(6)),
            parsePositiveDecimal(cells.get(5))
        ));
    }

    /**
     * "アメンタム ホールディングス インク AMTM / New York Stock Exchange" -> "AMTM".
     * Class suffixes are kept ("BRK.B"). Empty when no ticker precedes the separator.
     */
    static Optional<String> extractTicker(String symbolCell) {
        Matcher m = TICKER.matcher(symbolCell);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    /**
     * "アメンタム ホールディングス インク AMTM / New York Stock Exchange" -> "アメンタム ホールディングス インク".
     */
    static String extractName(String symbolCell) {
        int sep = symbolCell.indexOf(EXCHANGE_SEPARATOR);
        String beforeExchange = sep >= 0 ? symbolCell.substring(0, sep) : symbolCell;
        return TRAILING_TICKER.matcher(beforeExchange).replaceFirst("").trim();
    }

    /**
     * "2026年01月30日" -> "2026/01/30".
     */
    static String toSlashDate(String cell) {
        return cell.replace('年', '/').replace('月', '/').replace("日", "").trim();
    }
}
