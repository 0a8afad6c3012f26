package jp.tradelog.importer;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Decides which export layout a document uses.
 *
 * Rules are evaluated in fixed priority order and the first match wins:
 * header markers are tried on every line first, then cell-level heuristics on the
 * first data lines. Both passes share the same {@link Rule} evaluation.
 */
public final class LayoutDetector {

    static final String DOMESTIC_CODE_MARKER = "銘柄コード";
    static final String DOMESTIC_DATE_MARKER = "約定日";
    static final String FOREIGN_DATE_MARKER = "国内約定日";
    static final String FOREIGN_NAME_MARKER = "銘柄名";

    private static final Pattern SECURITY_CODE = Pattern.compile("^\\d{4,5}$");

    /** Lines 1..9 (after the first line) are scanned by the cell heuristics. */
    private static final int DATA_SCAN_LIMIT = 10;

    /**
     * One detector predicate bound to the layout it implies.
     */
    record Rule(String name, CsvLayout layout, Predicate<String> matcher) {}

    private static final List<Rule> HEADER_RULES = List.of(
        new Rule("domestic-header", CsvLayout.DOMESTIC,
            line -> line.contains(DOMESTIC_CODE_MARKER)),
        new Rule("foreign-header", CsvLayout.FOREIGN,
            line -> line.contains(FOREIGN_DATE_MARKER) && line.contains(FOREIGN_NAME_MARKER))
    );

    private static final List<Rule> CELL_RULES = List.of(
        new Rule("exchange-name", CsvLayout.FOREIGN,
            cell -> cell.contains("New York Stock Exchange") || cell.contains("NASDAQ")),
        new Rule("security-code", CsvLayout.DOMESTIC,
            cell -> SECURITY_CODE.matcher(cell).matches())
    );

    /**
     * Detect the layout of already split, trimmed, non-empty lines.
     *
     * @throws CsvImportException with {@link ImportErrorCode#FORMAT_UNDETECTED} if nothing matches
     */
    public CsvLayout detect(List<String> lines) {
        for (String line : lines) {
            Optional<CsvLayout> match = firstMatch(HEADER_RULES, List.of(line));
            if (match.isPresent()) {
                return match.get();
            }
        }

        int end = Math.min(lines.size(), DATA_SCAN_LIMIT);
        for (int i = 1; i < end; i++) {
            Optional<CsvLayout> match = firstMatch(CELL_RULES, CsvLineSplitter.split(lines.get(i)));
            if (match.isPresent()) {
                return match.get();
            }
        }

        throw new CsvImportException(ImportErrorCode.FORMAT_UNDETECTED);
    }

    private static Optional<CsvLayout> firstMatch(List<Rule> rules, List<String> candidates) {
        for (Rule rule : rules) {
            for (String candidate : candidates) {
                if (rule.matcher().test(candidate)) {
                    return Optional.of(rule.layout());
                }
            }
        }
        return Optional.empty();
    }
}
