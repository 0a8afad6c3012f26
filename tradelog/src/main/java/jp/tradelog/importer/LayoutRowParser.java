package jp.tradelog.importer;

import jp.tradelog.domain.trade.ExecutionRecord;
import jp.tradelog.domain.trade.Side;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Structural parse of one export layout: find the header row, then turn every
 * following row into an execution, skipping rows that do not qualify.
 */
abstract class LayoutRowParser {
    private static final Logger log = LoggerFactory.getLogger(LayoutRowParser.class);

    static final String BUY_MARKER = "買";
    static final String SELL_MARKER = "売";

    private static final DateTimeFormatter SLASH_DATE = DateTimeFormatter.ofPattern("uuuu/M/d")
        .withResolverStyle(ResolverStyle.STRICT);

    abstract CsvLayout layout();

    abstract boolean isHeader(String line);

    /**
     * Convert one data row. Empty means the row is not a tradable execution.
     * Number, date and value problems surface as {@link IllegalArgumentException}
     * or {@link DateTimeParseException} and are handled by the caller as a skipped row.
     */
    abstract Optional<ExecutionRecord> parseRow(List<String> cells);

    final ImportResult parse(List<String> lines) {
        int headerIndex = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (isHeader(lines.get(i))) {
                headerIndex = i;
                break;
            }
        }
        if (headerIndex < 0) {
            throw new CsvImportException(ImportErrorCode.HEADER_NOT_FOUND, layout());
        }

        List<ExecutionRecord> records = new ArrayList<>();
        int skipped = 0;

        for (int i = headerIndex + 1; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            try {
                Optional<ExecutionRecord> record = parseRow(CsvLineSplitter.split(line));
                if (record.isPresent()) {
                    records.add(record.get());
                } else {
                    skipped++;
                }
            } catch (IllegalArgumentException | DateTimeParseException e) {
                skipped++;
                log.debug("[IMPORT] {} line {} skipped: {}", layout(), i + 1, e.getMessage());
            }
        }

        return new ImportResult(layout(), records, skipped);
    }

    /**
     * Side from the trade-type description. A cell carrying both markers or neither is ambiguous.
     */
    static Optional<Side> resolveSide(String tradeType) {
        boolean buy = tradeType.contains(BUY_MARKER);
        boolean sell = tradeType.contains(SELL_MARKER);
        if (buy == sell) {
            return Optional.empty();
        }
        return Optional.of(buy ? Side.BUY : Side.SELL);
    }

    /**
     * Positive decimal with thousands separators stripped.
     */
    static BigDecimal parsePositiveDecimal(String cell) {
        BigDecimal value = new BigDecimal(cell.replace(",", "").trim());
        if (value.signum() <= 0) {
            throw new NumberFormatException("Not a positive amount: " + cell);
        }
        return value;
    }

    /**
     * yyyy/M/d. Days that do not exist in the month (2024/02/30) are rejected.
     */
    static LocalDate parseSlashDate(String cell) {
        return LocalDate.parse(cell.trim(), SLASH_DATE);
    }
}
