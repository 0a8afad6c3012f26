package jp.tradelog.importer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * Broker execution-history CSV parser.
 *
 * Pipeline: decode bytes (legacy Japanese encoding by default) -> split into
 * trimmed non-empty lines -> detect layout -> layout-specific row parse.
 *
 * Usage:
 * <pre>
 * ExecutionCsvParser parser = new ExecutionCsvParser();
 * ImportResult result = parser.parse(Files.readAllBytes(path));
 * result.records().forEach(repo::insert);
 * </pre>
 *
 * Stateless and safe to share between threads.
 */
public final class ExecutionCsvParser {
    private static final Logger log = LoggerFactory.getLogger(ExecutionCsvParser.class);

    /** Shift_JIS superset that the broker exports are actually written in. */
    public static final String DEFAULT_CHARSET = "windows-31j";

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    private final Charset charset;
    private final LayoutDetector detector = new LayoutDetector();
    private final DomesticRowParser domesticParser = new DomesticRowParser();
    private final ForeignRowParser foreignParser = new ForeignRowParser();

    public ExecutionCsvParser() {
        this(Charset.forName(DEFAULT_CHARSET));
    }

    public ExecutionCsvParser(Charset charset) {
        this.charset = charset;
    }

    /**
     * Decode and parse a raw export.
     *
     * @throws CsvImportException if the layout cannot be determined or nothing parses
     */
    public ImportResult parse(byte[] bytes) {
        return parse(decode(bytes));
    }

    /**
     * Parse already decoded text.
     *
     * @throws CsvImportException if the layout cannot be determined or nothing parses
     */
    public ImportResult parse(String text) {
        List<String> lines = text.lines()
            .map(String::trim)
            .filter(line -> !line.isEmpty())
            .toList();

        CsvLayout layout = detector.detect(lines);
        log.debug("[IMPORT] Detected layout {} ({} lines)", layout, lines.size());

        LayoutRowParser rowParser = switch (layout) {
            case DOMESTIC -> domesticParser;
            case FOREIGN -> foreignParser;
        };

        ImportResult result = rowParser.parse(lines);
        if (result.records().isEmpty()) {
            log.warn("[IMPORT] Layout {} detected but no rows parsed ({} skipped)", layout, result.skippedRows());
            throw new CsvImportException(ImportErrorCode.NO_RECORDS_PARSED, layout);
        }

        log.info("[IMPORT] Parsed {} executions ({}), skipped {} rows",
            result.size(), layout, result.skippedRows());
        return result;
    }

    /**
     * Decode with the configured charset. Malformed sequences become the
     * replacement character. A UTF-8 byte order mark switches to UTF-8.
     */
    String decode(byte[] bytes) {
        if (bytes.length >= UTF8_BOM.length && Arrays.equals(bytes, 0, UTF8_BOM.length, UTF8_BOM, 0, UTF8_BOM.length)) {
            return new String(bytes, UTF8_BOM.length, bytes.length - UTF8_BOM.length, StandardCharsets.UTF_8);
        }
        return new String(bytes, charset);
    }

    public Charset charset() {
        return charset;
    }
}
