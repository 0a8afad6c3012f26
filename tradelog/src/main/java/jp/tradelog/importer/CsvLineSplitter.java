package jp.tradelog.importer;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits one CSV line into trimmed, unquoted cells.
 *
 * Commas inside double quotes belong to the cell ("1,000" stays one cell) and
 * {@code ""} inside a quoted cell is a literal quote.
 */
final class CsvLineSplitter {

    static List<String> split(String line) {
        List<String> cells = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                if (inQuotes && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    current.append('"');
                    i++;
                } else {
                    inQuotes = !inQuotes;
                }
            } else if (c == ',' && !inQuotes) {
                cells.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        cells.add(current.toString().trim());
        return cells;
    }

    private CsvLineSplitter() {}
}
