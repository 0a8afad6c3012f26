package jp.tradelog.importer;

/**
 * Terminal failures of a CSV import. Row-level problems are never reported here;
 * those rows are skipped.
 */
public enum ImportErrorCode {
    /** Neither layout's header nor the data-row heuristics matched. */
    FORMAT_UNDETECTED("CSVファイルの形式を判別できませんでした。約定履歴CSVであることを確認してください。"),

    /** Layout guessed from data rows, but its header row is missing. */
    HEADER_NOT_FOUND("CSVのヘッダー行が見つかりませんでした。"),

    /** Layout detected, but no row survived row-level filtering. */
    NO_RECORDS_PARSED("CSVファイルからデータを読み取れませんでした。対応している約定履歴CSVか確認してください。");

    private final String userMessage;

    ImportErrorCode(String userMessage) {
        this.userMessage = userMessage;
    }

    public String userMessage() {
        return userMessage;
    }
}
