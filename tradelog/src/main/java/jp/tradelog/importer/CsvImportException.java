package jp.tradelog.importer;

/**
 * Thrown when an input document cannot be imported at all.
 *
 * Not retryable: the same bytes will fail the same way.
 */
public class CsvImportException extends RuntimeException {

    private final ImportErrorCode code;
    private final CsvLayout layout;

    public CsvImportException(ImportErrorCode code) {
        this(code, null);
    }

    public CsvImportException(ImportErrorCode code, CsvLayout layout) {
        super(layout == null
            ? String.format("[%s] %s", code, code.userMessage())
            : String.format("[%s:%s] %s", code, layout, code.userMessage()));
        this.code = code;
        this.layout = layout;
    }

    public ImportErrorCode getCode() {
        return code;
    }

    /**
     * Layout that was detected before the failure, or null if detection itself failed.
     */
    public CsvLayout getLayout() {
        return layout;
    }

    public String getUserMessage() {
        return code.userMessage();
    }
}
