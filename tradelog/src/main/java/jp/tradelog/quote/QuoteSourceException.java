package jp.tradelog.quote;

/**
 * Exception thrown when daily quotes cannot be obtained for a symbol.
 */
public class QuoteSourceException extends RuntimeException {

    private final QuoteErrorCode code;
    private final String symbol;

    public QuoteSourceException(QuoteErrorCode code, String symbol, String message) {
        super(String.format("[%s:%s] %s", code, symbol, message));
        this.code = code;
        this.symbol = symbol;
    }

    public QuoteSourceException(QuoteErrorCode code, String symbol, String message, Throwable cause) {
        super(String.format("[%s:%s] %s", code, symbol, message), cause);
        this.code = code;
        this.symbol = symbol;
    }

    public QuoteErrorCode getCode() {
        return code;
    }

    public String getSymbol() {
        return symbol;
    }
}
