package jp.tradelog.quote;

/**
 * Failure categories of a quote source call, mapped to HTTP status by the API layer.
 */
public enum QuoteErrorCode {
    NOT_FOUND(404),
    RATE_LIMITED(429),
    HTTP_ERROR(502),
    NO_DATA(404),
    CONFIG_MISSING(500);

    private final int httpStatus;

    QuoteErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
