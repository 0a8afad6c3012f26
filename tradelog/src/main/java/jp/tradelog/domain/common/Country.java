package jp.tradelog.domain.common;

/**
 * Market an instrument is listed on.
 */
public enum Country {
    /** Tokyo-listed equities, 4-5 digit security codes. */
    JP,

    /** US-listed equities, alphabetic tickers. */
    US
}
