package jp.tradelog.domain.trade;

/**
 * Execution side.
 */
public enum Side {
    BUY,
    SELL
}
