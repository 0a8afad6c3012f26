package jp.tradelog.service.trade;

import jp.tradelog.domain.common.Country;
import jp.tradelog.domain.trade.ExecutionRecord;

/**
 * Matching key: the same code on two markets is two instruments.
 */
record InstrumentKey(String symbol, Country country) {

    static InstrumentKey of(ExecutionRecord record) {
        return new InstrumentKey(record.symbol(), record.country());
    }
}
