package jp.tradelog.repository;

import jp.tradelog.domain.trade.RoundTripTrade;

import java.time.LocalDate;
import java.util.List;

/**
 * Store of derived round-trip trades. Never patched: always replaced as a whole.
 */
public interface RoundTripTradeRepository {
    /**
     * Atomically replace every stored trade with {@code trades}.
     */
    void replaceAll(List<RoundTripTrade> trades);

    /**
     * All trades ordered by exit date.
     */
    List<RoundTripTrade> findAll();

    /**
     * Trades whose exit date lies in [from, to]. A null bound is open.
     */
    List<RoundTripTrade> findByExitDateBetween(LocalDate from, LocalDate to);
}
