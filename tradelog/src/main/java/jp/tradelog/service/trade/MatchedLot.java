package jp.tradelog.service.trade;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Buy quantity consumed by one sell.
 */
record MatchedLot(BigDecimal price, BigDecimal quantity, LocalDate date, Long sourceId) {

    BigDecimal cost() {
        return price.multiply(quantity);
    }
}
