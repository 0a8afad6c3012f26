package jp.tradelog.service.trade;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Unconsumed remainder of one buy. Owned by a single {@link LotQueue} slot.
 */
final class LotFragment {
    private final BigDecimal price;
    private final LocalDate date;
    private final Long sourceId;
    private BigDecimal residualQuantity;

    LotFragment(BigDecimal price, BigDecimal quantity, LocalDate date, Long sourceId) {
        this.price = price;
        this.residualQuantity = quantity;
        this.date = date;
        this.sourceId = sourceId;
    }

    BigDecimal price() {
        return price;
    }

    BigDecimal residualQuantity() {
        return residualQuantity;
    }

    LocalDate date() {
        return date;
    }

    Long sourceId() {
        return sourceId;
    }

    /**
     * Take {@code quantity} off this fragment, which must hold strictly more.
     */
    void reduce(BigDecimal quantity) {
        if (quantity.compareTo(residualQuantity) >= 0) {
            throw new IllegalStateException("Split of " + quantity + " would exhaust fragment of " + residualQuantity);
        }
        residualQuantity = residualQuantity.subtract(quantity);
    }
}
