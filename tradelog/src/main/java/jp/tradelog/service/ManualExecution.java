package jp.tradelog.service;

import jp.tradelog.domain.common.Country;
import jp.tradelog.domain.trade.Side;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Hand-entered execution, as received from the API. Name is optional and defaults to the symbol.
 */
public record ManualExecution(
    String symbol,
    String name,
    Country country,
    LocalDate date,
    Side side,
    BigDecimal price,
    BigDecimal quantity
) {}
