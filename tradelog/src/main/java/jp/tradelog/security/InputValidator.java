package jp.tradelog.security;

import jp.tradelog.domain.common.Country;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.regex.Pattern;

/**
 * Input validator for hand-entered executions.
 *
 * Validation Rules:
 * - JP symbols: 4-5 digit security code, optionally followed by one letter (e.g. 130A)
 * - US symbols: 1-5 uppercase letters, optional class suffix (BRK.B)
 * - Quantities and prices: positive decimals below a sanity ceiling
 * - Names: max 256 chars, no markup
 * - Dates: not in the future
 */
public class InputValidator {

    private static final Pattern JP_SYMBOL_PATTERN = Pattern.compile("^\\d{4,5}[A-Z]?$|^\\d{3}[A-Z]$");
    private static final Pattern US_SYMBOL_PATTERN = Pattern.compile("^[A-Z]{1,5}([.-][A-Z])?$");

    private static final Pattern XSS_PATTERN =
        Pattern.compile(".*(<script|javascript:|onerror=|onload=|<iframe|<object|<embed).*",
            Pattern.CASE_INSENSITIVE);

    // Business limits
    private static final int MAX_NAME_LENGTH = 256;
    private static final BigDecimal MAX_QUANTITY = new BigDecimal("100000000");
    private static final BigDecimal MAX_PRICE = new BigDecimal("100000000");

    /**
     * Validate symbol for the given market.
     *
     * Valid formats:
     * - JP: 7203, 13060, 130A
     * - US: AAPL, BRK.B
     */
    public boolean isValidSymbol(String symbol, Country country) {
        if (symbol == null || symbol.isBlank() || country == null) {
            return false;
        }
        return switch (country) {
            case JP -> JP_SYMBOL_PATTERN.matcher(symbol).matches();
            case US -> US_SYMBOL_PATTERN.matcher(symbol).matches();
        };
    }

    /**
     * @throws IllegalArgumentException if quantity is missing, not positive or above the ceiling
     */
    public void validateQuantity(BigDecimal quantity) {
        if (quantity == null || quantity.signum() <= 0) {
            throw new IllegalArgumentException("Quantity must be positive: " + quantity);
        }
        if (quantity.compareTo(MAX_QUANTITY) > 0) {
            throw new IllegalArgumentException("Quantity exceeds maximum: " + quantity + " > " + MAX_QUANTITY);
        }
    }

    /**
     * @throws IllegalArgumentException if price is missing, not positive or above the ceiling
     */
    public void validatePrice(BigDecimal price) {
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("Price must be positive: " + price);
        }
        if (price.compareTo(MAX_PRICE) > 0) {
            throw new IllegalArgumentException("Price exceeds maximum: " + price + " > " + MAX_PRICE);
        }
    }

    /**
     * @throws IllegalArgumentException if date is missing or after {@code today}
     */
    public void validateDate(LocalDate date, LocalDate today) {
        if (date == null) {
            throw new IllegalArgumentException("Date is required");
        }
        if (date.isAfter(today)) {
            throw new IllegalArgumentException("Date is in the future: " + date);
        }
    }

    public boolean containsXss(String input) {
        if (input == null) return false;
        return XSS_PATTERN.matcher(input).matches();
    }

    /**
     * Trim and validate a display name.
     *
     * @throws IllegalArgumentException if too long or containing markup
     */
    public String sanitizeName(String name) {
        if (name == null) {
            return null;
        }
        String trimmed = name.trim();
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException("Name too long: " + trimmed.length() + " > " + MAX_NAME_LENGTH);
        }
        if (containsXss(trimmed)) {
            throw new IllegalArgumentException("Name contains markup");
        }
        return trimmed;
    }
}
