package jp.tradelog.importer;

import jp.tradelog.domain.common.Country;

/**
 * Supported broker execution-history export layouts.
 */
public enum CsvLayout {
    /**
     * Domestic equities export: {@code 約定日,銘柄,銘柄コード,...}, one row per fill,
     * 4-5 digit security code in its own column.
     */
    DOMESTIC(Country.JP),

    /**
     * Foreign equities export: {@code 国内約定日,通貨,銘柄名,...}, with the ticker and
     * exchange folded into the name column ("NAME TICKER / Exchange").
     */
    FOREIGN(Country.US);

    private final Country country;

    CsvLayout(Country country) {
        this.country = country;
    }

    public Country country() {
        return country;
    }
}
