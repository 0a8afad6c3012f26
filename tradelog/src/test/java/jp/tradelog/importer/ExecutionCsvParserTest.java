package jp.tradelog.importer;

import jp.tradelog.domain.common.Country;
import jp.tradelog.domain.trade.ExecutionRecord;
import jp.tradelog.domain.trade.Side;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Execution CSV Parser Tests")
public class ExecutionCsvParserTest {

    private static final String DOMESTIC_HEADER =
        "約定日,銘柄,銘柄コード,市場,取引,期限,預り,課税,約定数量,約定単価,手数料,税額,受渡日,受渡金額";

    private static final String FOREIGN_HEADER =
        "国内約定日,現地約定日,銘柄名,取引,預り区分,約定数量,約定単価,通貨";

    private ExecutionCsvParser parser;

    @BeforeEach
    public void setUp() {
        parser = new ExecutionCsvParser();
    }

    @Test
    @DisplayName("Domestic buy row becomes a JP execution")
    public void testDomesticBuy() {
        String csv = DOMESTIC_HEADER + "\n"
            + "2024/01/05,トヨタ自動車,7203,東証,株式現物買,--,特定,--,100,2500,0,0,2024/01/10,250000\n";

        ImportResult result = parser.parse(csv);

        assertEquals(CsvLayout.DOMESTIC, result.layout());
        assertEquals(Country.JP, result.country());
        assertEquals(1, result.size());
        assertEquals(0, result.skippedRows());

        ExecutionRecord record = result.records().get(0);
        assertNull(record.id());
        assertEquals("7203", record.symbol());
        assertEquals("トヨタ自動車", record.name());
        assertEquals(Country.JP, record.country());
        assertEquals(LocalDate.of(2024, 1, 5), record.date());
        assertEquals(Side.BUY, record.side());
        assertEquals(0, new BigDecimal("100").compareTo(record.quantity()));
        assertEquals(0, new BigDecimal("2500").compareTo(record.price()));
    }

    @Test
    @DisplayName("Quoted amounts with thousands separators are parsed")
    public void testQuotedThousandsSeparator() {
        String csv = DOMESTIC_HEADER + "\n"
            + "2024/01/05,ソニーグループ,6758,東証,株式現物売,--,特定,--,\"1,000\",\"12,345.5\",0,0,2024/01/10,0\n";

        ExecutionRecord record = parser.parse(csv).records().get(0);

        assertEquals(Side.SELL, record.side());
        assertEquals(0, new BigDecimal("1000").compareTo(record.quantity()));
        assertEquals(0, new BigDecimal("12345.5").compareTo(record.price()));
    }

    @Test
    @DisplayName("Domestic rows without code, side or enough cells are skipped")
    public void testDomesticFiltering() {
        String csv = DOMESTIC_HEADER + "\n"
            + "2024/01/05,トヨタ自動車,7203,東証,株式現物買,--,特定,--,100,2500,0,0,2024/01/10,250000\n"
            + "2024/01/05,ｅＭＡＸＩＳ Ｓｌｉｍ,--,--,投信金額買付,--,NISA,--,10000,1,0,0,2024/01/10,10000\n"
            + "2024/01/06,トヨタ自動車,7203,東証,配当金,--,特定,--,100,50,0,0,2024/01/10,5000\n"
            + "2024/01/07,トヨタ自動車,7203\n"
            + "2024/01/08,トヨタ自動車,7203,東証,株式現物買,--,特定,--,0,2500,0,0,2024/01/10,0\n"
            + "bad-date,トヨタ自動車,7203,東証,株式現物買,--,特定,--,100,2500,0,0,2024/01/10,250000\n";

        ImportResult result = parser.parse(csv);

        assertEquals(1, result.size());
        assertEquals(5, result.skippedRows());
    }

    @Test
    @DisplayName("Foreign row yields ticker, stripped name and kanji date")
    public void testForeignRow() {
        String csv = FOREIGN_HEADER + "\n"
            + "2026年01月30日,2026/01/29,アメンタム ホールディングス インク AMTM / New York Stock Exchange,買付,特定,10,23.45,USD\n"
            + "2026年02月03日,2026/02/02,アップル AAPL / NASDAQ,売却,特定,5,\"1,234.50\",USD\n";

        ImportResult result = parser.parse(csv);

        assertEquals(CsvLayout.FOREIGN, result.layout());
        assertEquals(Country.US, result.country());
        assertEquals(2, result.size());

        ExecutionRecord buy = result.records().get(0);
        assertEquals("AMTM", buy.symbol());
        assertEquals("アメンタム ホールディングス インク", buy.name());
        assertEquals(LocalDate.of(2026, 1, 30), buy.date());
        assertEquals(Side.BUY, buy.side());
        assertEquals(0, new BigDecimal("10").compareTo(buy.quantity()));
        assertEquals(0, new BigDecimal("23.45").compareTo(buy.price()));

        ExecutionRecord sell = result.records().get(1);
        assertEquals("AAPL", sell.symbol());
        assertEquals(Side.SELL, sell.side());
        assertEquals(0, new BigDecimal("1234.50").compareTo(sell.price()));
    }

    @Test
    @DisplayName("Days that do not exist in the month are skipped, not shifted")
    public void testImpossibleDateSkipped() {
        String csv = DOMESTIC_HEADER + "\n"
            + "2024/02/30,トヨタ自動車,7203,東証,株式現物買,--,特定,--,100,2500,0,0,2024/03/05,250000\n"
            + "2024/01/05,トヨタ自動車,7203,東証,株式現物買,--,特定,--,100,2500,0,0,2024/01/10,250000\n"
            + "2023/02/29,トヨタ自動車,7203,東証,株式現物売,--,特定,--,100,2600,0,0,2023/03/05,260000\n";

        ImportResult result = parser.parse(csv);

        assertEquals(1, result.size());
        assertEquals(2, result.skippedRows());
        assertEquals(LocalDate.of(2024, 1, 5), result.records().get(0).date());
    }

    @Test
    @DisplayName("Foreign dates are checked strictly too")
    public void testForeignImpossibleDateSkipped() {
        String csv = FOREIGN_HEADER + "\n"
            + "2026年04月31日,2026/04/30,アップル AAPL / NASDAQ,買付,特定,5,190.00,USD\n"
            + "2024年02月29日,2024/02/28,アップル AAPL / NASDAQ,買付,特定,5,180.00,USD\n";

        ImportResult result = parser.parse(csv);

        assertEquals(1, result.size());
        assertEquals(1, result.skippedRows());
        assertEquals(LocalDate.of(2024, 2, 29), result.records().get(0).date());
    }

    @Test
    @DisplayName("Class-suffixed tickers are kept and rows without a ticker are skipped")
    public void testForeignTickerExtraction() {
        String csv = FOREIGN_HEADER + "\n"
            + "2026年01月30日,2026/01/29,バークシャー ハサウェイ クラスB BRK.B / New York Stock Exchange,買付,特定,3,480.10,USD\n"
            + "2026年01月30日,2026/01/29,フォード モーター F / New York Stock Exchange,買付,特定,20,11.05,USD\n"
            + "2026年01月30日,2026/01/29,銘柄不明 / New York Stock Exchange,買付,特定,1,10.00,USD\n";

        ImportResult result = parser.parse(csv);

        assertEquals(2, result.size());
        assertEquals(1, result.skippedRows());

        ExecutionRecord berkshire = result.records().get(0);
        assertEquals("BRK.B", berkshire.symbol());
        assertEquals("バークシャー ハサウェイ クラスB", berkshire.name());

        ExecutionRecord ford = result.records().get(1);
        assertEquals("F", ford.symbol());
        assertEquals("フォード モーター", ford.name());
        result.records().forEach(r -> assertTrue(r.symbol().length() <= 32, r.symbol()));
    }

    @Test
    @DisplayName("Preamble lines before the header are ignored")
    public void testPreambleBeforeHeader() {
        String csv = "約定履歴照会\n"
            + "出力日時,2024/02/01 10:00\n"
            + "\n"
            + DOMESTIC_HEADER + "\n"
            + "2024/01/05,トヨタ自動車,7203,東証,株式現物買,--,特定,--,100,2500,0,0,2024/01/10,250000\n";

        ImportResult result = parser.parse(csv);

        assertEquals(1, result.size());
        assertEquals(0, result.skippedRows());
    }

    @Test
    @DisplayName("Shift_JIS bytes are decoded by default")
    public void testShiftJisBytes() {
        String csv = DOMESTIC_HEADER + "\r\n"
            + "2024/01/05,トヨタ自動車,7203,東証,株式現物買,--,特定,--,100,2500,0,0,2024/01/10,250000\r\n";
        byte[] bytes = csv.getBytes(Charset.forName("windows-31j"));

        ImportResult result = parser.parse(bytes);

        assertEquals(1, result.size());
        assertEquals("トヨタ自動車", result.records().get(0).name());
    }

    @Test
    @DisplayName("UTF-8 byte order mark overrides the default charset")
    public void testUtf8Bom() {
        String csv = "\uFEFF" + DOMESTIC_HEADER + "\n"
            + "2024/01/05,トヨタ自動車,7203,東証,株式現物買,--,特定,--,100,2500,0,0,2024/01/10,250000\n";
        byte[] bytes = csv.getBytes(StandardCharsets.UTF_8);

        ImportResult result = parser.parse(bytes);

        assertEquals(1, result.size());
        assertEquals("トヨタ自動車", result.records().get(0).name());
    }

    @Test
    @DisplayName("Unrecognised document fails with FORMAT_UNDETECTED")
    public void testFormatUndetected() {
        CsvImportException e = assertThrows(CsvImportException.class,
            () -> parser.parse("date,symbol,qty\n2024-01-01,AAPL,10\n"));

        assertEquals(ImportErrorCode.FORMAT_UNDETECTED, e.getCode());
        assertNull(e.getLayout());
        assertFalse(e.getUserMessage().isEmpty());
    }

    @Test
    @DisplayName("Empty document fails with FORMAT_UNDETECTED")
    public void testEmptyDocument() {
        CsvImportException e = assertThrows(CsvImportException.class, () -> parser.parse(new byte[0]));
        assertEquals(ImportErrorCode.FORMAT_UNDETECTED, e.getCode());
    }

    @Test
    @DisplayName("Header only fails with NO_RECORDS_PARSED")
    public void testHeaderOnly() {
        CsvImportException e = assertThrows(CsvImportException.class,
            () -> parser.parse(DOMESTIC_HEADER + "\n"));

        assertEquals(ImportErrorCode.NO_RECORDS_PARSED, e.getCode());
        assertEquals(CsvLayout.DOMESTIC, e.getLayout());
    }

    @Test
    @DisplayName("Layout found from data rows without a header fails with HEADER_NOT_FOUND")
    public void testHeaderMissing() {
        String csv = "x,y\n"
            + "2024/01/05,トヨタ自動車,7203,東証,株式現物買,--,特定,--,100,2500\n";

        CsvImportException e = assertThrows(CsvImportException.class, () -> parser.parse(csv));

        assertEquals(ImportErrorCode.HEADER_NOT_FOUND, e.getCode());
        assertEquals(CsvLayout.DOMESTIC, e.getLayout());
    }
}
