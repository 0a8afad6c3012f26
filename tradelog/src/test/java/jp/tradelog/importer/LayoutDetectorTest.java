package jp.tradelog.importer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Layout Detector Tests")
public class LayoutDetectorTest {

    private LayoutDetector detector;

    @BeforeEach
    public void setUp() {
        detector = new LayoutDetector();
    }

    @Test
    @DisplayName("Security code header marks the domestic layout")
    public void testDomesticHeader() {
        assertEquals(CsvLayout.DOMESTIC, detector.detect(List.of("約定日,銘柄,銘柄コード,市場")));
    }

    @Test
    @DisplayName("Domestic-date and name headers mark the foreign layout")
    public void testForeignHeader() {
        assertEquals(CsvLayout.FOREIGN, detector.detect(List.of("国内約定日,現地約定日,銘柄名,取引")));
    }

    @Test
    @DisplayName("Header rules win over data heuristics on earlier lines")
    public void testHeaderPriority() {
        List<String> lines = List.of(
            "title",
            "2024/01/05,x,7203",
            "国内約定日,現地約定日,銘柄名,取引");

        assertEquals(CsvLayout.FOREIGN, detector.detect(lines));
    }

    @Test
    @DisplayName("Exchange name in a data cell marks the foreign layout")
    public void testExchangeHeuristic() {
        List<String> lines = List.of(
            "title",
            "2026年01月30日,2026/01/29,APPLE AAPL / NASDAQ,買付");

        assertEquals(CsvLayout.FOREIGN, detector.detect(lines));
    }

    @Test
    @DisplayName("Four or five digit cell marks the domestic layout")
    public void testSecurityCodeHeuristic() {
        assertEquals(CsvLayout.DOMESTIC, detector.detect(List.of("title", "2024/01/05,x,13060")));
    }

    @Test
    @DisplayName("Heuristics ignore the first line and lines past the tenth")
    public void testScanWindow() {
        List<String> lines = new ArrayList<>();
        lines.add("7203");
        for (int i = 0; i < 9; i++) {
            lines.add("nothing,here");
        }
        lines.add("7203");

        CsvImportException e = assertThrows(CsvImportException.class, () -> detector.detect(lines));
        assertEquals(ImportErrorCode.FORMAT_UNDETECTED, e.getCode());
    }
}
