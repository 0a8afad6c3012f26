package jp.tradelog.quote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jp.tradelog.domain.common.Country;
import jp.tradelog.domain.data.HistoricalCandle;
import jp.tradelog.domain.data.TimeframeType;
import jp.tradelog.metrics.TradeLogMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Alpha Vantage daily quote client.
 *
 * Endpoint: {baseUrl}/query?function=TIME_SERIES_DAILY&symbol={symbol}&apikey={key}
 *
 * Response format:
 * <pre>
 * {
 *   "Meta Data": { ... },
 *   "Time Series (Daily)": {
 *     "2023-10-27": { "1. open": "166.9100", "2. high": "168.9600", "3. low": "166.8300",
 *                     "4. close": "168.2200", "5. volume": "58499129" }
 *   }
 * }
 * </pre>
 *
 * Alpha Vantage reports most failures with HTTP 200 and a message field:
 * "Error Message" for an unknown symbol, "Note" or "Information" for rate limits.
 */
public class AlphaVantageQuoteClient implements QuoteSource {
    private static final Logger log = LoggerFactory.getLogger(AlphaVantageQuoteClient.class);

    static final String SERIES_KEY = "Time Series (Daily)";

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final String baseUrl;
    private final String apiKey;
    private final Duration timeout;
    private final TradeLogMetrics metrics;

    public AlphaVantageQuoteClient(String baseUrl, String apiKey, Duration timeout, TradeLogMetrics metrics) {
        this.httpClient = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(timeout)
            .build();
        this.mapper = new ObjectMapper();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.timeout = timeout;
        this.metrics = metrics;
    }

    @Override
    public String getSourceCode() {
        return "ALPHA_VANTAGE";
    }

    @Override
    public CompletableFuture<List<HistoricalCandle>> fetchDaily(String symbol, Country country, LocalDate from, LocalDate to) {
        return CompletableFuture.supplyAsync(() -> {
            long startTime = System.currentTimeMillis();
            try {
                List<HistoricalCandle> candles = fetch(symbol, from, to);
                metrics.recordQuoteFetch("success", Duration.ofMillis(System.currentTimeMillis() - startTime));
                log.info("[QUOTE] {} {}: {} daily candles in {}ms",
                    symbol, country, candles.size(), System.currentTimeMillis() - startTime);
                return candles;
            } catch (QuoteSourceException e) {
                metrics.recordQuoteFetch(e.getCode().name(), Duration.ofMillis(System.currentTimeMillis() - startTime));
                log.warn("[QUOTE] {} {} failed: {}", symbol, country, e.getMessage());
                throw e;
            }
        });
    }

    private List<HistoricalCandle> fetch(String symbol, LocalDate from, LocalDate to) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new QuoteSourceException(QuoteErrorCode.CONFIG_MISSING, symbol, "API key is not configured");
        }

        String url = baseUrl + "/query?function=TIME_SERIES_DAILY"
            + "&symbol=" + URLEncoder.encode(symbol, StandardCharsets.UTF_8)
            + "&apikey=" + URLEncoder.encode(apiKey, StandardCharsets.UTF_8);

        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(timeout)
            .header("Accept", "application/json")
            .GET()
            .build();

        log.debug("[QUOTE] GET {}/query?function=TIME_SERIES_DAILY&symbol={}", baseUrl, symbol);

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new QuoteSourceException(QuoteErrorCode.HTTP_ERROR, symbol, "Request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QuoteSourceException(QuoteErrorCode.HTTP_ERROR, symbol, "Request interrupted", e);
        }

        if (response.statusCode() != 200) {
            throw new QuoteSourceException(QuoteErrorCode.HTTP_ERROR, symbol,
                "HTTP " + response.statusCode());
        }

        return parseDailySeries(symbol, response.body(), from, to);
    }

    /**
     * Parse a TIME_SERIES_DAILY body into ascending daily candles within [from, to].
     */
    List<HistoricalCandle> parseDailySeries(String symbol, String body, LocalDate from, LocalDate to) {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (IOException e) {
            throw new QuoteSourceException(QuoteErrorCode.HTTP_ERROR, symbol, "Malformed JSON response", e);
        }

        if (root.hasNonNull("Error Message")) {
            throw new QuoteSourceException(QuoteErrorCode.NOT_FOUND, symbol, root.get("Error Message").asText());
        }
        if (root.hasNonNull("Note")) {
            throw new QuoteSourceException(QuoteErrorCode.RATE_LIMITED, symbol, root.get("Note").asText());
        }
        if (root.hasNonNull("Information")) {
            throw new QuoteSourceException(QuoteErrorCode.RATE_LIMITED, symbol, root.get("Information").asText());
        }

        JsonNode series = root.get(SERIES_KEY);
        if (series == null || !series.isObject()) {
            throw new QuoteSourceException(QuoteErrorCode.NO_DATA, symbol, "No daily series in response");
        }

        List<HistoricalCandle> candles = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = series.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            try {
                LocalDate date = LocalDate.parse(field.getKey());
                if ((from != null && date.isBefore(from)) || (to != null && date.isAfter(to))) {
                    continue;
                }
                JsonNode bar = field.getValue();
                candles.add(new HistoricalCandle(
                    symbol,
                    TimeframeType.DAILY,
                    date,
                    new BigDecimal(bar.path("1. open").asText()),
                    new BigDecimal(bar.path("2. high").asText()),
                    new BigDecimal(bar.path("3. low").asText()),
                    new BigDecimal(bar.path("4. close").asText()),
                    Long.parseLong(bar.path("5. volume").asText())
                ));
            } catch (DateTimeParseException | NumberFormatException e) {
                log.warn("[QUOTE] {} skipping malformed bar {}: {}", symbol, field.getKey(), e.getMessage());
            }
        }

        candles.sort(Comparator.comparing(HistoricalCandle::date));
        return candles;
    }
}
