package jp.tradelog.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jp.tradelog.domain.common.Country;
import jp.tradelog.domain.data.HistoricalCandle;
import jp.tradelog.domain.data.TimeframeType;
import jp.tradelog.domain.trade.ExecutionRecord;
import jp.tradelog.domain.trade.RoundTripTrade;
import jp.tradelog.importer.CsvImportException;
import jp.tradelog.quote.QuoteSourceException;
import jp.tradelog.service.ImportSummary;
import jp.tradelog.service.ManualExecution;
import jp.tradelog.service.TradeLogService;
import jp.tradelog.service.analysis.CountryAnalysis;
import jp.tradelog.service.analysis.PerformanceAnalyzer;
import jp.tradelog.service.candle.ChartDataService;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.PathTemplateMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * HTTP API handlers for the trade log.
 *
 * Handlers run on worker threads (routes are wrapped in a BlockingHandler), so they
 * read request bodies from the input stream and wait on quote futures directly.
 *
 * Errors: {"error": "...", "code": "..."} with 400 for bad input, 404/429/502 for
 * quote source failures, 500 otherwise.
 */
public final class ApiHandlers {
    private static final Logger log = LoggerFactory.getLogger(ApiHandlers.class);
    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final String JSON_SUCCESS = "success";
    private static final String JSON_DATA = "data";
    private static final String JSON_ERROR = "error";
    private static final String JSON_CODE = "code";

    private final TradeLogService tradeLogService;
    private final PerformanceAnalyzer analyzer;
    private final ChartDataService chartDataService;

    public ApiHandlers(TradeLogService tradeLogService,
                       PerformanceAnalyzer analyzer,
                       ChartDataService chartDataService) {
        this.tradeLogService = tradeLogService;
        this.analyzer = analyzer;
        this.chartDataService = chartDataService;
    }

    /**
     * GET /api/health
     */
    public void health(HttpServerExchange exchange) {
        ObjectNode health = MAPPER.createObjectNode();
        health.put("status", "ok");
        health.put("ts", Instant.now().toString());
        sendJson(exchange, 200, health.toString());
    }

    /**
     * GET /api/executions
     */
    public void listExecutions(HttpServerExchange exchange) {
        try {
            List<ExecutionRecord> executions = tradeLogService.listExecutions();
            ObjectNode response = MAPPER.createObjectNode();
            response.put("count", executions.size());
            response.set(JSON_DATA, MAPPER.valueToTree(executions));
            sendJson(exchange, 200, response.toString());
        } catch (Exception e) {
            handleError(exchange, "list executions", e);
        }
    }

    /**
     * POST /api/executions
     * Body: {"symbol":"AAPL","name":"APPLE INC","country":"US","date":"2024-01-05","side":"BUY","price":185.2,"quantity":10}
     */
    public void addExecution(HttpServerExchange exchange) {
        try {
            String body = readBody(exchange);
            ManualExecution input = MAPPER.readValue(body, ManualExecution.class);
            ExecutionRecord stored = tradeLogService.addExecution(input);

            ObjectNode response = MAPPER.createObjectNode();
            response.put(JSON_SUCCESS, true);
            response.set(JSON_DATA, MAPPER.valueToTree(stored));
            sendJson(exchange, 201, response.toString());
        } catch (Exception e) {
            handleError(exchange, "add execution", e);
        }
    }

    /**
     * POST /api/executions/import
     * Body: raw broker CSV export bytes (any Content-Type).
     */
    public void importCsv(HttpServerExchange exchange) {
        try {
            byte[] content = exchange.getInputStream().readAllBytes();
            if (content.length == 0) {
                badRequest(exchange, "Empty upload", null);
                return;
            }
            ImportSummary summary = tradeLogService.importCsv(content);

            ObjectNode response = MAPPER.createObjectNode();
            response.put(JSON_SUCCESS, true);
            response.put("layout", summary.layout().name());
            response.put("country", summary.country().name());
            response.put("imported", summary.imported());
            response.put("skipped", summary.skipped());
            response.put("tradeCount", summary.tradeCount());
            sendJson(exchange, 200, response.toString());
        } catch (Exception e) {
            handleError(exchange, "import CSV", e);
        }
    }

    /**
     * DELETE /api/executions/{id}
     */
    public void deleteExecution(HttpServerExchange exchange) {
        try {
            String idParam = exchange.getAttachment(PathTemplateMatch.ATTACHMENT_KEY)
                    .getParameters().get("id");
            long id = Long.parseLong(idParam);

            if (!tradeLogService.deleteExecution(id)) {
                sendJson(exchange, 404, errorBody("Execution not found: " + id, null));
                return;
            }
            ObjectNode response = MAPPER.createObjectNode();
            response.put(JSON_SUCCESS, true);
            response.put("id", id);
            sendJson(exchange, 200, response.toString());
        } catch (NumberFormatException e) {
            badRequest(exchange, "Invalid execution id", null);
        } catch (Exception e) {
            handleError(exchange, "delete execution", e);
        }
    }

    /**
     * DELETE /api/executions
     */
    public void clearExecutions(HttpServerExchange exchange) {
        try {
            int removed = tradeLogService.clearExecutions();
            ObjectNode response = MAPPER.createObjectNode();
            response.put(JSON_SUCCESS, true);
            response.put("removed", removed);
            sendJson(exchange, 200, response.toString());
        } catch (Exception e) {
            handleError(exchange, "clear executions", e);
        }
    }

    /**
     * GET /api/trades?from=yyyy-MM-dd&to=yyyy-MM-dd
     */
    public void trades(HttpServerExchange exchange) {
        try {
            Map<String, Deque<String>> params = exchange.getQueryParameters();
            List<RoundTripTrade> trades = tradeLogService.listTrades(
                dateParam(params, "from"), dateParam(params, "to"));

            ArrayNode data = MAPPER.valueToTree(trades);
            ObjectNode response = MAPPER.createObjectNode();
            response.put("count", trades.size());
            response.set(JSON_DATA, data);
            sendJson(exchange, 200, response.toString());
        } catch (Exception e) {
            handleError(exchange, "fetch trades", e);
        }
    }

    /**
     * GET /api/analysis?from=&to=&compareFrom=&compareTo=
     * The comparison period is empty unless compareFrom or compareTo is given.
     */
    public void analysis(HttpServerExchange exchange) {
        try {
            Map<String, Deque<String>> params = exchange.getQueryParameters();
            List<RoundTripTrade> main = tradeLogService.listTrades(
                dateParam(params, "from"), dateParam(params, "to"));

            LocalDate compareFrom = dateParam(params, "compareFrom");
            LocalDate compareTo = dateParam(params, "compareTo");
            List<RoundTripTrade> comparison = compareFrom == null && compareTo == null
                ? List.of()
                : tradeLogService.listTrades(compareFrom, compareTo);

            Map<Country, CountryAnalysis> result = analyzer.analyze(main, comparison);
            ObjectNode response = MAPPER.createObjectNode();
            for (Map.Entry<Country, CountryAnalysis> entry : result.entrySet()) {
                response.set(entry.getKey().name(), MAPPER.valueToTree(entry.getValue()));
            }
            sendJson(exchange, 200, response.toString());
        } catch (Exception e) {
            handleError(exchange, "build analysis", e);
        }
    }

    /**
     * GET /api/candles/{symbol}?country=JP|US&from=&to=&timeframe=D|W|M
     */
    public void candles(HttpServerExchange exchange) {
        try {
            String symbol = exchange.getAttachment(PathTemplateMatch.ATTACHMENT_KEY)
                    .getParameters().get("symbol");
            Map<String, Deque<String>> params = exchange.getQueryParameters();

            String countryParam = param(params, "country");
            Country country = countryParam == null
                ? Country.US
                : Country.valueOf(countryParam.trim().toUpperCase(Locale.ROOT));
            TimeframeType timeframe = TimeframeType.fromParam(param(params, "timeframe"));

            List<HistoricalCandle> candles = chartDataService.candles(
                symbol, country, dateParam(params, "from"), dateParam(params, "to"), timeframe).join();

            ObjectNode response = MAPPER.createObjectNode();
            response.put("symbol", symbol);
            response.put("country", country.name());
            response.put("timeframe", timeframe.name());
            response.set(JSON_DATA, MAPPER.valueToTree(candles));
            sendJson(exchange, 200, response.toString());
        } catch (Exception e) {
            handleError(exchange, "fetch candles", e);
        }
    }

    // ════════════════════════════════════════════════════════════════════════
    // Helpers
    // ════════════════════════════════════════════════════════════════════════

    private void handleError(HttpServerExchange exchange, String action, Exception e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;

        if (cause instanceof CsvImportException csv) {
            log.warn("[API] Failed to {}: {}", action, csv.getMessage());
            badRequest(exchange, csv.getUserMessage(), csv.getCode().name());
        } else if (cause instanceof QuoteSourceException quote) {
            log.warn("[API] Failed to {}: {}", action, quote.getMessage());
            sendJson(exchange, quote.getCode().httpStatus(), errorBody(quote.getMessage(), quote.getCode().name()));
        } else if (cause instanceof IllegalArgumentException
                || cause instanceof DateTimeParseException
                || cause instanceof JsonProcessingException) {
            log.warn("[API] Failed to {}: {}", action, cause.getMessage());
            badRequest(exchange, cause.getMessage(), null);
        } else {
            log.error("[API] Failed to {}: {}", action, cause.getMessage(), cause);
            serverError(exchange, "Failed to " + action);
        }
    }

    private static String readBody(HttpServerExchange exchange) throws IOException {
        return new String(exchange.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
    }

    private static String param(Map<String, Deque<String>> params, String name) {
        Deque<String> values = params.get(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String value = values.peekFirst();
        return value == null || value.isBlank() ? null : value;
    }

    private static LocalDate dateParam(Map<String, Deque<String>> params, String name) {
        String value = param(params, name);
        return value == null ? null : LocalDate.parse(value.trim());
    }

    private static String errorBody(String message, String code) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put(JSON_ERROR, message);
        if (code != null) {
            body.put(JSON_CODE, code);
        }
        return body.toString();
    }

    private static void sendJson(HttpServerExchange exchange, int status, String json) {
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }

    private void badRequest(HttpServerExchange exchange, String message, String code) {
        sendJson(exchange, 400, errorBody(message, code));
    }

    private void serverError(HttpServerExchange exchange, String message) {
        sendJson(exchange, 500, errorBody(message, null));
    }
}
