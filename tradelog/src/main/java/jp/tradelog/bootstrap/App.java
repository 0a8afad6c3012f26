package jp.tradelog.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import jp.tradelog.importer.ExecutionCsvParser;
import jp.tradelog.metrics.PrometheusMetricsHandler;
import jp.tradelog.metrics.PrometheusTradeLogMetrics;
import jp.tradelog.migration.TradeLogMigration;
import jp.tradelog.quote.AlphaVantageQuoteClient;
import jp.tradelog.quote.QuoteSource;
import jp.tradelog.repository.ExecutionRepository;
import jp.tradelog.repository.PostgresExecutionRepository;
import jp.tradelog.repository.PostgresRoundTripTradeRepository;
import jp.tradelog.repository.RoundTripTradeRepository;
import jp.tradelog.security.InputValidator;
import jp.tradelog.service.TradeLogService;
import jp.tradelog.service.analysis.PerformanceAnalyzer;
import jp.tradelog.service.candle.CandleResampler;
import jp.tradelog.service.candle.ChartDataService;
import jp.tradelog.service.trade.TradeAggregator;
import jp.tradelog.transport.http.ApiHandlers;
import jp.tradelog.util.Env;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.nio.charset.Charset;
import java.time.Duration;

/**
 * TradeLog - brokerage execution history, FIFO round trips and chart data over HTTP.
 *
 * Startup:
 * - HikariCP pool over PostgreSQL, schema migration
 * - Prometheus metrics
 * - Repositories, parser, aggregator, quote client
 * - Undertow HTTP API
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== TradeLog Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        int port = Env.getInt("PORT", 9090);

        // ═══════════════════════════════════════════════════════════════
        // Database
        // ═══════════════════════════════════════════════════════════════
        DataSource dataSource = createDataSource();
        new TradeLogMigration(dataSource).migrate();

        ExecutionRepository executionRepo = new PostgresExecutionRepository(dataSource);
        RoundTripTradeRepository tradeRepo = new PostgresRoundTripTradeRepository(dataSource);

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusTradeLogMetrics metrics = new PrometheusTradeLogMetrics();
        PrometheusMetricsHandler metricsHandler = new PrometheusMetricsHandler(metrics.getRegistry());
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Services
        // ═══════════════════════════════════════════════════════════════
        Charset importCharset = Charset.forName(Env.get("IMPORT_CHARSET", ExecutionCsvParser.DEFAULT_CHARSET));
        TradeLogService tradeLogService = new TradeLogService(
            executionRepo,
            tradeRepo,
            new ExecutionCsvParser(importCharset),
            new TradeAggregator(),
            new InputValidator(),
            metrics);

        QuoteSource quoteSource = createQuoteSource(metrics);
        ChartDataService chartDataService = new ChartDataService(quoteSource, new CandleResampler());

        ApiHandlers api = new ApiHandlers(tradeLogService, new PerformanceAnalyzer(), chartDataService);
        log.info("✓ Services initialized (import charset: {})", importCharset.name());

        // ═══════════════════════════════════════════════════════════════
        // HTTP Server
        // ═══════════════════════════════════════════════════════════════
        Undertow server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(withCors(routes(api, metricsHandler, port)))
            .build();

        server.start();
        log.info("✓ TradeLog started on http://localhost:{}/", port);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down TradeLog");
            server.stop();
            if (dataSource instanceof HikariDataSource hikari) {
                hikari.close();
            }
        }, "tradelog-shutdown"));
    }

    /**
     * API routes. Handlers that touch the database or the quote source run on worker threads.
     */
    public static RoutingHandler routes(ApiHandlers api, HttpHandler metricsHandler, int port) {
        return Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/api/health", api::health)
            .get("/api/executions", new BlockingHandler(api::listExecutions))
            .post("/api/executions", new BlockingHandler(api::addExecution))
            .post("/api/executions/import", new BlockingHandler(api::importCsv))
            .delete("/api/executions", new BlockingHandler(api::clearExecutions))
            .delete("/api/executions/{id}", new BlockingHandler(api::deleteExecution))
            .get("/api/trades", new BlockingHandler(api::trades))
            .get("/api/analysis", new BlockingHandler(api::analysis))
            .get("/api/candles/{symbol}", new BlockingHandler(api::candles))
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "TradeLog\n\n" +
                    "API: GET /api/health, /api/executions, /api/trades, /api/analysis, /api/candles/{symbol}\n" +
                    "     POST /api/executions, /api/executions/import\n" +
                    "Metrics: http://localhost:" + port + "/metrics\n"
                );
            });
    }

    private static HttpHandler withCors(HttpHandler next) {
        return exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, POST, DELETE, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"), "Content-Type")
                .put(HttpString.tryFromString("Access-Control-Max-Age"), "3600");

            if (exchange.getRequestMethod().toString().equals("OPTIONS")) {
                exchange.setStatusCode(200);
                exchange.endExchange();
            } else {
                next.handleRequest(exchange);
            }
        };
    }

    private static QuoteSource createQuoteSource(PrometheusTradeLogMetrics metrics) {
        String baseUrl = Env.get("ALPHA_VANTAGE_BASE_URL", "https://www.alphavantage.co");
        String apiKey = Env.get("ALPHA_VANTAGE_API_KEY", null);
        int timeoutSeconds = Env.getInt("QUOTE_TIMEOUT_SECONDS", 10);

        if (apiKey == null) {
            log.warn("ALPHA_VANTAGE_API_KEY not set: chart requests will fail with CONFIG_MISSING");
        }
        log.info("Quotes: baseUrl={}, timeout={}s", baseUrl, timeoutSeconds);
        return new AlphaVantageQuoteClient(baseUrl, apiKey, Duration.ofSeconds(timeoutSeconds), metrics);
    }

    private static DataSource createDataSource() {
        String url = Env.get("DB_URL", "jdbc:postgresql://localhost:5432/tradelog");
        String user = Env.get("DB_USER", "postgres");
        String pass = Env.get("DB_PASS", "postgres");
        int maxPool = Env.getInt("DB_POOL_SIZE", 10);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(user);
        config.setPassword(pass);
        config.setMaximumPoolSize(maxPool);
        config.setMinimumIdle(2);
        config.setConnectionTimeout(5000);
        config.setPoolName("tradelog-hikari");

        log.info("DB: url={}, user={}, pool={}", url, user, maxPool);
        return new HikariDataSource(config);
    }

    private App() {}
}
