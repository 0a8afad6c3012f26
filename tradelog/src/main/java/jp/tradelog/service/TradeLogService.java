package jp.tradelog.service;

import jp.tradelog.domain.trade.ExecutionRecord;
import jp.tradelog.domain.trade.RoundTripTrade;
import jp.tradelog.importer.CsvImportException;
import jp.tradelog.importer.ExecutionCsvParser;
import jp.tradelog.importer.ImportResult;
import jp.tradelog.metrics.TradeLogMetrics;
import jp.tradelog.repository.ExecutionRepository;
import jp.tradelog.repository.RoundTripTradeRepository;
import jp.tradelog.security.InputValidator;
import jp.tradelog.service.trade.TradeAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Service for maintaining the execution log and the round trips derived from it.
 *
 * Every mutation of executions is followed by a full rebuild: all executions are
 * re-read in date order, aggregated, and the stored round trips replaced as a whole.
 * Rebuilds are serialized on this instance.
 */
public class TradeLogService {
    private static final Logger log = LoggerFactory.getLogger(TradeLogService.class);

    private final ExecutionRepository executionRepo;
    private final RoundTripTradeRepository tradeRepo;
    private final ExecutionCsvParser parser;
    private final TradeAggregator aggregator;
    private final InputValidator validator;
    private final TradeLogMetrics metrics;
    private final Clock clock;

    public TradeLogService(ExecutionRepository executionRepo,
                           RoundTripTradeRepository tradeRepo,
                           ExecutionCsvParser parser,
                           TradeAggregator aggregator,
                           InputValidator validator,
                           TradeLogMetrics metrics) {
        this(executionRepo, tradeRepo, parser, aggregator, validator, metrics, Clock.systemDefaultZone());
    }

    public TradeLogService(ExecutionRepository executionRepo,
                           RoundTripTradeRepository tradeRepo,
                           ExecutionCsvParser parser,
                           TradeAggregator aggregator,
                           InputValidator validator,
                           TradeLogMetrics metrics,
                           Clock clock) {
        this.executionRepo = executionRepo;
        this.tradeRepo = tradeRepo;
        this.parser = parser;
        this.aggregator = aggregator;
        this.validator = validator;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Parse a broker export, store its executions and rebuild round trips.
     *
     * @throws CsvImportException if the document cannot be imported; nothing is stored
     */
    public ImportSummary importCsv(byte[] content) {
        ImportResult result;
        try {
            result = parser.parse(content);
        } catch (CsvImportException e) {
            String layout = e.getLayout() == null ? "UNKNOWN" : e.getLayout().name();
            metrics.recordImport(layout, e.getCode().name());
            log.warn("[IMPORT] Rejected {} byte document: {}", content.length, e.getMessage());
            throw e;
        }

        int inserted = executionRepo.insertBatch(result.records());
        metrics.recordImport(result.layout().name(), "success");
        metrics.recordImportedRows(result.size(), result.skippedRows());

        int tradeCount = recalculate();
        log.info("[IMPORT] {} layout ({}): stored {} executions, skipped {} rows, {} round trips",
            result.layout(), result.country(), inserted, result.skippedRows(), tradeCount);

        return new ImportSummary(result.layout(), result.country(), inserted, result.skippedRows(), tradeCount);
    }

    /**
     * Validate and store one hand-entered execution, then rebuild round trips.
     *
     * @throws IllegalArgumentException if any field is invalid
     */
    public ExecutionRecord addExecution(ManualExecution input) {
        if (input.side() == null) {
            throw new IllegalArgumentException("Side is required");
        }
        if (!validator.isValidSymbol(input.symbol(), input.country())) {
            throw new IllegalArgumentException("Invalid symbol for " + input.country() + ": " + input.symbol());
        }
        validator.validateDate(input.date(), LocalDate.now(clock));
        validator.validatePrice(input.price());
        validator.validateQuantity(input.quantity());

        String name = validator.sanitizeName(input.name());
        if (name == null || name.isEmpty()) {
            name = input.symbol();
        }

        ExecutionRecord stored = executionRepo.insert(ExecutionRecord.of(
            input.symbol(), name, input.country(), input.date(),
            input.side(), input.price(), input.quantity()));
        log.info("[EXECUTION] Added {} {} {} x {} @ {} on {}",
            stored.side(), stored.symbol(), stored.country(), stored.quantity(), stored.price(), stored.date());

        recalculate();
        return stored;
    }

    /**
     * @return true if the execution existed
     */
    public boolean deleteExecution(long id) {
        boolean deleted = executionRepo.deleteById(id);
        if (!deleted) {
            log.debug("[EXECUTION] Delete of unknown id {}", id);
            return false;
        }
        log.info("[EXECUTION] Deleted execution {}", id);
        recalculate();
        return true;
    }

    /**
     * Remove every execution and every round trip.
     *
     * @return number of executions removed
     */
    public int clearExecutions() {
        int removed = executionRepo.deleteAll();
        log.info("[EXECUTION] Cleared {} executions", removed);
        recalculate();
        return removed;
    }

    /**
     * Rebuild all round trips from the stored executions.
     *
     * @return number of round trips stored
     */
    public synchronized int recalculate() {
        Instant start = Instant.now();

        List<ExecutionRecord> executions = executionRepo.findAllOrderByDate();
        List<RoundTripTrade> trades = aggregator.aggregate(executions);
        tradeRepo.replaceAll(trades);

        Duration elapsed = Duration.between(start, Instant.now());
        metrics.recordRecalculation(elapsed, trades.size());
        log.info("[AGGREGATE] Rebuilt {} round trips from {} executions in {}ms",
            trades.size(), executions.size(), elapsed.toMillis());
        return trades.size();
    }

    public List<ExecutionRecord> listExecutions() {
        return executionRepo.findAllOrderByDate();
    }

    /**
     * Round trips closed within [from, to]; either bound may be null.
     */
    public List<RoundTripTrade> listTrades(LocalDate from, LocalDate to) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to: " + from + " > " + to);
        }
        if (from == null && to == null) {
            return tradeRepo.findAll();
        }
        return tradeRepo.findByExitDateBetween(from, to);
    }
}
