package jp.tradelog.repository;

import jp.tradelog.domain.trade.ExecutionRecord;

import java.util.List;
import java.util.Optional;

/**
 * Store of raw executions. The store owns id assignment.
 */
public interface ExecutionRepository {
    /**
     * Insert one execution.
     *
     * @return the stored record, with id and createdAt populated
     */
    ExecutionRecord insert(ExecutionRecord record);

    /**
     * Insert many executions in one transaction.
     *
     * @return number of rows inserted
     */
    int insertBatch(List<ExecutionRecord> records);

    Optional<ExecutionRecord> findById(long id);

    /**
     * Full scan, ordered by execution date then insertion order.
     */
    List<ExecutionRecord> findAllOrderByDate();

    /**
     * @return true if a row was deleted
     */
    boolean deleteById(long id);

    /**
     * @return number of rows deleted
     */
    int deleteAll();
}
