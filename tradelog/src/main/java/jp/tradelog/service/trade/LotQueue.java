package jp.tradelog.service.trade;

import jp.tradelog.domain.trade.ExecutionRecord;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Open buy lots for one instrument, oldest at the head.
 *
 * Fragments leave the queue exactly when their residual reaches zero; a partially
 * consumed head keeps its place with a smaller residual.
 */
final class LotQueue {
    private final Deque<LotFragment> fragments = new ArrayDeque<>();

    void add(ExecutionRecord buy) {
        fragments.addLast(new LotFragment(buy.price(), buy.quantity(), buy.date(), buy.id()));
    }

    /**
     * Consume up to {@code quantity} from the head of the queue.
     *
     * @return matched lots in consumption order; empty if the queue was empty.
     *         The sum of their quantities is less than {@code quantity} only when the queue ran dry.
     */
    List<MatchedLot> consume(BigDecimal quantity) {
        List<MatchedLot> matched = new ArrayList<>();
        BigDecimal remaining = quantity;

        while (remaining.signum() > 0 && !fragments.isEmpty()) {
            LotFragment head = fragments.peekFirst();

            if (head.residualQuantity().compareTo(remaining) <= 0) {
                fragments.removeFirst();
                matched.add(new MatchedLot(head.price(), head.residualQuantity(), head.date(), head.sourceId()));
                remaining = remaining.subtract(head.residualQuantity());
            } else {
                matched.add(new MatchedLot(head.price(), remaining, head.date(), head.sourceId()));
                head.reduce(remaining);
                remaining = BigDecimal.ZERO;
            }
        }
        return matched;
    }

    boolean isEmpty() {
        return fragments.isEmpty();
    }

    int size() {
        return fragments.size();
    }

    BigDecimal openQuantity() {
        BigDecimal total = BigDecimal.ZERO;
        for (LotFragment f : fragments) {
            total = total.add(f.residualQuantity());
        }
        return total;
    }
}
