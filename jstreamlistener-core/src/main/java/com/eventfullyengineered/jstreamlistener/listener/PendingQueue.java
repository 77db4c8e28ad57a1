package com.eventfullyengineered.jstreamlistener.listener;

import com.eventfullyengineered.jstreamlistener.infrastructure.Ensure;
import com.eventfullyengineered.jstreamlistener.notifications.EventRange;
import com.google.common.base.MoreObjects;
import com.google.common.math.LongMath;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * FIFO of decoded ranges waiting for consumer demand, together with the outstanding demand.
 *
 * <p>The queue is unbounded. A consumer that never requests more makes it grow without limit;
 * notifications are never dropped to bound memory.</p>
 *
 * <p>Not thread safe. Owned by a single {@link EventRangeDispatcher}.</p>
 */
public class PendingQueue {

    private final Deque<EventRange> queue = new ArrayDeque<>();
    private long demand;

    public void enqueue(EventRange range) {
        queue.addLast(Ensure.notNull(range, "range"));
    }

    /**
     * Add consumer demand. Saturates at {@link Long#MAX_VALUE}, which is treated as unbounded.
     * @param n the number of further ranges the consumer can take
     */
    public void addDemand(long n) {
        Ensure.positive(n, "n");
        demand = LongMath.saturatedAdd(demand, n);
    }

    /**
     * Remove ranges from the head while there is demand, one unit of demand per range.
     * @return the released ranges in arrival order, possibly empty
     */
    public List<EventRange> drain() {
        if (demand == 0 || queue.isEmpty()) {
            return Collections.emptyList();
        }

        List<EventRange> batch = new ArrayList<>((int) Math.min(demand, queue.size()));
        while (demand > 0 && !queue.isEmpty()) {
            batch.add(queue.removeFirst());
            if (demand != Long.MAX_VALUE) {
                demand--;
            }
        }
        return batch;
    }

    public long getDemand() {
        return demand;
    }

    public int size() {
        return queue.size();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("demand", demand)
            .add("size", queue.size())
            .toString();
    }
}
