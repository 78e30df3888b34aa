package org.netpreserve.sitescraper;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Counts processed pages against the crawl's page limit.
 * <p>
 * A worker reserves a slot before fetching a page and then either commits it once the page has been stored or
 * cancels it if the page produced nothing. Processed pages plus in-flight reservations never exceed the limit, so
 * the processed count can't overshoot however many pages are being fetched at once.
 */
public class PageBudget {
    private final long limit;
    private final Lock lock = new ReentrantLock();
    private final Condition slotFreed = lock.newCondition();
    private long inFlight = 0;
    private long processed = 0;

    public PageBudget(long limit) {
        if (limit < 0) throw new IllegalArgumentException("page limit must not be negative");
        this.limit = limit;
    }

    /**
     * Reserves a slot for one page. If every remaining slot is held by an in-flight page this waits until one of
     * them is committed or cancelled.
     *
     * @return true if a slot was reserved, false if the budget is exhausted
     */
    public boolean reserve() throws InterruptedException {
        lock.lock();
        try {
            while (true) {
                if (processed >= limit) return false;
                if (processed + inFlight < limit) {
                    inFlight++;
                    return true;
                }
                slotFreed.await();
            }
        } finally {
            lock.unlock();
        }
    }

    public void commit() {
        lock.lock();
        try {
            if (inFlight <= 0) throw new IllegalStateException("commit() without reservation");
            inFlight--;
            processed++;
            slotFreed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public void cancel() {
        lock.lock();
        try {
            if (inFlight <= 0) throw new IllegalStateException("cancel() without reservation");
            inFlight--;
            slotFreed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * True once the limit has been reached by pages actually processed.
     */
    public boolean exhausted() {
        lock.lock();
        try {
            return processed >= limit;
        } finally {
            lock.unlock();
        }
    }

    public long processed() {
        lock.lock();
        try {
            return processed;
        } finally {
            lock.unlock();
        }
    }

    public long limit() {
        return limit;
    }
}
