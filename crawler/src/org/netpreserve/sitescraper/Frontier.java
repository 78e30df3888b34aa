package org.netpreserve.sitescraper;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.sitescraper.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * FIFO queue of crawl tasks plus the bookkeeping that keeps an address from being queued or visited twice.
 * <p>
 * Every task handed out by {@link #poll(Duration)} must be acknowledged with {@link #taskDone()} once the worker
 * has finished with it, whether it was processed or discarded. The frontier is drained when every task ever
 * queued has been acknowledged.
 */
public class Frontier {
    private static final Logger log = LoggerFactory.getLogger(Frontier.class);
    private final BlockingQueue<CrawlTask> queue = new LinkedBlockingQueue<>();
    private final Set<Url> enqueued = ConcurrentHashMap.newKeySet();
    private final Set<Url> visited = ConcurrentHashMap.newKeySet();
    private final Lock unfinishedLock = new ReentrantLock();
    private final Condition drained = unfinishedLock.newCondition();
    private long unfinished = 0;

    /**
     * Queues the url unless it has already been queued or visited.
     *
     * @return true if a new task was queued
     */
    public boolean offer(Url url, int depth) {
        if (visited.contains(url)) return false;
        if (!enqueued.add(url)) return false;
        unfinishedLock.lock();
        try {
            unfinished++;
        } finally {
            unfinishedLock.unlock();
        }
        queue.add(new CrawlTask(url, depth));
        return true;
    }

    public int offerAll(Collection<Url> urls, int depth) {
        int novel = 0;
        for (var url : urls) {
            if (offer(url, depth)) novel++;
        }
        log.debug("Queued {} new URLs of {} at depth {}", novel, urls.size(), depth);
        return novel;
    }

    /**
     * Takes the next task, waiting up to the given time for one to become available.
     *
     * @return the task or null if none arrived in time
     */
    public @Nullable CrawlTask poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Acknowledges a task previously returned by {@link #poll(Duration)}.
     */
    public void taskDone() {
        unfinishedLock.lock();
        try {
            if (unfinished <= 0) throw new IllegalStateException("taskDone() called more times than tasks were queued");
            unfinished--;
            if (unfinished == 0) drained.signalAll();
        } finally {
            unfinishedLock.unlock();
        }
    }

    /**
     * Blocks until every queued task has been acknowledged.
     */
    public void awaitDrained() throws InterruptedException {
        unfinishedLock.lock();
        try {
            while (unfinished > 0) {
                drained.await();
            }
        } finally {
            unfinishedLock.unlock();
        }
    }

    /**
     * Waits up to the given time for every queued task to be acknowledged.
     *
     * @return true if the frontier drained
     */
    public boolean awaitDrained(Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        unfinishedLock.lock();
        try {
            while (unfinished > 0) {
                if (nanos <= 0) return false;
                nanos = drained.awaitNanos(nanos);
            }
            return true;
        } finally {
            unfinishedLock.unlock();
        }
    }

    /**
     * Records that the url is being processed.
     *
     * @return false if it had already been marked visited
     */
    public boolean markVisited(Url url) {
        return visited.add(url);
    }

    public boolean isVisited(Url url) {
        return visited.contains(url);
    }

    public boolean isEnqueued(Url url) {
        return enqueued.contains(url);
    }

    public int size() {
        return queue.size();
    }

    public int enqueuedCount() {
        return enqueued.size();
    }

    public int visitedCount() {
        return visited.size();
    }

    public long unfinished() {
        unfinishedLock.lock();
        try {
            return unfinished;
        } finally {
            unfinishedLock.unlock();
        }
    }
}
