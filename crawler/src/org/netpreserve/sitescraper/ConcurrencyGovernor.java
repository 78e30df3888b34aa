package org.netpreserve.sitescraper;

import org.netpreserve.sitescraper.util.Url;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Semaphore;

/**
 * Bounds the number of fetches in flight, both in total and per origin.
 * <p>
 * A permit is taken from the global pool first and then from the origin's pool, and returned in the reverse
 * order. Callers block until both are available. Origin pools are created on first use and kept for the life of the
 * crawl.
 */
public class ConcurrencyGovernor {
    private final Semaphore global;
    private final ConcurrentMap<String, Semaphore> perOrigin = new ConcurrentHashMap<>();
    private final int perOriginLimit;

    public ConcurrencyGovernor(int globalLimit, int perOriginLimit) {
        if (globalLimit < 1) throw new IllegalArgumentException("global concurrency must be at least 1");
        if (perOriginLimit < 1) throw new IllegalArgumentException("per-origin concurrency must be at least 1");
        this.perOriginLimit = perOriginLimit;
        this.global = new Semaphore(globalLimit, true);
    }

    public Permit acquire(Url url) throws InterruptedException {
        String origin = url.origin();
        Semaphore originPool = perOrigin.computeIfAbsent(origin, o -> new Semaphore(perOriginLimit, true));
        global.acquire();
        try {
            originPool.acquire();
        } catch (InterruptedException e) {
            global.release();
            throw e;
        }
        return new Permit(origin, originPool);
    }

    public int availableGlobal() {
        return global.availablePermits();
    }

    public int availableFor(Url url) {
        Semaphore pool = perOrigin.get(url.origin());
        return pool == null ? perOriginLimit : pool.availablePermits();
    }

    /**
     * Both permits held for one fetch. Closing it releases them, the origin's first.
     */
    public final class Permit implements AutoCloseable {
        private final String origin;
        private final Semaphore originPool;
        private boolean released;

        private Permit(String origin, Semaphore originPool) {
            this.origin = origin;
            this.originPool = originPool;
        }

        public String origin() {
            return origin;
        }

        @Override
        public synchronized void close() {
            if (released) return;
            released = true;
            originPool.release();
            global.release();
        }
    }
}
