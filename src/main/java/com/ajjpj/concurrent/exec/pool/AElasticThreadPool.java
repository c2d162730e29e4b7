package com.ajjpj.concurrent.exec.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;


/**
 * A bounded, elastic set of worker threads. The pool does not know what its threads do - it only decides whether
 *  a thread may be started or must terminate, and keeps track of how many are alive.<p>
 * Up to {@code coreSize} threads are always granted. Beyond that, threads are only created when explicitly forced,
 *  and never more than {@code maxSize}. A thread above core size is allowed to release itself, and after shutdown
 *  every thread is.<p>
 * All size mutations are serialized by a single lock. Its only condition signals 'no thread left'.
 *
 * @author arno
 */
public class AElasticThreadPool {
    private static final Logger log = LoggerFactory.getLogger (AElasticThreadPool.class);

    private final int coreSize;
    private final int maxSize;
    private final String threadNamePrefix;
    private final boolean daemonThreads;

    private final ReentrantLock lock = new ReentrantLock ();
    private final Condition empty = lock.newCondition ();

    // guarded by 'lock'
    private int size = 0;
    private int peakSize = 0;
    private long numForcedThreads = 0;
    private long numCreatedThreads = 0;

    private volatile boolean shutdown;

    public AElasticThreadPool (int coreSize, int maxSize) {
        this (coreSize, maxSize, "a-executor", true);
    }

    public AElasticThreadPool (int coreSize, int maxSize, String threadNamePrefix, boolean daemonThreads) {
        if (coreSize < 0) {
            throw new IllegalArgumentException ("core size must not be negative, is " + coreSize);
        }
        if (maxSize < 1 || maxSize < coreSize) {
            throw new IllegalArgumentException ("max size must be at least 1 and at least core size " + coreSize + ", is " + maxSize);
        }

        this.coreSize = coreSize;
        this.maxSize = maxSize;
        this.threadNamePrefix = threadNamePrefix;
        this.daemonThreads = daemonThreads;
    }

    /**
     * Starts a new thread running {@code body} if the pool's sizing rules permit it: a thread is always granted while there are
     *  fewer than {@code coreSize} threads, and only if {@code force} is set while there are fewer than {@code maxSize}.
     *
     * @return true iff a thread was started
     */
    public boolean tryCreateThread (Runnable body, boolean force) {
        final Thread thread;
        final boolean forced;

        lock.lock ();
        try {
            if (shutdown) {
                return false;
            }

            if (size < coreSize) {
                forced = false;
            }
            else if (force && size < maxSize) {
                forced = true;
            }
            else {
                return false;
            }

            numCreatedThreads += 1;
            thread = new Thread (body, threadNamePrefix + "-worker-" + numCreatedThreads);
            thread.setDaemon (daemonThreads);
            thread.start ();

            size += 1;
            peakSize = Math.max (peakSize, size);
            if (forced) numForcedThreads += 1;
        }
        finally {
            lock.unlock ();
        }

        log.debug ("{} created (forced: {})", thread.getName (), forced);
        return true;
    }

    /**
     * Called by a thread that found no work. The thread is released if the pool is above core size, or unconditionally after shutdown.
     *
     * @return true iff the calling thread was removed from the pool and must terminate
     */
    public boolean removeThread () {
        lock.lock ();
        try {
            if (size > coreSize || shutdown) {
                doRemove ();
                return true;
            }
            return false;
        }
        finally {
            lock.unlock ();
        }
    }

    /**
     * Unconditionally removes the calling thread from the pool. This is for threads that terminate abnormally.
     */
    public void abandonThread () {
        lock.lock ();
        try {
            doRemove ();
        }
        finally {
            lock.unlock ();
        }
    }

    private void doRemove () {
        if (size <= 0) {
            throw new IllegalStateException ("no thread left to remove");
        }

        size -= 1;
        if (size == 0) {
            empty.signalAll ();
        }
        log.debug ("{} terminated, {} remaining", Thread.currentThread ().getName (), size);
    }

    /**
     * Marks the pool as shut down. This is cooperative: no thread is interrupted, threads are expected to notice the flag and release themselves.
     */
    public void shutdown () {
        shutdown = true;
    }

    public boolean isShutdown () {
        return shutdown;
    }

    /**
     * Blocks until there are no threads left in the pool.
     */
    public void awaitEmpty () throws InterruptedException {
        lock.lock ();
        try {
            while (size != 0) {
                empty.await ();
            }
        }
        finally {
            lock.unlock ();
        }
    }

    /**
     * @return true if the pool became empty, false if the timeout elapsed first
     */
    public boolean awaitEmpty (long timeout, TimeUnit timeUnit) throws InterruptedException {
        long remaining = timeUnit.toNanos (timeout);

        lock.lock ();
        try {
            while (size != 0) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = empty.awaitNanos (remaining);
            }
            return true;
        }
        finally {
            lock.unlock ();
        }
    }

    public int size () {
        lock.lock ();
        try {
            return size;
        }
        finally {
            lock.unlock ();
        }
    }

    /**
     * @return the highest number of threads that were alive at the same time
     */
    public int peakSize () {
        lock.lock ();
        try {
            return peakSize;
        }
        finally {
            lock.unlock ();
        }
    }

    /**
     * @return the number of threads that were created beyond core size because their creation was forced
     */
    public long numForcedThreads () {
        lock.lock ();
        try {
            return numForcedThreads;
        }
        finally {
            lock.unlock ();
        }
    }

    public int coreSize () {
        return coreSize;
    }

    public int maxSize () {
        return maxSize;
    }

    @Override public String toString () {
        return "AElasticThreadPool{" +
                "coreSize=" + coreSize +
                ", maxSize=" + maxSize +
                ", size=" + size () +
                ", shutdown=" + shutdown +
                '}';
    }
}
