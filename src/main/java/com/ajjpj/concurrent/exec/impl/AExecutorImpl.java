package com.ajjpj.concurrent.exec.impl;

import com.ajjpj.concurrent.exec.api.ACallable;
import com.ajjpj.concurrent.exec.api.AExecutor;
import com.ajjpj.concurrent.exec.api.AExecutorStatistics;
import com.ajjpj.concurrent.exec.api.AFuture;
import com.ajjpj.concurrent.exec.api.exc.RejectedExecutionExceptionWithoutStacktrace;
import com.ajjpj.concurrent.exec.pool.AElasticThreadPool;
import com.ajjpj.concurrent.exec.queue.ABlockingQueue;
import com.ajjpj.concurrent.exec.util.AClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;


/**
 * An executor combining an {@link AElasticThreadPool} with a bounded queue of pending futures.<p>
 * Submission prefers starting a new thread up to the pool's core size, then queueing. When the queue is full as well,
 *  the oldest pending future is evicted to make room for the new one, and a thread beyond core size is started for the
 *  evicted future. Submitted work is never dropped: if even the pool's maximum size is reached, the submitting thread
 *  blocks until there is room in the queue,
 *  or until the executor is shut down, which rejects the waiting future.
 *
 * @author arno
 */
public class AExecutorImpl implements AExecutor {
    private static final Logger log = LoggerFactory.getLogger (AExecutorImpl.class);

    /**
     * Placed in the pending queue during shutdown to wake up idle workers. It is never executed.
     */
    static final AFutureImpl<Void> SHUTDOWN_MARKER = new AFutureImpl<> (ACallable.oneShot (() -> null), -1);

    final AElasticThreadPool pool;
    final ABlockingQueue<AFutureImpl<?>> pendingFutures;
    final long keepAliveMillis;
    final AClock clock;
    private final long idleCheckMillis;

    /**
     * Submissions hold the read lock, initiating shutdown takes the write lock. So once the pool is marked as shut down, no
     *  submission is in flight any more.
     */
    private final ReadWriteLock shutdownLock = new ReentrantReadWriteLock ();

    private final AtomicLong nextSubmissionId = new AtomicLong (0);
    private final AtomicLong numEvictions = new AtomicLong (0);
    private final AtomicInteger numBackPressured = new AtomicInteger ();
    private final AtomicLong numCompleted = new AtomicLong (0);

    AExecutorImpl (AElasticThreadPool pool, ABlockingQueue<AFutureImpl<?>> pendingFutures, long keepAliveMillis, long idleCheckMillis, AClock clock) {
        this.pool = pool;
        this.pendingFutures = pendingFutures;
        this.keepAliveMillis = keepAliveMillis;
        this.idleCheckMillis = idleCheckMillis;
        this.clock = clock;
    }

    @Override public <T> AFuture<T> submit (ACallable<T> callable) {
        if (callable == null) {
            throw new IllegalArgumentException ("callable must not be null");
        }

        final AFutureImpl<T> future;
        final List<AFutureImpl<?>> homeless = new ArrayList<> (2);

        shutdownLock.readLock ().lock ();
        try {
            if (pool.isShutdown ()) {
                throw new RejectedExecutionExceptionWithoutStacktrace ("executor is shut down");
            }

            future = new AFutureImpl<> (callable, nextSubmissionId.getAndIncrement ());

            if (pool.tryCreateThread (new PoolWorker (this, future), false)) {
                return future;
            }
            if (pendingFutures.add (future)) {
                return future;
            }

            // both core threads and queue are exhausted
            final AFutureImpl<?> oldest = pendingFutures.remove ();
            if (oldest == null) {
                dispatchForced (future, homeless);
            }
            else {
                numEvictions.incrementAndGet ();
                final boolean requeued = pendingFutures.add (future);
                dispatchForced (oldest, homeless);
                if (! requeued) {
                    dispatchForced (future, homeless);
                }
            }
            if (! homeless.isEmpty ()) {
                numBackPressured.incrementAndGet ();
            }
        }
        finally {
            shutdownLock.readLock ().unlock ();
        }

        // back pressure happens outside the shutdown lock, so shutdown can proceed while the submitter waits
        try {
            for (AFutureImpl<?> f: homeless) {
                awaitRoomInQueue (f);
            }
        }
        finally {
            if (! homeless.isEmpty ()) {
                numBackPressured.decrementAndGet ();
            }
        }
        return future;
    }

    /**
     * Starts a thread beyond core size for a future. If the pool is at its maximum size, the future is added to
     *  {@code homeless} for the submitting thread to re-queue after it released the shutdown lock.
     */
    private void dispatchForced (AFutureImpl<?> future, List<AFutureImpl<?>> homeless) {
        if (! pool.tryCreateThread (new PoolWorker (this, future), true)) {
            homeless.add (future);
        }
    }

    /**
     * Blocks the submitting thread until there is room for the future in the queue. Once the executor is shut down, the
     *  future is completed with a rejection instead, since the remaining workers may already have terminated.
     */
    private void awaitRoomInQueue (AFutureImpl<?> future) {
        log.debug ("pool is at maximum size {}, waiting for room in the queue for future #{}", pool.maxSize (), future.submissionId ());
        try {
            while (! pool.isShutdown ()) {
                if (pendingFutures.offer (future, clock.deadlineAfterMillis (idleCheckMillis))) {
                    return;
                }
            }
            future.tryCompleteExceptionally (new RejectedExecutionExceptionWithoutStacktrace ("executor was shut down while waiting for room in the queue"));
        }
        catch (InterruptedException e) {
            Thread.currentThread ().interrupt ();
            future.tryCompleteExceptionally (new RejectedExecutionExceptionWithoutStacktrace ("interrupted while waiting for room in the queue"));
        }
    }

    void onCompleted () {
        numCompleted.incrementAndGet ();
    }

    @Override public void shutdown () throws InterruptedException {
        shutdownLock.writeLock ().lock ();
        try {
            pool.shutdown ();
        }
        finally {
            shutdownLock.writeLock ().unlock ();
        }

        // Idle workers may be blocked in the queue indefinitely, so they are woken up by shutdown markers. Markers go behind
        //  the pending futures, which are still executed.
        wakeUpIdleWorkers ();
        while (! pool.awaitEmpty (idleCheckMillis, TimeUnit.MILLISECONDS)) {
            wakeUpIdleWorkers ();
        }

        // submitters blocked by back pressure notice the shut down within one idle check interval
        while (numBackPressured.get () > 0) {
            clock.sleepUntil (clock.deadlineAfterMillis (idleCheckMillis));
        }
        rejectLeftovers ();

        log.info ("executor shut down: {}", getStatistics ());
    }

    /**
     * Completes futures that were queued by back-pressured submitters after the last worker terminated.
     */
    private void rejectLeftovers () {
        AFutureImpl<?> leftover;
        while ((leftover = pendingFutures.remove ()) != null) {
            if (leftover != SHUTDOWN_MARKER && leftover.tryCompleteExceptionally (new RejectedExecutionExceptionWithoutStacktrace ("executor shut down before the callable was started"))) {
                log.debug ("rejected future #{} during shutdown", leftover.submissionId ());
            }
        }
    }

    private void wakeUpIdleWorkers () {
        final int numWorkers = pool.size ();
        for (int i=0; i<numWorkers; i++) {
            if (! pendingFutures.add (SHUTDOWN_MARKER)) {
                break;
            }
        }
    }

    @Override public boolean isShutdown () {
        return pool.isShutdown ();
    }

    @Override public AExecutorStatistics getStatistics () {
        return new AExecutorStatistics (pool.size (), pool.peakSize (), pool.numForcedThreads (), numEvictions.get (), pendingFutures.size (), nextSubmissionId.get (), numCompleted.get ());
    }

    @Override public String toString () {
        return "AExecutorImpl{" +
                "pool=" + pool +
                ", pendingFutures=" + pendingFutures +
                ", keepAliveMillis=" + keepAliveMillis +
                '}';
    }
}
