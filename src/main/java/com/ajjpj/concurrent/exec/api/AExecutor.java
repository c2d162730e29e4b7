package com.ajjpj.concurrent.exec.api;

import com.ajjpj.concurrent.exec.impl.AExecutorBuilder;

import java.util.concurrent.Callable;


/**
 * @author arno
 */
public interface AExecutor {
    /**
     * Submits a callable for execution. This never blocks for the callable's completion, and the callable is never silently dropped:
     *  when both the pool's core threads and the pending queue are exhausted, additional threads up to the pool's maximum size
     *  are started. If even the maximum size is reached, the caller blocks until there is room in the queue. A future that is
     *  still waiting for room when the executor shuts down completes with a
     *  {@link com.ajjpj.concurrent.exec.api.exc.RejectedExecutionExceptionWithoutStacktrace}.
     *
     * @throws com.ajjpj.concurrent.exec.api.exc.RejectedExecutionExceptionWithoutStacktrace if the executor is shut down
     */
    <T> AFuture<T> submit (ACallable<T> callable);

    default <T> AFuture<T> submit (Callable<T> code) {
        return submit (ACallable.oneShot (code));
    }

    /**
     * Stops accepting work and blocks until every worker thread has terminated. Work that was submitted before is still executed,
     *  periodic callables stop after their current period.
     */
    void shutdown () throws InterruptedException;

    boolean isShutdown ();

    AExecutorStatistics getStatistics ();

    static AExecutor create (int coreSize, int maxSize, long keepAliveMillis, int queueCapacity) {
        return new AExecutorBuilder ()
                .withCoreSize (coreSize)
                .withMaxSize (maxSize)
                .withKeepAliveMillis (keepAliveMillis)
                .withQueueCapacity (queueCapacity)
                .build ();
    }
}
