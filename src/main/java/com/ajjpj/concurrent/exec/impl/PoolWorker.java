package com.ajjpj.concurrent.exec.impl;

import com.ajjpj.concurrent.exec.api.ACallable;
import com.ajjpj.concurrent.exec.util.AClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * The main loop of an executor's pool thread. A worker is started with a first future, runs it, and then keeps fetching
 *  pending futures from the executor's queue until it is idle for too long or the executor shuts down.
 *
 * @author arno
 */
class PoolWorker implements Runnable {
    private static final Logger log = LoggerFactory.getLogger (PoolWorker.class);

    private final AExecutorImpl executor;
    private final AClock clock;
    private final AFutureImpl<?> firstFuture;

    private WorkerState state;

    PoolWorker (AExecutorImpl executor, AFutureImpl<?> firstFuture) {
        this.executor = executor;
        this.clock = executor.clock;
        this.firstFuture = firstFuture;
    }

    @Override public void run () {
        AFutureImpl<?> future = firstFuture;
        transitionTo (WorkerState.runningStateFor (future));

        try {
            while (state != WorkerState.TERMINATED) {
                switch (state) {
                    case RUNNING_ONE_SHOT:
                        runOnce (future);
                        transitionTo (WorkerState.IDLE_WAITING);
                        break;
                    case RUNNING_PERIODIC:
                        runPeriodically (future);
                        transitionTo (WorkerState.IDLE_WAITING);
                        break;
                    case IDLE_WAITING:
                        future = awaitWork ();
                        if (obtainedWork (future)) {
                            transitionTo (WorkerState.runningStateFor (future));
                        }
                        else if (poolAgreesToRelease ()) {
                            transitionTo (WorkerState.TERMINATED);
                        }
                        break;
                    default:
                        throw new IllegalStateException ("unexpected worker state " + state);
                }
            }
        }
        catch (InterruptedException e) {
            log.warn ("{} was interrupted, leaving the pool", Thread.currentThread ().getName ());
            executor.pool.abandonThread ();
        }
    }

    private void transitionTo (WorkerState newState) {
        if (log.isTraceEnabled ()) {
            log.trace ("{}: {} -> {}", Thread.currentThread ().getName (), state, newState);
        }
        state = newState;
    }

    private <T> void runOnce (AFutureImpl<T> future) {
        final T result;
        try {
            result = future.getCallable ().call ();
        }
        catch (Throwable th) {
            //TODO distinguish between safe and unsafe throwables
            onFailure (future, th);
            return;
        }
        future.complete (result);
        executor.onCompleted ();
    }

    /**
     * Re-runs a periodic callable at release times {@code start + k * period} until the executor shuts down. A shut down ends the
     *  schedule with the result of the last run, a failure ends it exceptionally.
     */
    private <T> void runPeriodically (AFutureImpl<T> future) throws InterruptedException {
        final ACallable<T> callable = future.getCallable ();
        long nextRelease = clock.now ();
        T lastResult;

        try {
            while (true) {
                try {
                    lastResult = callable.call ();
                }
                catch (Throwable th) {
                    onFailure (future, th);
                    return;
                }

                nextRelease = clock.plusMillis (nextRelease, callable.getPeriodMillis ());
                clock.sleepUntil (nextRelease);

                if (isShutdownRequested ()) {
                    break;
                }
            }
        }
        catch (InterruptedException e) {
            if (future.tryCompleteExceptionally (e)) {
                executor.onCompleted ();
            }
            throw e;
        }

        future.complete (lastResult);
        executor.onCompleted ();
    }

    private void onFailure (AFutureImpl<?> future, Throwable th) {
        log.warn ("callable #{} failed", future.submissionId (), th);
        future.completeExceptionally (th);
        executor.onCompleted ();
    }

    private AFutureImpl<?> awaitWork () throws InterruptedException {
        if (executor.keepAliveMillis == AExecutorBuilder.FOREVER) {
            return executor.pendingFutures.get ();
        }
        return executor.pendingFutures.poll (clock.deadlineAfterMillis (executor.keepAliveMillis));
    }

    private boolean obtainedWork (AFutureImpl<?> future) {
        return future != null && future != AExecutorImpl.SHUTDOWN_MARKER;
    }

    private boolean isShutdownRequested () {
        return executor.pool.isShutdown ();
    }

    private boolean poolAgreesToRelease () {
        return executor.pool.removeThread ();
    }
}
