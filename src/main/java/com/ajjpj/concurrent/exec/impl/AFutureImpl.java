package com.ajjpj.concurrent.exec.impl;

import com.ajjpj.concurrent.exec.api.ACallable;
import com.ajjpj.concurrent.exec.api.AFuture;
import com.ajjpj.concurrent.exec.api.exc.TimeoutExceptionWithoutStackTrace;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;


/**
 * The future implementation used by {@link AExecutorImpl}. It is written by exactly one worker thread and read by any
 *  number of threads, each future having its own lock and 'completed' condition.<p>
 * A future is referenced by its executor (pending queue or worker thread) until it is completed, and by callers until
 *  they read the result. There is no explicit release, the garbage collector reclaims it once both sides dropped it.
 *
 * @author arno
 */
public class AFutureImpl<T> implements AFuture<T> {
    private final ACallable<T> callable;
    private final long submissionId;

    private final ReentrantLock lock = new ReentrantLock ();
    private final Condition completion = lock.newCondition ();

    // guarded by 'lock'; 'completed' is volatile for lock-free reads in isComplete()
    private volatile boolean completed = false;
    private T result;
    private Throwable failure;

    public AFutureImpl (ACallable<T> callable, long submissionId) {
        this.callable = callable;
        this.submissionId = submissionId;
    }

    /**
     * @throws IllegalStateException if the future was completed before
     */
    public void complete (T result) {
        if (! tryComplete (result)) {
            throw new IllegalStateException ("future #" + submissionId + " is already completed");
        }
    }

    /**
     * @throws IllegalStateException if the future was completed before
     */
    public void completeExceptionally (Throwable th) {
        if (! tryCompleteExceptionally (th)) {
            throw new IllegalStateException ("future #" + submissionId + " is already completed");
        }
    }

    public boolean tryComplete (T result) {
        return doComplete (result, null);
    }

    public boolean tryCompleteExceptionally (Throwable th) {
        if (th == null) {
            throw new IllegalArgumentException ("failure must not be null");
        }
        return doComplete (null, th);
    }

    private boolean doComplete (T result, Throwable failure) {
        lock.lock ();
        try {
            if (completed) {
                return false;
            }

            this.result = result;
            this.failure = failure;
            // the outcome must be written before 'completed' is set
            completed = true;
            completion.signalAll ();
            return true;
        }
        finally {
            lock.unlock ();
        }
    }

    @Override public boolean isComplete () {
        return completed;
    }

    @Override public T get () throws InterruptedException, ExecutionException {
        lock.lock ();
        try {
            while (! completed) {
                completion.await ();
            }
            return outcome ();
        }
        finally {
            lock.unlock ();
        }
    }

    @Override public T get (long timeout, TimeUnit timeUnit) throws InterruptedException, ExecutionException, TimeoutExceptionWithoutStackTrace {
        long remaining = timeUnit.toNanos (timeout);

        lock.lock ();
        try {
            while (! completed) {
                if (remaining <= 0) {
                    throw new TimeoutExceptionWithoutStackTrace ("future #" + submissionId + " did not complete within " + timeout + " " + timeUnit);
                }
                remaining = completion.awaitNanos (remaining);
            }
            return outcome ();
        }
        finally {
            lock.unlock ();
        }
    }

    /**
     * This method must only be called with the lock held and 'completed' set.
     */
    private T outcome () throws ExecutionException {
        if (failure != null) {
            throw new ExecutionException (failure);
        }
        return result;
    }

    @Override public ACallable<T> getCallable () {
        return callable;
    }

    @Override public long submissionId () {
        return submissionId;
    }

    @Override public String toString () {
        return "AFutureImpl{#" + submissionId + (completed ? ", completed" : "") + '}';
    }
}
