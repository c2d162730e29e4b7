package com.ajjpj.concurrent.exec.api;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;


/**
 * Handle to the eventual result of an {@link ACallable} submitted to an {@link AExecutor}. Any number of threads
 *  may wait for the result concurrently, and all of them receive the same outcome.
 *
 * @author arno
 */
public interface AFuture<T> {
    boolean isComplete ();

    /**
     * Blocks until the callable has completed and returns its result.
     *
     * @throws ExecutionException if the callable failed, wrapping the failure
     */
    T get () throws InterruptedException, ExecutionException;

    /**
     * Like {@link #get()}, but waits no longer than the given timeout.
     */
    T get (long timeout, TimeUnit timeUnit) throws InterruptedException, ExecutionException, TimeoutException;

    ACallable<T> getCallable ();

    /**
     * @return a number identifying this future, unique and increasing per executor
     */
    long submissionId ();
}
