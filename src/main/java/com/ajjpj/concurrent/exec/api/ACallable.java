package com.ajjpj.concurrent.exec.api;

import java.util.concurrent.Callable;
import java.util.function.Function;


/**
 * An immutable unit of work for an {@link AExecutor}: the code to run plus its repeat period. A period of 0 means
 *  the code runs exactly once, otherwise it is re-run every {@code periodMillis} until the executor shuts down.
 *
 * @author arno
 */
public final class ACallable<T> {
    private final Callable<T> code;
    private final long periodMillis;

    private ACallable (Callable<T> code, long periodMillis) {
        if (code == null) {
            throw new IllegalArgumentException ("code must not be null");
        }
        if (periodMillis < 0) {
            throw new IllegalArgumentException ("period must not be negative, is " + periodMillis);
        }

        this.code = code;
        this.periodMillis = periodMillis;
    }

    public static <T> ACallable<T> oneShot (Callable<T> code) {
        return new ACallable<> (code, 0);
    }

    public static <T> ACallable<T> periodic (Callable<T> code, long periodMillis) {
        if (periodMillis == 0) {
            throw new IllegalArgumentException ("a periodic callable requires a period greater than 0");
        }
        return new ACallable<> (code, periodMillis);
    }

    /**
     * Binds an entry point to its parameters.
     */
    public static <P, T> ACallable<T> withParams (Function<P, T> entryPoint, P params, long periodMillis) {
        if (entryPoint == null) {
            throw new IllegalArgumentException ("entry point must not be null");
        }
        return new ACallable<> (() -> entryPoint.apply (params), periodMillis);
    }

    public T call () throws Exception {
        return code.call ();
    }

    public long getPeriodMillis () {
        return periodMillis;
    }

    public boolean isPeriodic () {
        return periodMillis != 0;
    }

    @Override public String toString () {
        return "ACallable{" +
                "code=" + code +
                ", periodMillis=" + periodMillis +
                '}';
    }
}
