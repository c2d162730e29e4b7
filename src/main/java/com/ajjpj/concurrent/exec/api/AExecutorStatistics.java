package com.ajjpj.concurrent.exec.api;

import java.text.NumberFormat;


/**
 * A snapshot of an executor's state. The individual numbers are read one after the other rather than atomically, so they
 *  need not be consistent with each other while work is in progress.
 *
 * @author arno
 */
public class AExecutorStatistics {
    public final int poolSize;
    public final int peakPoolSize;
    public final long numForcedThreads;
    public final long numEvictions;
    public final int numPending;
    public final long numSubmitted;
    public final long numCompleted;

    public AExecutorStatistics (int poolSize, int peakPoolSize, long numForcedThreads, long numEvictions, int numPending, long numSubmitted, long numCompleted) {
        this.poolSize = poolSize;
        this.peakPoolSize = peakPoolSize;
        this.numForcedThreads = numForcedThreads;
        this.numEvictions = numEvictions;
        this.numPending = numPending;
        this.numSubmitted = numSubmitted;
        this.numCompleted = numCompleted;
    }

    @Override public String toString () {
        return "AExecutorStatistics{" +
                "poolSize=" + poolSize +
                ", peakPoolSize=" + peakPoolSize +
                ", numForcedThreads=" + NumberFormat.getNumberInstance ().format (numForcedThreads) +
                ", numEvictions=" + NumberFormat.getNumberInstance ().format (numEvictions) +
                ", numPending=" + NumberFormat.getNumberInstance ().format (numPending) +
                ", numSubmitted=" + NumberFormat.getNumberInstance ().format (numSubmitted) +
                ", numCompleted=" + NumberFormat.getNumberInstance ().format (numCompleted) +
                '}';
    }
}
