package com.ajjpj.concurrent.exec.impl;

import com.ajjpj.concurrent.exec.api.AExecutor;
import com.ajjpj.concurrent.exec.pool.AElasticThreadPool;
import com.ajjpj.concurrent.exec.queue.ABlockingQueue;
import com.ajjpj.concurrent.exec.queue.ABlockingQueueStrategy;
import com.ajjpj.concurrent.exec.util.AClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


public class AExecutorBuilder {
    private static final Logger log = LoggerFactory.getLogger (AExecutorBuilder.class);

    /**
     * keep-alive value for 'never release idle threads'
     */
    public static final long FOREVER = -1;

    private static final int DERIVED = -1;

    private int coreSize = Runtime.getRuntime ().availableProcessors ();
    private int maxSize = DERIVED;
    private long keepAliveMillis = FOREVER;
    private int queueCapacity = 1024;
    private ABlockingQueueStrategy queueStrategy = ABlockingQueueStrategy.Condition;
    private String threadNamePrefix = "a-executor";
    private boolean daemonThreads = true;
    private long idleCheckMillis = 100;
    private AClock clock = AClock.SYSTEM;

    public AExecutorBuilder withCoreSize (int coreSize) {
        this.coreSize = coreSize;
        return this;
    }

    /**
     * Unless set explicitly, the maximum size is twice the core size in effect when {@link #build()} is called.
     */
    public AExecutorBuilder withMaxSize (int maxSize) {
        this.maxSize = maxSize;
        return this;
    }

    /**
     * @param keepAliveMillis the time an idle thread above core size waits for new work before it terminates, or {@link #FOREVER}
     */
    public AExecutorBuilder withKeepAliveMillis (long keepAliveMillis) {
        this.keepAliveMillis = keepAliveMillis;
        return this;
    }

    public AExecutorBuilder withQueueCapacity (int queueCapacity) {
        this.queueCapacity = queueCapacity;
        return this;
    }

    public AExecutorBuilder withQueueStrategy (ABlockingQueueStrategy queueStrategy) {
        this.queueStrategy = queueStrategy;
        return this;
    }

    public AExecutorBuilder withThreadNamePrefix (String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
        return this;
    }

    public AExecutorBuilder withDaemonThreads (boolean daemonThreads) {
        this.daemonThreads = daemonThreads;
        return this;
    }

    /**
     * @param idleCheckMillis the interval at which shutdown re-checks for workers that did not terminate yet
     */
    public AExecutorBuilder withIdleCheckMillis (long idleCheckMillis) {
        this.idleCheckMillis = idleCheckMillis;
        return this;
    }

    public AExecutorBuilder withClock (AClock clock) {
        this.clock = clock;
        return this;
    }

    public AExecutor build () {
        if (keepAliveMillis != FOREVER && keepAliveMillis <= 0) {
            throw new IllegalArgumentException ("keep-alive must be positive or FOREVER, is " + keepAliveMillis);
        }
        if (idleCheckMillis <= 0) {
            throw new IllegalArgumentException ("idle check interval must be positive, is " + idleCheckMillis);
        }
        if (queueStrategy == null || clock == null || threadNamePrefix == null) {
            throw new IllegalArgumentException ("queue strategy, clock and thread name prefix are required: " + this);
        }

        final AElasticThreadPool pool = new AElasticThreadPool (coreSize, effectiveMaxSize (), threadNamePrefix, daemonThreads);
        final ABlockingQueue<AFutureImpl<?>> pendingFutures = queueStrategy.create (queueCapacity, clock);

        log.info ("creating executor: {}", this);
        return new AExecutorImpl (pool, pendingFutures, keepAliveMillis, idleCheckMillis, clock);
    }

    private int effectiveMaxSize () {
        return maxSize == DERIVED ? 2 * coreSize : maxSize;
    }

    @Override
    public String toString () {
        return "AExecutorBuilder{" +
                "coreSize=" + coreSize +
                ", maxSize=" + effectiveMaxSize () +
                ", keepAliveMillis=" + (keepAliveMillis == FOREVER ? "FOREVER" : String.valueOf (keepAliveMillis)) +
                ", queueCapacity=" + queueCapacity +
                ", queueStrategy=" + queueStrategy +
                ", threadNamePrefix=" + threadNamePrefix +
                ", daemonThreads=" + daemonThreads +
                ", idleCheckMillis=" + idleCheckMillis +
                '}';
    }
}
