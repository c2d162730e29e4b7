package com.ajjpj.concurrent.exec.impl;

/**
 * The states of a {@link PoolWorker}. Both running states lead to {@link #IDLE_WAITING} when their future is done,
 *  {@link #IDLE_WAITING} leads to a running state when new work is obtained and to {@link #TERMINATED} when the pool
 *  releases the thread.
 *
 * @author arno
 */
enum WorkerState {
    RUNNING_ONE_SHOT,
    RUNNING_PERIODIC,
    IDLE_WAITING,
    TERMINATED;

    static WorkerState runningStateFor (AFutureImpl<?> future) {
        return future.getCallable ().isPeriodic () ? RUNNING_PERIODIC : RUNNING_ONE_SHOT;
    }
}
