package com.ajjpj.concurrent.exec.queue;

import com.ajjpj.concurrent.exec.util.AClock;


/**
 * Selects the synchronization strategy of an {@link ABlockingQueue}. Both strategies have identical semantics.
 *
 * @author arno
 */
public enum ABlockingQueueStrategy {
    /**
     * counting semaphores for free and filled slots, plus a lock guarding the buffer
     */
    Semaphore,
    /**
     * one lock with 'item available' and 'slot freed' conditions
     */
    Condition;

    public <T> ABlockingQueue<T> create (int capacity) {
        return create (capacity, AClock.SYSTEM);
    }

    public <T> ABlockingQueue<T> create (int capacity, AClock clock) {
        switch (this) {
            case Semaphore: return new SemaphoreBlockingQueue<> (capacity, clock);
            case Condition: return new ConditionBlockingQueue<> (capacity, clock);
        }
        throw new IllegalStateException ("unknown blocking queue strategy " + this);
    }
}
