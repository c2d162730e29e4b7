package com.ajjpj.concurrent.exec.queue;

import com.ajjpj.concurrent.exec.util.AClock;
import com.ajjpj.concurrent.exec.util.ARingBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;


/**
 * An {@link ABlockingQueue} based on counting semaphores: {@code freeSlots} starts at the queue's capacity,
 *  {@code filledSlots} starts at zero. A thread first acquires a permit of the relevant semaphore and then
 *  enters a short critical section to actually touch the ring buffer. Acquiring a permit reserves an element
 *  (or a slot), so the buffer operation inside the lock is guaranteed to succeed.
 *
 * @author arno
 */
class SemaphoreBlockingQueue<T> implements ABlockingQueue<T> {
    private static final Logger log = LoggerFactory.getLogger (SemaphoreBlockingQueue.class);

    private final ARingBuffer<T> buffer;
    private final AClock clock;

    private final Semaphore freeSlots;
    private final Semaphore filledSlots;
    private final ReentrantLock lock = new ReentrantLock ();

    SemaphoreBlockingQueue (int capacity, AClock clock) {
        this.buffer = new ARingBuffer<> (capacity);
        this.clock = clock;

        this.freeSlots = new Semaphore (capacity, true);
        this.filledSlots = new Semaphore (0, true);
    }

    @Override public T get () throws InterruptedException {
        filledSlots.acquire ();
        return doGet ("get");
    }

    @Override public void put (T element) throws InterruptedException {
        checkNotNull (element);
        freeSlots.acquire ();
        doPut ("put", element);
    }

    @Override public T remove () {
        if (! filledSlots.tryAcquire ()) {
            logActivity ("remove", null);
            return null;
        }
        return doGet ("remove");
    }

    @Override public boolean add (T element) {
        checkNotNull (element);
        if (! freeSlots.tryAcquire ()) {
            logActivity ("add", null);
            return false;
        }
        doPut ("add", element);
        return true;
    }

    @Override public T poll (long deadline) throws InterruptedException {
        if (! filledSlots.tryAcquire (clock.remainingNanos (deadline), TimeUnit.NANOSECONDS)) {
            logActivity ("poll", null);
            return null;
        }
        return doGet ("poll");
    }

    @Override public boolean offer (T element, long deadline) throws InterruptedException {
        checkNotNull (element);
        if (! freeSlots.tryAcquire (clock.remainingNanos (deadline), TimeUnit.NANOSECONDS)) {
            logActivity ("offer", null);
            return false;
        }
        doPut ("offer", element);
        return true;
    }

    /**
     * This method must only be called with a 'filled slots' permit held. The permit is turned into a 'free slots' permit.
     */
    private T doGet (String activity) {
        final T result;
        lock.lock ();
        try {
            result = buffer.tryGet ();
        }
        finally {
            lock.unlock ();
        }
        if (result == null) {
            throw new IllegalStateException ("acquired a filled slot, but the buffer is empty");
        }

        logActivity (activity, result);
        freeSlots.release ();
        return result;
    }

    /**
     * This method must only be called with a 'free slots' permit held. The permit is turned into a 'filled slots' permit.
     */
    private void doPut (String activity, T element) {
        final boolean success;
        lock.lock ();
        try {
            success = buffer.tryPut (element);
        }
        finally {
            lock.unlock ();
        }
        if (! success) {
            throw new IllegalStateException ("acquired a free slot, but the buffer is full");
        }

        logActivity (activity, element);
        filledSlots.release ();
    }

    @Override public int size () {
        lock.lock ();
        try {
            return buffer.size ();
        }
        finally {
            lock.unlock ();
        }
    }

    @Override public int capacity () {
        return buffer.capacity ();
    }

    private static void checkNotNull (Object element) {
        if (element == null) {
            throw new IllegalArgumentException ("null elements are not supported");
        }
    }

    private static void logActivity (String activity, Object element) {
        if (log.isDebugEnabled ()) {
            log.debug ("[{}] {}", activity, element);
        }
    }

    @Override public String toString () {
        return "SemaphoreBlockingQueue{" +
                "size=" + size () +
                ", capacity=" + capacity () +
                '}';
    }
}
