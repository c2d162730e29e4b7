package com.ajjpj.concurrent.exec.queue;

import com.ajjpj.concurrent.exec.util.AClock;
import com.ajjpj.concurrent.exec.util.ARingBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;


/**
 * An {@link ABlockingQueue} based on a single lock with two conditions. Waiting threads re-check the buffer
 *  after every wake-up before they look at their deadline, so a signal that arrives together with a timeout
 *  is never lost.
 *
 * @author arno
 */
class ConditionBlockingQueue<T> implements ABlockingQueue<T> {
    private static final Logger log = LoggerFactory.getLogger (ConditionBlockingQueue.class);

    private final ARingBuffer<T> buffer;
    private final AClock clock;

    private final ReentrantLock lock = new ReentrantLock ();
    private final Condition itemAvailable = lock.newCondition ();
    private final Condition slotFreed = lock.newCondition ();

    ConditionBlockingQueue (int capacity, AClock clock) {
        this.buffer = new ARingBuffer<> (capacity);
        this.clock = clock;
    }

    @Override public T get () throws InterruptedException {
        T result;

        lock.lock ();
        try {
            while ((result = buffer.tryGet ()) == null) {
                itemAvailable.await ();
            }
            slotFreed.signal ();
        }
        finally {
            lock.unlock ();
        }

        logActivity ("get", result);
        return result;
    }

    @Override public void put (T element) throws InterruptedException {
        checkNotNull (element);

        lock.lock ();
        try {
            while (! buffer.tryPut (element)) {
                slotFreed.await ();
            }
            itemAvailable.signal ();
        }
        finally {
            lock.unlock ();
        }

        logActivity ("put", element);
    }

    @Override public T remove () {
        final T result;

        lock.lock ();
        try {
            result = buffer.tryGet ();
            if (result != null) {
                slotFreed.signal ();
            }
        }
        finally {
            lock.unlock ();
        }

        logActivity ("remove", result);
        return result;
    }

    @Override public boolean add (T element) {
        checkNotNull (element);

        final boolean success;
        lock.lock ();
        try {
            success = buffer.tryPut (element);
            if (success) {
                itemAvailable.signal ();
            }
        }
        finally {
            lock.unlock ();
        }

        logActivity ("add", success ? element : null);
        return success;
    }

    @Override public T poll (long deadline) throws InterruptedException {
        T result;

        lock.lock ();
        try {
            long remaining;
            while ((result = buffer.tryGet ()) == null) {
                if ((remaining = clock.remainingNanos (deadline)) <= 0) {
                    break;
                }
                itemAvailable.awaitNanos (remaining);
            }
            if (result != null) {
                slotFreed.signal ();
            }
        }
        finally {
            lock.unlock ();
        }

        logActivity ("poll", result);
        return result;
    }

    @Override public boolean offer (T element, long deadline) throws InterruptedException {
        checkNotNull (element);

        boolean success;
        lock.lock ();
        try {
            long remaining;
            while (! (success = buffer.tryPut (element))) {
                if ((remaining = clock.remainingNanos (deadline)) <= 0) {
                    break;
                }
                slotFreed.awaitNanos (remaining);
            }
            if (success) {
                itemAvailable.signal ();
            }
        }
        finally {
            lock.unlock ();
        }

        logActivity ("offer", success ? element : null);
        return success;
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
        return "ConditionBlockingQueue{" +
                "size=" + size () +
                ", capacity=" + capacity () +
                '}';
    }
}
