package com.ajjpj.concurrent.exec.queue;

/**
 * A bounded FIFO queue that is safe for any number of concurrent producers and consumers. Every kind of
 *  access exists in a blocking, a non-blocking and a deadline-bounded variant.<p>
 * Absence of an element is signalled by {@code null} (for retrieval) or {@code false} (for insertion), never by
 *  an exception. Running into a deadline is a regular outcome as well. Deadlines are absolute timestamps of the
 *  queue's {@link com.ajjpj.concurrent.exec.util.AClock}.<p>
 * Implementations differ only in the synchronization primitives they use, see {@link ABlockingQueueStrategy}.
 *
 * @author arno
 */
public interface ABlockingQueue<T> {
    /**
     * Removes and returns the oldest element, waiting for one to become available if necessary.
     */
    T get () throws InterruptedException;

    /**
     * Inserts an element, waiting for a free slot if necessary.
     */
    void put (T element) throws InterruptedException;

    /**
     * Removes and returns the oldest element if one is available, and returns {@code null} immediately otherwise.
     */
    T remove ();

    /**
     * Inserts an element if there is a free slot, and returns {@code false} immediately otherwise.
     */
    boolean add (T element);

    /**
     * Like {@link #get()}, but gives up and returns {@code null} when {@code deadline} passes before an element becomes available.
     */
    T poll (long deadline) throws InterruptedException;

    /**
     * Like {@link #put(Object)}, but gives up and returns {@code false} when {@code deadline} passes before a slot becomes free.
     */
    boolean offer (T element, long deadline) throws InterruptedException;

    /**
     * @return a snapshot of the number of stored elements
     */
    int size ();

    int capacity ();
}
