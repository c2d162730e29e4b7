package com.ajjpj.concurrent.exec.util;

/**
 * A fixed-capacity FIFO ring buffer. This class does no synchronization whatsoever, all callers must
 *  hold exclusive access - it is the storage behind the blocking queues in {@code com.ajjpj.concurrent.exec.queue}.<p>
 * {@code null} serves as the 'empty' marker, so it can not be stored.
 *
 * @author arno
 */
public class ARingBuffer<T> {
    /**
     * an array holding all currently stored elements
     */
    private final Object[] elements;

    /**
     * index of the next slot to read from - never wraps, projected into the array by 'modulo capacity'
     */
    private long base = 0;

    /**
     * index of the next slot to write to - never wraps either
     */
    private long top = 0;

    public ARingBuffer (int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException ("capacity must be at least 1, is " + capacity);
        }
        this.elements = new Object[capacity];
    }

    /**
     * Adds an element at the end of the buffer.
     *
     * @return false iff the buffer is full, leaving it unchanged
     */
    public boolean tryPut (T element) {
        if (element == null) {
            throw new IllegalArgumentException ("null elements are not supported");
        }
        if (isFull ()) {
            return false;
        }

        elements[asArrayIndex (top)] = element;
        top += 1;
        return true;
    }

    /**
     * Removes the oldest element from the buffer.
     *
     * @return the element, or null iff the buffer is empty
     */
    public T tryGet () {
        if (isEmpty ()) {
            return null;
        }

        final int idx = asArrayIndex (base);
        @SuppressWarnings ("unchecked")
        final T result = (T) elements[idx];
        elements[idx] = null; // allow GC
        base += 1;
        return result;
    }

    public int size () {
        return (int) (top - base);
    }

    public int capacity () {
        return elements.length;
    }

    public boolean isEmpty () {
        return top == base;
    }

    public boolean isFull () {
        return top - base == elements.length;
    }

    private int asArrayIndex (long l) {
        return (int) (l % elements.length);
    }

    @Override public String toString () {
        return "ARingBuffer{" +
                "size=" + size () +
                ", capacity=" + capacity () +
                '}';
    }
}
