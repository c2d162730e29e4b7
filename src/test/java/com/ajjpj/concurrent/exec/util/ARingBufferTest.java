package com.ajjpj.concurrent.exec.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;


public class ARingBufferTest {
    @Test
    public void testFifo () {
        final ARingBuffer<String> buffer = new ARingBuffer<> (3);

        assertTrue (buffer.tryPut ("a"));
        assertTrue (buffer.tryPut ("b"));
        assertEquals ("a", buffer.tryGet ());
        assertTrue (buffer.tryPut ("c"));
        assertTrue (buffer.tryPut ("d"));

        assertEquals ("b", buffer.tryGet ());
        assertEquals ("c", buffer.tryGet ());
        assertEquals ("d", buffer.tryGet ());
        assertNull (buffer.tryGet ());
    }

    @Test
    public void testFullBufferIsUnchanged () {
        final ARingBuffer<Integer> buffer = new ARingBuffer<> (2);
        assertTrue (buffer.tryPut (1));
        assertTrue (buffer.tryPut (2));
        assertTrue (buffer.isFull ());

        assertFalse (buffer.tryPut (3));
        assertEquals (2, buffer.size ());
        assertEquals (1, buffer.tryGet ());
        assertEquals (2, buffer.tryGet ());
        assertTrue (buffer.isEmpty ());
    }

    @Test
    public void testWrapAround () {
        final ARingBuffer<Integer> buffer = new ARingBuffer<> (3);
        for (int i=0; i<100; i++) {
            assertTrue (buffer.tryPut (i));
            assertTrue (buffer.tryPut (i + 1000));
            assertEquals (i, buffer.tryGet ());
            assertEquals (i + 1000, buffer.tryGet ());
            assertEquals (0, buffer.size ());
        }
    }

    @Test
    public void testInvalidArguments () {
        assertThrows (IllegalArgumentException.class, () -> new ARingBuffer<> (0));
        assertThrows (IllegalArgumentException.class, () -> new ARingBuffer<String> (1).tryPut (null));
    }
}
