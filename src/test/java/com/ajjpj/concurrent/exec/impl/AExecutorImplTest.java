package com.ajjpj.concurrent.exec.impl;

import com.ajjpj.concurrent.exec.api.ACallable;
import com.ajjpj.concurrent.exec.api.AExecutor;
import com.ajjpj.concurrent.exec.api.AExecutorStatistics;
import com.ajjpj.concurrent.exec.api.AFuture;
import com.ajjpj.concurrent.exec.queue.ABlockingQueueStrategy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;


public class AExecutorImplTest {
    private final List<AExecutor> executors = new ArrayList<> ();
    private final CountDownLatch release = new CountDownLatch (1);

    @AfterEach
    public void tearDown () throws InterruptedException {
        release.countDown ();
        for (AExecutor executor: executors) {
            executor.shutdown ();
        }
    }

    private AExecutor newExecutor (int coreSize, int maxSize, long keepAliveMillis, int queueCapacity, ABlockingQueueStrategy strategy) {
        final AExecutor result = new AExecutorBuilder ()
                .withCoreSize (coreSize)
                .withMaxSize (maxSize)
                .withKeepAliveMillis (keepAliveMillis)
                .withQueueCapacity (queueCapacity)
                .withQueueStrategy (strategy)
                .withIdleCheckMillis (20)
                .build ();
        executors.add (result);
        return result;
    }

    private Callable<Integer> blockingCallable (int result) {
        return () -> {
            release.await ();
            return result;
        };
    }

    private static void awaitPoolSize (AExecutor executor, int expected) throws InterruptedException {
        final long deadline = System.nanoTime () + TimeUnit.SECONDS.toNanos (5);
        while (executor.getStatistics ().poolSize != expected && System.nanoTime () < deadline) {
            Thread.sleep (5);
        }
        assertEquals (expected, executor.getStatistics ().poolSize);
    }

    @ParameterizedTest
    @EnumSource (ABlockingQueueStrategy.class)
    public void testScenarioFiveCallablesOnSmallPool (ABlockingQueueStrategy strategy) throws Exception {
        final AExecutor executor = newExecutor (2, 4, AExecutorBuilder.FOREVER, 2, strategy);

        final AtomicInteger numRunning = new AtomicInteger ();
        final AtomicInteger maxRunning = new AtomicInteger ();

        final List<AFuture<Integer>> futures = new ArrayList<> ();
        for (int i=0; i<5; i++) {
            final int idx = i;
            futures.add (executor.submit (() -> {
                maxRunning.accumulateAndGet (numRunning.incrementAndGet (), Math::max);
                Thread.sleep (50);
                numRunning.decrementAndGet ();
                return idx;
            }));
        }

        for (int i=0; i<5; i++) {
            assertEquals (i, futures.get (i).get (5, TimeUnit.SECONDS));
        }

        final AExecutorStatistics stats = executor.getStatistics ();
        assertTrue (stats.peakPoolSize <= 4, stats.toString ());
        assertTrue (maxRunning.get () <= 4);
        assertEquals (5, stats.numSubmitted);

        final long start = System.nanoTime ();
        executor.shutdown ();
        assertTrue (System.nanoTime () - start < TimeUnit.SECONDS.toNanos (2));
        assertEquals (0, executor.getStatistics ().poolSize);
        assertEquals (5, executor.getStatistics ().numCompleted);
    }

    @ParameterizedTest
    @EnumSource (ABlockingQueueStrategy.class)
    public void testQueueingDoesNotExceedCoreSize (ABlockingQueueStrategy strategy) throws Exception {
        final AExecutor executor = newExecutor (2, 4, AExecutorBuilder.FOREVER, 10, strategy);

        final List<AFuture<Integer>> futures = new ArrayList<> ();
        for (int i=0; i<8; i++) {
            futures.add (executor.submit (blockingCallable (i)));
        }

        AExecutorStatistics stats = executor.getStatistics ();
        assertEquals (2, stats.poolSize);
        assertEquals (6, stats.numPending);
        assertEquals (0, stats.numForcedThreads);
        assertEquals (0, stats.numEvictions);

        release.countDown ();
        for (int i=0; i<8; i++) {
            assertEquals (i, futures.get (i).get (5, TimeUnit.SECONDS));
        }

        // core threads stay alive while the executor is not shut down
        stats = executor.getStatistics ();
        assertEquals (2, stats.poolSize);
        assertEquals (2, stats.peakPoolSize);
    }

    @ParameterizedTest
    @EnumSource (ABlockingQueueStrategy.class)
    public void testSaturationForcesThreadsAndDropsNothing (ABlockingQueueStrategy strategy) throws Exception {
        final AExecutor executor = newExecutor (1, 3, AExecutorBuilder.FOREVER, 1, strategy);

        final List<AFuture<Integer>> futures = new ArrayList<> ();
        futures.add (executor.submit (blockingCallable (0))); // core thread
        futures.add (executor.submit (blockingCallable (1))); // queued
        futures.add (executor.submit (blockingCallable (2))); // evicts #1 to a forced thread
        futures.add (executor.submit (blockingCallable (3))); // evicts #2 to a forced thread

        AExecutorStatistics stats = executor.getStatistics ();
        assertEquals (3, stats.poolSize);
        assertEquals (2, stats.numForcedThreads);
        assertEquals (2, stats.numEvictions);
        assertEquals (1, stats.numPending);

        // the pool is at its maximum size now, so the next submission blocks until there is room in the queue
        final ExecutorService submitter = Executors.newSingleThreadExecutor ();
        try {
            final Future<AFuture<Integer>> lastSubmission = submitter.submit (() -> executor.submit (blockingCallable (4)));
            Thread.sleep (50);
            assertFalse (lastSubmission.isDone ());

            release.countDown ();
            futures.add (lastSubmission.get (5, TimeUnit.SECONDS));
        }
        finally {
            submitter.shutdownNow ();
        }

        for (int i=0; i<5; i++) {
            assertEquals (i, futures.get (i).get (5, TimeUnit.SECONDS));
        }

        stats = executor.getStatistics ();
        assertTrue (stats.peakPoolSize <= 3);
        assertEquals (5, stats.numSubmitted);
    }

    @Test
    public void testIdleThreadsAboveCoreSizeAreReleased () throws Exception {
        final AExecutor executor = newExecutor (1, 3, 50, 1, ABlockingQueueStrategy.Condition);

        final List<AFuture<Integer>> futures = new ArrayList<> ();
        for (int i=0; i<4; i++) {
            futures.add (executor.submit (blockingCallable (i)));
        }
        assertEquals (3, executor.getStatistics ().poolSize);

        release.countDown ();
        for (int i=0; i<4; i++) {
            assertEquals (i, futures.get (i).get (5, TimeUnit.SECONDS));
        }

        awaitPoolSize (executor, 1);

        // the remaining core thread keeps waiting for work
        Thread.sleep (150);
        assertEquals (1, executor.getStatistics ().poolSize);
        assertEquals (42, executor.submit (() -> 42).get (5, TimeUnit.SECONDS));
    }

    @ParameterizedTest
    @EnumSource (ABlockingQueueStrategy.class)
    public void testPeriodicCallable (ABlockingQueueStrategy strategy) throws Exception {
        final AExecutor executor = newExecutor (1, 2, AExecutorBuilder.FOREVER, 4, strategy);
        final AtomicInteger numInvocations = new AtomicInteger ();

        final AFuture<Integer> future = executor.submit (ACallable.periodic (numInvocations::incrementAndGet, 20));

        Thread.sleep (200);
        assertFalse (future.isComplete ());
        assertTrue (numInvocations.get () >= 3, "only " + numInvocations.get () + " invocations");

        executor.shutdown ();
        assertTrue (future.isComplete ());
        assertEquals (numInvocations.get (), future.get ());
        assertEquals (0, executor.getStatistics ().poolSize);
    }

    @Test
    public void testPeriodicScheduleDoesNotDrift () throws Exception {
        final AExecutor executor = newExecutor (1, 1, AExecutorBuilder.FOREVER, 1, ABlockingQueueStrategy.Semaphore);
        final List<Long> releaseTimes = new CopyOnWriteArrayList<> ();

        executor.submit (ACallable.periodic (() -> {
            releaseTimes.add (System.nanoTime ());
            Thread.sleep (5);
            return null;
        }, 20));

        Thread.sleep (250);
        executor.shutdown ();

        assertTrue (releaseTimes.size () >= 5);
        final long first = releaseTimes.get (0);
        final int k = releaseTimes.size () - 1;
        final long expected = first + k * TimeUnit.MILLISECONDS.toNanos (20);
        // absolute release times: k periods after the first release, not k * (period + execution time)
        assertTrue (releaseTimes.get (k) - expected < TimeUnit.MILLISECONDS.toNanos (k * 5L), "schedule drifted");
    }

    @Test
    public void testFailingCallableDoesNotKillTheWorker () throws Exception {
        final AExecutor executor = newExecutor (1, 1, AExecutorBuilder.FOREVER, 4, ABlockingQueueStrategy.Condition);

        final AFuture<Object> failing = executor.submit (() -> {
            throw new IllegalStateException ("expected in test");
        });
        final ExecutionException exc = assertThrows (ExecutionException.class, () -> failing.get (5, TimeUnit.SECONDS));
        assertTrue (exc.getCause () instanceof IllegalStateException);

        assertEquals ("still alive", executor.submit (() -> "still alive").get (5, TimeUnit.SECONDS));
        assertEquals (1, executor.getStatistics ().poolSize);
    }

    @Test
    public void testFailingPeriodicCallableEndsItsSchedule () throws Exception {
        final AExecutor executor = newExecutor (1, 1, AExecutorBuilder.FOREVER, 4, ABlockingQueueStrategy.Condition);
        final AtomicInteger numInvocations = new AtomicInteger ();

        final AFuture<Integer> future = executor.submit (ACallable.periodic (() -> {
            if (numInvocations.incrementAndGet () == 3) {
                throw new IllegalStateException ("expected in test");
            }
            return numInvocations.get ();
        }, 10));

        assertThrows (ExecutionException.class, () -> future.get (5, TimeUnit.SECONDS));
        Thread.sleep (50);
        assertEquals (3, numInvocations.get ());
    }

    @ParameterizedTest
    @EnumSource (ABlockingQueueStrategy.class)
    public void testShutdownExecutesPendingWork (ABlockingQueueStrategy strategy) throws Exception {
        final AExecutor executor = newExecutor (1, 1, AExecutorBuilder.FOREVER, 10, strategy);

        final List<AFuture<Integer>> futures = new ArrayList<> ();
        for (int i=0; i<6; i++) {
            final int idx = i;
            futures.add (executor.submit (() -> {
                Thread.sleep (10);
                return idx;
            }));
        }

        executor.shutdown ();

        assertEquals (0, executor.getStatistics ().poolSize);
        for (int i=0; i<6; i++) {
            assertTrue (futures.get (i).isComplete ());
            assertEquals (i, futures.get (i).get ());
        }
    }

    @Test
    public void testShutdownWithFiniteKeepAlive () throws Exception {
        final AExecutor executor = newExecutor (2, 2, 10_000, 4, ABlockingQueueStrategy.Semaphore);
        assertEquals (1, executor.submit (() -> 1).get (5, TimeUnit.SECONDS));
        assertEquals (2, executor.submit (() -> 2).get (5, TimeUnit.SECONDS));

        final long start = System.nanoTime ();
        executor.shutdown ();
        assertTrue (System.nanoTime () - start < TimeUnit.SECONDS.toNanos (2), "shutdown waited for the keep-alive time");
        assertEquals (0, executor.getStatistics ().poolSize);
    }

    @Test
    public void testSubmitAfterShutdownIsRejected () throws Exception {
        final AExecutor executor = newExecutor (1, 1, AExecutorBuilder.FOREVER, 1, ABlockingQueueStrategy.Condition);
        executor.shutdown ();

        assertTrue (executor.isShutdown ());
        assertThrows (RejectedExecutionException.class, () -> executor.submit (() -> 1));

        // shutting down again is harmless
        executor.shutdown ();
    }

    @ParameterizedTest
    @EnumSource (ABlockingQueueStrategy.class)
    public void testShutdownDoesNotWaitForBackPressuredSubmitter (ABlockingQueueStrategy strategy) throws Exception {
        final AExecutor executor = newExecutor (1, 1, AExecutorBuilder.FOREVER, 1, strategy);

        final AFuture<Integer> periodic = executor.submit (ACallable.periodic (() -> 1, 10)); // occupies the only thread
        final AFuture<Integer> queued = executor.submit (() -> 2);

        final ExecutorService helpers = Executors.newFixedThreadPool (2);
        try {
            // evicts #2, which has no thread to go to and waits for room in the queue
            final Future<AFuture<Integer>> blockedSubmission = helpers.submit (() -> executor.submit (() -> 3));
            Thread.sleep (50);
            assertFalse (blockedSubmission.isDone ());

            final Future<?> shutdown = helpers.submit (() -> {
                executor.shutdown ();
                return null;
            });
            shutdown.get (5, TimeUnit.SECONDS);

            final AFuture<Integer> last = blockedSubmission.get (5, TimeUnit.SECONDS);
            assertEquals (3, last.get (5, TimeUnit.SECONDS));
            assertTrue (periodic.isComplete ());
            assertTrue (queued.isComplete ());
            try {
                assertEquals (2, queued.get ());
            }
            catch (ExecutionException e) {
                assertTrue (e.getCause () instanceof RejectedExecutionException, e.toString ());
            }
        }
        finally {
            helpers.shutdownNow ();
        }

        assertEquals (0, executor.getStatistics ().poolSize);
    }

    @Test
    public void testDefaultMaxSizeFollowsCoreSize () throws Exception {
        final int coreSize = 4 * Runtime.getRuntime ().availableProcessors ();
        final AExecutor executor = new AExecutorBuilder ().withCoreSize (coreSize).build ();
        executors.add (executor);

        final List<AFuture<Integer>> futures = new ArrayList<> ();
        for (int i=0; i<coreSize; i++) {
            futures.add (executor.submit (blockingCallable (i)));
        }
        assertEquals (coreSize, executor.getStatistics ().poolSize);

        release.countDown ();
        for (int i=0; i<coreSize; i++) {
            assertEquals (i, futures.get (i).get (5, TimeUnit.SECONDS));
        }
    }

    @Test
    public void testCallableWithParams () throws Exception {
        final AExecutor executor = AExecutor.create (1, 1, AExecutorBuilder.FOREVER, 2);
        executors.add (executor);

        final AFuture<Integer> future = executor.submit (ACallable.withParams (String::length, "abcdef", 0));
        assertEquals (6, future.get (5, TimeUnit.SECONDS));
        assertEquals (6, future.get ());
    }

    @Test
    public void testConcurrentCallersReceiveTheSameResult () throws Exception {
        final AExecutor executor = newExecutor (1, 1, AExecutorBuilder.FOREVER, 1, ABlockingQueueStrategy.Condition);
        final Object result = new Object ();
        final AFuture<Object> future = executor.submit (() -> {
            release.await ();
            return result;
        });

        final ExecutorService callers = Executors.newFixedThreadPool (4);
        try {
            final List<Future<Object>> results = new ArrayList<> ();
            for (int i=0; i<4; i++) {
                results.add (callers.submit (() -> future.get ()));
            }
            release.countDown ();
            for (Future<Object> r: results) {
                assertSame (result, r.get (5, TimeUnit.SECONDS));
            }
        }
        finally {
            callers.shutdownNow ();
        }
    }

    @Test
    public void testInvalidConfiguration () {
        assertThrows (IllegalArgumentException.class, () -> new AExecutorBuilder ().withCoreSize (4).withMaxSize (2).build ());
        assertThrows (IllegalArgumentException.class, () -> new AExecutorBuilder ().withKeepAliveMillis (0).build ());
        assertThrows (IllegalArgumentException.class, () -> new AExecutorBuilder ().withQueueCapacity (0).build ());
        assertThrows (IllegalArgumentException.class, () -> ACallable.periodic (() -> 1, 0));
        assertThrows (IllegalArgumentException.class, () -> ACallable.withParams (x -> x, 1, -5));
    }
}
