package benchmark;

import com.ajjpj.concurrent.exec.api.AExecutor;
import com.ajjpj.concurrent.exec.api.AFuture;
import com.ajjpj.concurrent.exec.impl.AExecutorBuilder;
import com.ajjpj.concurrent.exec.queue.ABlockingQueue;
import com.ajjpj.concurrent.exec.queue.ABlockingQueueStrategy;
import com.ajjpj.concurrent.exec.util.AClock;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;


/**
 * @author arno
 */
@Fork (1)
@Threads (1)
@Warmup (iterations = 3, time = 1)
@Measurement (iterations = 3, time = 3)
@State (Scope.Benchmark)
public class ExecutorBenchmark {
    AExecutor executor;
    ABlockingQueue<Integer> queue;

    @Param ({
            "Semaphore",
            "Condition",
    })
    public String strategy;

    @Setup
    public void setUp() {
        final ABlockingQueueStrategy queueStrategy = ABlockingQueueStrategy.valueOf (strategy);

        executor = new AExecutorBuilder ()
                .withCoreSize (8)
                .withMaxSize (16)
                .withQueueCapacity (16384)
                .withQueueStrategy (queueStrategy)
                .build ();
        queue = queueStrategy.create (1024);
    }

    @TearDown
    public void tearDown() throws InterruptedException {
        executor.shutdown ();

        System.out.println ();
        System.out.println ("---- Executor Statistics ----");
        System.out.println (executor.getStatistics ());
        System.out.println ("-----------------------------");
    }

    @Benchmark
    public void _testSimpleScheduling01() throws InterruptedException {
        final int num = 10_000;
        final CountDownLatch latch = new CountDownLatch (num);

        for (int i=0; i<num; i++) {
            executor.submit (() -> {
                latch.countDown ();
                return null;});
        }
        latch.await ();
    }

    @Benchmark
    @Threads (7)
    public void _testSimpleScheduling07() throws InterruptedException {
        final int num = 10_000;
        final CountDownLatch latch = new CountDownLatch (num);

        for (int i=0; i<num; i++) {
            executor.submit (() -> {
                latch.countDown ();
                return null;});
        }
        latch.await ();
    }

    @Benchmark
    public void testExpensive() throws InterruptedException {
        final int num = 10_000;
        final CountDownLatch latch = new CountDownLatch (num);

        for (int i=0; i<num; i++) {
            executor.submit (() -> {
                Blackhole.consumeCPU (100);
                latch.countDown ();
                return null;
            });
        }
        latch.await ();
    }

    @Benchmark
    public long testFutureRoundTrip() throws InterruptedException, ExecutionException {
        final AFuture<Long> f = executor.submit (() -> 42L);
        return f.get ();
    }

    @Benchmark
    @Group ("queuePingPong")
    @GroupThreads (4)
    public boolean queueProducer() throws InterruptedException {
        // bounded waits: the other side of the group stops at the end of each iteration
        return queue.offer (1, AClock.SYSTEM.deadlineAfterMillis (10));
    }

    @Benchmark
    @Group ("queuePingPong")
    @GroupThreads (4)
    public Integer queueConsumer() throws InterruptedException {
        return queue.poll (AClock.SYSTEM.deadlineAfterMillis (10));
    }
}
