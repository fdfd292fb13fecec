package waveflow.worker.consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;

/**
 * Fixed set of independent pollers, one thread each.
 */
public class ConsumerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConsumerPool.class);

    private final List<QueueConsumer> consumers = new ArrayList<>();
    private final ExecutorService executor;
    private final Duration shutdownGrace;

    private volatile boolean running = false;

    /**
     * @param factory       builds the consumer for poller index {@code i}
     * @param shutdownGrace how long {@link #stop()} waits for in-flight messages
     */
    public ConsumerPool(int pollers, IntFunction<QueueConsumer> factory, Duration shutdownGrace) {
        AtomicInteger threadIndex = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(pollers, r -> {
            Thread t = new Thread(r, "waveflow-poller-" + threadIndex.incrementAndGet());
            t.setDaemon(false);
            t.setUncaughtExceptionHandler((thread, e) ->
                    log.error("Poller thread {} terminated", thread.getName(), e));
            return t;
        });
        for (int i = 0; i < pollers; i++) {
            consumers.add(factory.apply(i));
        }
        this.shutdownGrace = shutdownGrace;
    }

    public synchronized void start() {
        if (running) {
            log.warn("Consumer pool already running");
            return;
        }
        running = true;
        for (QueueConsumer consumer : consumers) {
            executor.execute(consumer);
        }
        log.info("Started {} poller(s)", consumers.size());
    }

    /**
     * Stop polling and wait for in-flight messages to finish.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        consumers.forEach(QueueConsumer::stop);
        executor.shutdown();

        try {
            if (!executor.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
                log.warn("Pollers did not finish within {}s, interrupted", shutdownGrace.toSeconds());
            } else {
                log.info("Pollers stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /** True while started and at least one poller is still looping. */
    public boolean isRunning() {
        return running && alivePollers() > 0;
    }

    public int alivePollers() {
        return (int) consumers.stream().filter(QueueConsumer::isRunning).count();
    }

    @Override
    public void close() {
        stop();
    }
}
