package waveflow.worker.consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import waveflow.worker.dispatch.DecodeResult;
import waveflow.worker.dispatch.MessageDecoder;
import waveflow.worker.dispatch.TaskRouter;
import waveflow.worker.executor.ExecutionReport;
import waveflow.worker.executor.TaskExecutor;
import waveflow.worker.executor.TaskHandler;
import waveflow.worker.model.TaskInvocation;
import waveflow.worker.queue.MessageQueue;
import waveflow.worker.queue.QueueException;
import waveflow.worker.queue.QueueMessage;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * One polling loop. Receives a single message at a time and processes it to a
 * final state before polling again.
 * <p>
 * A message is deleted when it is malformed, names an unknown kind, or its
 * invocation succeeded or exhausted its retries. A scheduled retry keeps the
 * message and moves its visibility to the backoff delay, so the broker redelivers it.
 * Poll failures and unexpected runtime failures are retried forever after a fixed pause.
 * Only {@link #stop()} or an {@link Error} ends the loop; an Error is logged and rethrown.
 */
public class QueueConsumer implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(QueueConsumer.class);

    private final String name;
    private final MessageQueue queue;
    private final MessageDecoder decoder;
    private final TaskRouter router;
    private final TaskExecutor executor;
    private final ConsumerStats stats;
    private final Duration pollWait;
    private final Duration visibilityTimeout;
    private final Duration pollErrorBackoff;

    private volatile boolean running = true;

    public QueueConsumer(String name, MessageQueue queue, MessageDecoder decoder, TaskRouter router,
            TaskExecutor executor, ConsumerStats stats, Duration pollWait, Duration visibilityTimeout,
            Duration pollErrorBackoff) {
        this.name = name;
        this.queue = queue;
        this.decoder = decoder;
        this.router = router;
        this.executor = executor;
        this.stats = stats;
        this.pollWait = pollWait;
        this.visibilityTimeout = visibilityTimeout;
        this.pollErrorBackoff = pollErrorBackoff;
    }

    @Override
    public void run() {
        log.info("Consumer {} started (wait {}s, visibility {}s)", name, pollWait.toSeconds(),
                visibilityTimeout.toSeconds());
        try {
            while (running && !Thread.currentThread().isInterrupted()) {
                try {
                    pollOnce();
                } catch (RuntimeException e) {
                    stats.pollErrors.increment();
                    log.error("Consumer {} iteration failed, continuing in {}ms", name,
                            pollErrorBackoff.toMillis(), e);
                    pause(pollErrorBackoff);
                }
            }
        } catch (Error e) {
            running = false;
            log.error("Consumer {} died", name, e);
            throw e;
        }
        log.info("Consumer {} stopped", name);
    }

    /** Stop after the in-flight message, if any, is finished. */
    public void stop() {
        running = false;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * One receive call and the processing of whatever it returned.
     */
    void pollOnce() {
        List<QueueMessage> messages;
        try {
            messages = queue.receive(1, pollWait, visibilityTimeout);
        } catch (QueueException e) {
            stats.pollErrors.increment();
            log.warn("Consumer {} poll failed, retrying in {}s: {}", name, pollErrorBackoff.toSeconds(),
                    e.getMessage());
            pause(pollErrorBackoff);
            return;
        }

        if (messages.isEmpty()) {
            stats.idlePolls.increment();
            return;
        }
        for (QueueMessage message : messages) {
            process(message);
        }
    }

    void process(QueueMessage message) {
        stats.received.increment();
        DecodeResult decoded = decoder.decode(message.body(), message.receiveCount(), message.messageId());

        if (decoded instanceof DecodeResult.Malformed malformed) {
            stats.malformed.increment();
            log.warn("Discarding malformed message {} ({}): {}", message.messageId(), malformed.reason(),
                    malformed.detail());
            acknowledge(message);
            return;
        }

        TaskInvocation invocation = ((DecodeResult.Decoded) decoded).invocation();
        Optional<TaskHandler> handler = router.resolve(invocation.kindName());
        if (handler.isEmpty()) {
            stats.unknownKind.increment();
            log.error("Unknown task kind '{}' in message {} (id={}), deleting. Body: {}", invocation.kindName(),
                    message.messageId(), invocation.id(), message.body());
            acknowledge(message);
            return;
        }

        ExecutionReport report = executor.execute(handler.get(), invocation,
                (next, delay) -> postpone(message, next, delay));

        switch (report.state()) {
            case SUCCEEDED -> {
                stats.succeeded.increment();
                acknowledge(message);
            }
            case EXHAUSTED -> {
                stats.exhausted.increment();
                acknowledge(message);
            }
            case RETRY_SCHEDULED -> stats.retried.increment();
            default -> log.error("Unexpected state {} for message {}", report.state(), message.messageId());
        }
    }

    private void acknowledge(QueueMessage message) {
        try {
            queue.delete(message);
        } catch (QueueException e) {
            log.error("Could not delete message {}, it will be redelivered: {}", message.messageId(),
                    e.getMessage());
        }
    }

    private void postpone(QueueMessage message, TaskInvocation next, Duration delay) {
        try {
            queue.changeVisibility(message, delay);
            log.info("Message {} ({}) will be redelivered as attempt {} in {}s", message.messageId(),
                    next.id(), next.attempt(), delay.toSeconds());
        } catch (QueueException e) {
            log.warn("Could not postpone message {}, it reappears when its lease expires: {}",
                    message.messageId(), e.getMessage());
        }
    }

    private void pause(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }
}
