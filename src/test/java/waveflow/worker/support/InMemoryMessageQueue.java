package waveflow.worker.support;

import waveflow.worker.queue.MessageQueue;
import waveflow.worker.queue.QueueException;
import waveflow.worker.queue.QueueMessage;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Queue fake: returns pending messages one receive at a time, never blocks.
 */
public class InMemoryMessageQueue implements MessageQueue {

    private final Deque<QueueMessage> pending = new ArrayDeque<>();
    private final List<String> deleted = new ArrayList<>();
    private final Map<String, Duration> visibilityChanges = new LinkedHashMap<>();
    private final AtomicInteger ids = new AtomicInteger();

    public volatile int failNextReceives;
    public volatile boolean unavailable;
    /** Thrown once by the next receive, ahead of any broker failure. */
    public volatile RuntimeException nextReceiveFailure;
    public volatile Error nextReceiveError;

    public synchronized QueueMessage offer(String body) {
        return offer(body, 1);
    }

    public synchronized QueueMessage offer(String body, int receiveCount) {
        String id = "msg-" + ids.incrementAndGet();
        QueueMessage message = new QueueMessage(id, "receipt-" + id, body, receiveCount);
        pending.add(message);
        return message;
    }

    public synchronized List<String> deleted() {
        return List.copyOf(deleted);
    }

    public synchronized Map<String, Duration> visibilityChanges() {
        return Map.copyOf(visibilityChanges);
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    @Override
    public synchronized List<QueueMessage> receive(int maxMessages, Duration wait, Duration visibility)
            throws QueueException {
        if (nextReceiveError != null) {
            Error error = nextReceiveError;
            nextReceiveError = null;
            throw error;
        }
        if (nextReceiveFailure != null) {
            RuntimeException failure = nextReceiveFailure;
            nextReceiveFailure = null;
            throw failure;
        }
        if (failNextReceives > 0) {
            failNextReceives--;
            throw new QueueException("broker unavailable", null);
        }
        List<QueueMessage> batch = new ArrayList<>();
        while (batch.size() < maxMessages && !pending.isEmpty()) {
            batch.add(pending.poll());
        }
        return batch;
    }

    @Override
    public synchronized void delete(QueueMessage message) {
        deleted.add(message.messageId());
    }

    @Override
    public synchronized void changeVisibility(QueueMessage message, Duration visibility) {
        visibilityChanges.put(message.messageId(), visibility);
    }

    @Override
    public void probe() throws QueueException {
        if (unavailable) {
            throw new QueueException("queue offline", null);
        }
    }
}
