package waveflow.worker.queue;

import java.time.Duration;
import java.util.List;

/**
 * At-least-once message broker as seen by a competing consumer.
 */
public interface MessageQueue {

    /**
     * Long-poll for up to {@code maxMessages}. Returns an empty list when the wait elapses.
     *
     * @param visibility lease during which the received messages are hidden from other consumers
     */
    List<QueueMessage> receive(int maxMessages, Duration wait, Duration visibility) throws QueueException;

    /** Acknowledge: the message will not be delivered again. */
    void delete(QueueMessage message) throws QueueException;

    /** Reset the lease so the message reappears after {@code visibility}. */
    void changeVisibility(QueueMessage message, Duration visibility) throws QueueException;

    /** Connectivity check without consuming messages. */
    void probe() throws QueueException;
}
