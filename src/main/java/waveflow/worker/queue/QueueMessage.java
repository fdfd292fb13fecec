package waveflow.worker.queue;

/**
 * One received message with its lease handle.
 *
 * @param receiveCount how many times the broker has delivered this message, starting at 1
 */
public record QueueMessage(String messageId, String receiptHandle, String body, int receiveCount) {
}
