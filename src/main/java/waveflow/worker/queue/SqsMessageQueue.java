package waveflow.worker.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.SqsClientBuilder;
import software.amazon.awssdk.services.sqs.model.ChangeMessageVisibilityRequest;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.GetQueueAttributesRequest;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.QueueAttributeName;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import waveflow.worker.config.WorkerConfig;

import java.net.URI;
import java.time.Duration;
import java.util.List;

/**
 * {@link MessageQueue} backed by an SQS queue.
 */
public class SqsMessageQueue implements MessageQueue, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SqsMessageQueue.class);
    private static final String RECEIVE_COUNT = "ApproximateReceiveCount";

    private final SqsClient sqs;
    private final String queueUrl;

    public SqsMessageQueue(SqsClient sqs, String queueUrl) {
        this.sqs = sqs;
        this.queueUrl = queueUrl;
    }

    public static SqsMessageQueue create(WorkerConfig config) {
        SqsClientBuilder builder = SqsClient.builder().region(Region.of(config.region()));
        if (config.endpointOverride() != null) {
            builder.endpointOverride(URI.create(config.endpointOverride()));
        }
        return new SqsMessageQueue(builder.build(), config.queueUrl());
    }

    @Override
    public List<QueueMessage> receive(int maxMessages, Duration wait, Duration visibility) throws QueueException {
        ReceiveMessageRequest request = ReceiveMessageRequest.builder()
                .queueUrl(queueUrl)
                .maxNumberOfMessages(maxMessages)
                .waitTimeSeconds((int) wait.toSeconds())
                .visibilityTimeout((int) visibility.toSeconds())
                .attributeNamesWithStrings(RECEIVE_COUNT)
                .build();
        try {
            List<Message> messages = sqs.receiveMessage(request).messages();
            return messages.stream().map(SqsMessageQueue::toQueueMessage).toList();
        } catch (SdkException e) {
            throw new QueueException("receive failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void delete(QueueMessage message) throws QueueException {
        try {
            sqs.deleteMessage(DeleteMessageRequest.builder()
                    .queueUrl(queueUrl)
                    .receiptHandle(message.receiptHandle())
                    .build());
            log.debug("Deleted message {}", message.messageId());
        } catch (SdkException e) {
            throw new QueueException("delete failed for " + message.messageId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void changeVisibility(QueueMessage message, Duration visibility) throws QueueException {
        try {
            sqs.changeMessageVisibility(ChangeMessageVisibilityRequest.builder()
                    .queueUrl(queueUrl)
                    .receiptHandle(message.receiptHandle())
                    .visibilityTimeout((int) visibility.toSeconds())
                    .build());
        } catch (SdkException e) {
            throw new QueueException("visibility change failed for " + message.messageId() + ": "
                    + e.getMessage(), e);
        }
    }

    @Override
    public void probe() throws QueueException {
        try {
            sqs.getQueueAttributes(GetQueueAttributesRequest.builder()
                    .queueUrl(queueUrl)
                    .attributeNames(QueueAttributeName.APPROXIMATE_NUMBER_OF_MESSAGES)
                    .build());
        } catch (SdkException e) {
            throw new QueueException("queue unreachable: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        sqs.close();
    }

    private static QueueMessage toQueueMessage(Message message) {
        int receiveCount = 1;
        String raw = message.attributesAsStrings().get(RECEIVE_COUNT);
        if (raw != null) {
            try {
                receiveCount = Integer.parseInt(raw);
            } catch (NumberFormatException e) {
                log.warn("Ignoring malformed {} '{}' on message {}", RECEIVE_COUNT, raw, message.messageId());
            }
        }
        return new QueueMessage(message.messageId(), message.receiptHandle(), message.body(), receiveCount);
    }
}
