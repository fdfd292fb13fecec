package waveflow.worker.error;

/**
 * A webhook whose delivery matters to the task outcome was not accepted.
 */
public class WebhookDeliveryException extends TaskException {

    public WebhookDeliveryException(String message) {
        super("WEBHOOK_FAILED", true, message);
    }

    public WebhookDeliveryException(String message, Throwable cause) {
        super("WEBHOOK_FAILED", true, message, cause);
    }
}
