package waveflow.worker.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import waveflow.worker.error.WebhookDeliveryException;

/**
 * Outbound webhook client.
 */
public interface Notifier {

    /**
     * POST the envelope to the endpoint.
     *
     * @return true on a 2xx response
     */
    boolean send(WebhookEndpoint endpoint, WebhookEnvelope envelope);

    /**
     * Send and apply the endpoint's failure policy: a failed critical endpoint
     * raises, any other failure is logged.
     */
    default void deliver(WebhookEndpoint endpoint, WebhookEnvelope envelope) throws WebhookDeliveryException {
        if (send(endpoint, envelope)) {
            return;
        }
        if (endpoint.critical()) {
            throw new WebhookDeliveryException("webhook " + endpoint.suffix() + " failed for job " + envelope.jobId());
        }
        Logger log = LoggerFactory.getLogger(Notifier.class);
        log.warn("Webhook {} failed for job {}, continuing", endpoint.suffix(), envelope.jobId());
    }
}
