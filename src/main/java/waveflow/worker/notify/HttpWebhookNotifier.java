package waveflow.worker.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import waveflow.worker.util.Json;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link Notifier} over {@link HttpClient}: one synchronous JSON POST per callback.
 */
public class HttpWebhookNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(HttpWebhookNotifier.class);

    private final HttpClient httpClient;
    private final String baseUrl;
    private final Duration timeout;

    public HttpWebhookNotifier(String baseUrl, Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), baseUrl, timeout);
    }

    public HttpWebhookNotifier(HttpClient httpClient, String baseUrl, Duration timeout) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout;
    }

    public String urlFor(WebhookEndpoint endpoint) {
        return baseUrl + "/" + endpoint.suffix();
    }

    @Override
    public boolean send(WebhookEndpoint endpoint, WebhookEnvelope envelope) {
        String url = urlFor(endpoint);
        String body;
        try {
            body = Json.mapper().writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize webhook for job {}: {}", envelope.jobId(), e.getMessage());
            return false;
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            if (status / 100 != 2) {
                log.error("Webhook {} returned HTTP {} for job {}: {}", url, status, envelope.jobId(),
                        response.body());
                return false;
            }
            log.info("Webhook {} delivered for job {} ({})", endpoint.suffix(), envelope.jobId(), envelope.status());
            return true;
        } catch (IOException e) {
            log.error("Webhook {} failed for job {}: {}", url, envelope.jobId(), e.toString());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Webhook {} interrupted for job {}", url, envelope.jobId());
            return false;
        }
    }
}
