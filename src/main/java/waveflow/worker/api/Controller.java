package waveflow.worker.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import waveflow.worker.util.Json;

import java.util.Map;

/**
 * One read-only status endpoint of the worker (health, counters).
 * Endpoints never touch the queue or storage beyond probing them, and always answer with JSON.
 */
public interface Controller {

    /**
     * @param path request path without the query string
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Build the response. Runs on a Netty event loop thread, so it must not block
     * longer than a probe call.
     */
    ControllerResponse handle(FullHttpRequest req, String path);

    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body) {

        private static final String JSON = "application/json";

        public static ControllerResponse json(String body) {
            return json(HttpResponseStatus.OK, body);
        }

        /** JSON body with an explicit status, e.g. 503 for a failed probe. */
        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, JSON, body);
        }

        public static ControllerResponse error(String message) {
            String body;
            try {
                body = Json.mapper().writeValueAsString(Map.of("error", message == null ? "" : message));
            } catch (JsonProcessingException e) {
                body = "{\"error\":\"internal\"}";
            }
            return new ControllerResponse(HttpResponseStatus.INTERNAL_SERVER_ERROR, JSON, body);
        }
    }
}
