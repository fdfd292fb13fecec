package waveflow.worker.api.v1;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import waveflow.worker.api.Controller;
import waveflow.worker.health.HealthProbe;
import waveflow.worker.health.HealthReport;
import waveflow.worker.util.Json;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final HealthProbe probe;

    public HealthController(HealthProbe probe) {
        this.probe = probe;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) {
        try {
            HealthReport report = probe.check();
            HttpResponseStatus status = report.healthy() ? HttpResponseStatus.OK
                    : HttpResponseStatus.SERVICE_UNAVAILABLE;
            return ControllerResponse.json(status, Json.mapper().writeValueAsString(report));
        } catch (Exception e) {
            log.error("Health check failed", e);
            return ControllerResponse.error("health check failed");
        }
    }
}
