package waveflow.worker.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import waveflow.worker.api.Controller;
import waveflow.worker.api.v1.dto.StatsResponse;
import waveflow.worker.consumer.ConsumerStats;
import waveflow.worker.util.Json;

import java.lang.management.ManagementFactory;

/**
 * Consumer counters.
 * GET /api/v1/stats
 */
public class StatsController implements Controller {

    private final ConsumerStats stats;
    private final int pollers;

    public StatsController(ConsumerStats stats, int pollers) {
        this.stats = stats;
        this.pollers = pollers;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/stats".equals(path);
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) {
        StatsResponse response = new StatsResponse(pollers,
                ManagementFactory.getRuntimeMXBean().getUptime() / 1000, stats.snapshot());
        try {
            return ControllerResponse.json(Json.mapper().writeValueAsString(response));
        } catch (JsonProcessingException e) {
            return ControllerResponse.error(e.getOriginalMessage());
        }
    }
}
