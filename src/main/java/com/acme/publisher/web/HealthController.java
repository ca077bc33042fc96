package com.acme.publisher.web;

import com.acme.publisher.relay.PublishHealth;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import java.util.LinkedHashMap;
import java.util.Map;

@Controller("/health")
public class HealthController {
    private final PublishHealth health;

    public HealthController(PublishHealth health) {
        this.health = health;
    }

    @Get("/publisher")
    public HttpResponse<Map<String, Object>> publisher() {
        boolean healthy = health.isHealthy();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("healthy", healthy);
        body.put("consecutiveErrors", health.consecutiveErrors());
        health.lastError().ifPresent(err -> body.put("error", err));
        return HttpResponse.<Map<String, Object>>status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }
}
