package dev.chatstore.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final OffsetDateTime startTime = OffsetDateTime.now(ZoneOffset.UTC);

    /**
     * Liveness probe. Does not touch the database.
     */
    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> health() {
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        Duration uptime = Duration.between(startTime, now);
        log.debug("health check uptimeSeconds={}", uptime.toSeconds());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "OK");
        body.put("startTime", startTime.toString());
        body.put("currentTime", now.toString());
        body.put("uptime", formatUptime(uptime));
        return body;
    }

    static String formatUptime(Duration uptime) {
        return "%dd %dhrs %dmins %ds".formatted(
                uptime.toDays(),
                uptime.toHoursPart(),
                uptime.toMinutesPart(),
                uptime.toSecondsPart()
        );
    }
}
