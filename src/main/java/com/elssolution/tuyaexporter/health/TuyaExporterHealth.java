package com.elssolution.tuyaexporter.health;

import com.elssolution.tuyaexporter.service.StatusService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/** UP once every device has data and none is stuck failing. */
@Component
public class TuyaExporterHealth implements HealthIndicator {
    private final StatusService status;
    private final int maxConsecutiveFailures;

    public TuyaExporterHealth(StatusService status,
                              @Value("${tuya.health.maxConsecutiveFailures:5}") int maxConsecutiveFailures) {
        this.status = status;
        this.maxConsecutiveFailures = Math.max(1, maxConsecutiveFailures);
    }

    @Override public Health health() {
        var devices = status.buildStatusView();
        boolean ok = devices.stream().allMatch(d ->
                d.isHasReading() && d.getConsecutiveFailures() < maxConsecutiveFailures);

        Health.Builder b = (ok ? Health.up() : Health.down());
        for (var d : devices) {
            b.withDetail(d.getName(), d.getLastErrorKind() == null
                    ? "age " + d.getDataAgeHuman()
                    : "age " + d.getDataAgeHuman() + ", " + d.getConsecutiveFailures() + "x " + d.getLastErrorKind());
        }
        return b.build();
    }
}
