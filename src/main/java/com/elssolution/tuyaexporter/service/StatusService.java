package com.elssolution.tuyaexporter.service;

import com.elssolution.tuyaexporter.domain.DeviceStatus;
import com.elssolution.tuyaexporter.domain.FetchError;
import com.elssolution.tuyaexporter.domain.Reading;
import lombok.Builder;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/** Human/JSON view of the store for /status and the health indicator. */
@Component
public class StatusService {

    private final MetricStore store;
    private final Clock clock;

    public StatusService(MetricStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public List<DeviceView> buildStatusView() {
        Instant now = clock.instant();
        return store.snapshot().stream().map(s -> toView(s, now)).toList();
    }

    private static DeviceView toView(DeviceStatus s, Instant now) {
        Reading r = s.getLatest();
        FetchError e = s.getLastError();
        double ageSec = (r == null) ? -1 : MetricExporter.dataAgeSeconds(r, now);
        return DeviceView.builder()
                .deviceId(s.getDevice().id())
                .name(s.getDevice().name())
                .hasReading(r != null)
                .temperatureCelsius(r == null ? null : r.temperatureCelsius())
                .humidityPercent(r == null ? null : r.humidityPercent())
                .batteryState(r == null ? null : r.batteryState().label())
                .observedAt(r == null ? null : r.observedAt())
                .dataAgeSeconds(ageSec)
                .dataAgeHuman(humanAge(ageSec))
                .consecutiveFailures(s.getConsecutiveFailures())
                .lastErrorKind(e == null ? null : e.kind().name())
                .lastErrorMessage(e == null ? null : e.message())
                .lastErrorAt(e == null ? null : e.occurredAt())
                .build();
    }

    static String humanAge(double ageSec) {
        if (ageSec < 0) return "-";
        long s = (long) ageSec;
        if (s < 60) return s + " s";
        long m = s / 60;
        long remS = s % 60;
        if (m < 60) return m + " min " + remS + " s";
        return (m / 60) + " h " + (m % 60) + " min";
    }

    @Value @Builder
    public static class DeviceView {
        String deviceId;
        String name;
        boolean hasReading;
        Double temperatureCelsius;
        Double humidityPercent;
        String batteryState;
        Instant observedAt;
        double dataAgeSeconds;   // -1 until the first reading
        String dataAgeHuman;
        int consecutiveFailures;
        String lastErrorKind;
        String lastErrorMessage;
        Instant lastErrorAt;
    }
}
