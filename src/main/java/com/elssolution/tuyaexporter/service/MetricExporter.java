package com.elssolution.tuyaexporter.service;

import com.elssolution.tuyaexporter.domain.BatteryState;
import com.elssolution.tuyaexporter.domain.DeviceStatus;
import com.elssolution.tuyaexporter.domain.Reading;
import io.prometheus.client.Collector;
import io.prometheus.client.GaugeMetricFamily;
import io.prometheus.client.exporter.common.TextFormat;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * Prometheus view of the {@link MetricStore}. Nothing is cached between scrapes:
 * each {@link #render()} takes a fresh snapshot and computes data age against the clock.
 */
@Component
public class MetricExporter extends Collector {

    static final String TEMPERATURE = "tuya_sensor_temperature_celsius";
    static final String HUMIDITY = "tuya_sensor_relative_humidity_percent";
    static final String DATA_AGE = "tuya_data_age_seconds";
    static final String BATTERY = "tuya_battery_state";
    static final String LABEL_DEVICE = "device";

    private final MetricStore store;
    private final Clock clock;

    public MetricExporter(MetricStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /** Text exposition format 0.0.4. */
    public String render() {
        StringWriter out = new StringWriter();
        try {
            TextFormat.write004(out, Collections.enumeration(collect()));
        } catch (IOException e) {
            throw new UncheckedIOException(e); // StringWriter doesn't do I/O
        }
        return out.toString();
    }

    public String contentType() {
        return TextFormat.CONTENT_TYPE_004;
    }

    @Override
    public List<MetricFamilySamples> collect() {
        GaugeMetricFamily temperature = temperatureFamily();
        GaugeMetricFamily humidity = humidityFamily();
        GaugeMetricFamily age = dataAgeFamily();
        GaugeMetricFamily battery = batteryFamily();

        Instant now = clock.instant();
        for (DeviceStatus status : store.snapshot()) {
            Reading r = status.getLatest();
            if (r == null) continue; // no successful fetch yet → no series

            List<String> labels = List.of(status.getDevice().name());
            if (r.temperatureCelsius() != null) temperature.addMetric(labels, r.temperatureCelsius());
            if (r.humidityPercent() != null) humidity.addMetric(labels, r.humidityPercent());
            age.addMetric(labels, dataAgeSeconds(r, now));
            for (BatteryState s : BatteryState.values()) {
                battery.addMetric(List.of(status.getDevice().name(), s.label()), s == r.batteryState() ? 1 : 0);
            }
        }
        return List.of(temperature, humidity, age, battery);
    }

    /** Seconds since the platform observed the reading; 0 if the device clock is ahead of ours. */
    static double dataAgeSeconds(Reading r, Instant now) {
        long ms = Duration.between(r.observedAt(), now).toMillis();
        return Math.max(0, ms) / 1000.0;
    }

    private static GaugeMetricFamily temperatureFamily() {
        return new GaugeMetricFamily(TEMPERATURE, "Current temperature", List.of(LABEL_DEVICE));
    }

    private static GaugeMetricFamily humidityFamily() {
        return new GaugeMetricFamily(HUMIDITY, "Relative humidity", List.of(LABEL_DEVICE));
    }

    private static GaugeMetricFamily dataAgeFamily() {
        return new GaugeMetricFamily(DATA_AGE, "Data age for each sensor", List.of(LABEL_DEVICE));
    }

    private static GaugeMetricFamily batteryFamily() {
        return new GaugeMetricFamily(BATTERY, "Tuya Battery State", List.of(LABEL_DEVICE, BATTERY));
    }
}
