package com.elssolution.tuyaexporter.service;

import com.elssolution.tuyaexporter.MutableClock;
import com.elssolution.tuyaexporter.domain.*;
import io.prometheus.client.Collector.MetricFamilySamples.Sample;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MetricExporterTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private final DeviceRegistry registry = new DeviceRegistry("a1=Kitchen,b2=Bedroom");
    private final MetricStore store = new MetricStore(registry);
    private final MutableClock clock = new MutableClock(T0);
    private final MetricExporter exporter = new MetricExporter(store, clock);

    private List<Sample> samples(String family) {
        return exporter.collect().stream()
                .filter(f -> f.name.equals(family))
                .flatMap(f -> f.samples.stream())
                .toList();
    }

    @Test
    void empty_store_renders_headers_only() {
        String text = exporter.render();
        assertThat(text).contains("# TYPE tuya_sensor_temperature_celsius gauge");
        assertThat(text).contains("# TYPE tuya_data_age_seconds gauge");
        assertThat(text).contains("# TYPE tuya_battery_state gauge");
        assertThat(text).doesNotContain("device=");
        assertThat(exporter.collect()).allSatisfy(f -> assertThat(f.samples).isEmpty());
    }

    @Test
    void device_without_reading_has_no_series() {
        store.update("a1", FetchOutcome.success(new Reading(21.5, 45.0, BatteryState.HIGH, T0, T0)));

        List<Sample> all = exporter.collect().stream().flatMap(f -> f.samples.stream()).toList();
        assertThat(all).isNotEmpty();
        assertThat(all).allSatisfy(s -> assertThat(s.labelValues.get(0)).isEqualTo("Kitchen"));
        assertThat(exporter.render()).doesNotContain("Bedroom");
    }

    @Test
    void absent_fields_emit_no_series() {
        store.update("a1", FetchOutcome.success(new Reading(21.5, null, BatteryState.LOW, T0, T0)));
        store.update("b2", FetchOutcome.success(new Reading(null, 60.0, BatteryState.LOW, T0, T0)));

        assertThat(samples(MetricExporter.TEMPERATURE)).extracting(s -> s.labelValues.get(0)).containsExactly("Kitchen");
        assertThat(samples(MetricExporter.HUMIDITY)).extracting(s -> s.labelValues.get(0)).containsExactly("Bedroom");
        assertThat(samples(MetricExporter.DATA_AGE)).hasSize(2);
        assertThat(samples(MetricExporter.BATTERY)).hasSize(8);
    }

    @Test
    void values_and_labels_rendered() {
        store.update("a1", FetchOutcome.success(new Reading(21.5, 45.0, BatteryState.HIGH, T0, T0)));

        assertThat(samples(MetricExporter.TEMPERATURE).get(0).value).isEqualTo(21.5);
        assertThat(samples(MetricExporter.HUMIDITY).get(0).value).isEqualTo(45.0);
        assertThat(samples(MetricExporter.TEMPERATURE).get(0).labelNames).containsExactly("device");

        String text = exporter.render();
        assertThat(text).contains("tuya_sensor_temperature_celsius{device=\"Kitchen\",} 21.5");
        assertThat(text).contains("tuya_battery_state{device=\"Kitchen\",tuya_battery_state=\"high\",} 1.0");
    }

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = {"unknown", "low", "middle", "high", "bogus", ""})
    void battery_state_is_one_hot(String raw) {
        BatteryState expected = BatteryState.fromRaw(raw);
        store.update("a1", FetchOutcome.success(new Reading(20.0, 40.0, expected, T0, T0)));

        Map<String, Double> byState = samples(MetricExporter.BATTERY).stream()
                .collect(Collectors.toMap(s -> s.labelValues.get(1), s -> s.value));

        assertThat(byState).containsOnlyKeys("unknown", "low", "middle", "high");
        assertThat(byState.values().stream().filter(v -> v == 1.0)).hasSize(1);
        assertThat(byState.values().stream().filter(v -> v == 0.0)).hasSize(3);
        assertThat(byState.get(expected.label())).isEqualTo(1.0);
    }

    @Test
    void data_age_is_computed_at_render_time() {
        Instant observed = T0.minusSeconds(30);
        store.update("a1", FetchOutcome.success(new Reading(20.0, 40.0, BatteryState.HIGH, observed, T0)));

        assertThat(samples(MetricExporter.DATA_AGE).get(0).value).isCloseTo(30.0, within(0.001));

        clock.advance(Duration.ofMillis(12_500));
        double later = samples(MetricExporter.DATA_AGE).get(0).value;
        assertThat(later).isCloseTo(42.5, within(0.001));

        clock.advance(Duration.ofSeconds(1));
        assertThat(samples(MetricExporter.DATA_AGE).get(0).value).isGreaterThanOrEqualTo(later);
    }

    @Test
    void data_age_never_negative() {
        Instant future = T0.plusSeconds(90); // device clock ahead of ours
        store.update("a1", FetchOutcome.success(new Reading(20.0, 40.0, BatteryState.HIGH, future, T0)));

        assertThat(samples(MetricExporter.DATA_AGE).get(0).value).isZero();
    }

    @Test
    void families_in_fixed_order() {
        assertThat(exporter.collect()).extracting(f -> f.name).containsExactly(
                MetricExporter.TEMPERATURE, MetricExporter.HUMIDITY, MetricExporter.DATA_AGE, MetricExporter.BATTERY);
        assertThat(exporter.contentType()).startsWith("text/plain; version=0.0.4");
    }

    @Test
    void stale_reading_still_exported_after_failure() {
        store.update("a1", FetchOutcome.success(new Reading(20.0, 40.0, BatteryState.HIGH, T0, T0)));
        store.update("a1", FetchOutcome.failure(new FetchError(FetchException.Kind.NETWORK, "down", T0)));
        clock.advance(Duration.ofMinutes(5));

        assertThat(samples(MetricExporter.TEMPERATURE).get(0).value).isEqualTo(20.0);
        assertThat(samples(MetricExporter.DATA_AGE).get(0).value).isCloseTo(300.0, within(0.001));
    }
}
