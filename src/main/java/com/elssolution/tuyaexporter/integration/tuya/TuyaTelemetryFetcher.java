package com.elssolution.tuyaexporter.integration.tuya;

import com.elssolution.tuyaexporter.domain.BatteryState;
import com.elssolution.tuyaexporter.domain.Device;
import com.elssolution.tuyaexporter.domain.FetchException;
import com.elssolution.tuyaexporter.domain.Reading;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns one device's Tuya payload into a {@link Reading}.
 *
 * Every field is optional in the payload; anything missing or unparsable leaves the
 * corresponding Reading field absent (battery: UNKNOWN). No retries: a failing call
 * surfaces as {@link FetchException} and the scheduler tries again next tick.
 */
@Slf4j
@Service
public class TuyaTelemetryFetcher {

    static final Set<String> TEMPERATURE_CODES = Set.of("va_temperature", "temp_current");
    static final Set<String> HUMIDITY_CODES = Set.of("va_humidity", "humidity_value");
    static final String BATTERY_CODE = "battery_state";

    // used when the specification doesn't describe the data point
    static final int DEFAULT_TEMPERATURE_SCALE = 1; // tenths of a degree
    static final int DEFAULT_HUMIDITY_SCALE = 0;

    private final TuyaCloudClient client;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();

    /** deviceId → (code → scale). Filled on first successful specification call. */
    private final Map<String, Map<String, Integer>> scales = new ConcurrentHashMap<>();

    public TuyaTelemetryFetcher(TuyaCloudClient client, Clock clock) {
        this.client = client;
        this.clock = clock;
    }

    public Reading fetch(Device device) throws FetchException {
        JsonNode d = client.getDevice(device.id());
        JsonNode status = d.path("status");
        if (!status.isArray()) {
            throw new FetchException(device.id(), FetchException.Kind.MALFORMED_RESPONSE,
                    "Device payload has no status[] array");
        }
        Map<String, Integer> scale = scalesFor(device.id());
        Instant fetchedAt = clock.instant();

        Double temperature = null;
        Double humidity = null;
        BatteryState battery = BatteryState.UNKNOWN;
        Long newestPointMs = null;

        for (JsonNode entry : status) {
            String code = entry.path("code").asText("");
            JsonNode value = entry.path("value");
            if (TEMPERATURE_CODES.contains(code)) {
                Double v = scaled(value, scale.getOrDefault(code, DEFAULT_TEMPERATURE_SCALE));
                if (v != null) temperature = v;
            } else if (HUMIDITY_CODES.contains(code)) {
                Double v = scaled(value, scale.getOrDefault(code, DEFAULT_HUMIDITY_SCALE));
                if (v != null) humidity = v;
            } else if (BATTERY_CODE.equals(code)) {
                battery = BatteryState.fromRaw(value.isValueNode() ? value.asText() : null);
            } else {
                continue;
            }
            Long t = epochMs(entry.path("t"));
            if (t != null && (newestPointMs == null || t > newestPointMs)) newestPointMs = t;
        }

        Instant observedAt = observedAt(d, newestPointMs, fetchedAt);
        if (log.isDebugEnabled()) {
            log.debug("tuya_reading device={} temp={} hum={} battery={} observedAt={}",
                    device.id(), temperature, humidity, battery, observedAt);
        }
        return new Reading(temperature, humidity, battery, observedAt, fetchedAt);
    }

    // ===== Scale factors =====

    private Map<String, Integer> scalesFor(String deviceId) throws FetchException {
        Map<String, Integer> cached = scales.get(deviceId);
        if (cached != null) return cached;

        Map<String, Integer> parsed = parseScales(deviceId, client.getSpecification(deviceId));
        log.info("tuya_scales device={} {}", deviceId, parsed);
        Map<String, Integer> prev = scales.putIfAbsent(deviceId, parsed);
        return prev != null ? prev : parsed;
    }

    /** Integer data points carry {@code values} as a JSON string, e.g. {"scale":1,"unit":"℃"}. */
    private Map<String, Integer> parseScales(String deviceId, JsonNode spec) {
        Map<String, Integer> out = new HashMap<>();
        for (JsonNode p : spec.path("status")) {
            String code = p.path("code").asText("");
            if (code.isEmpty() || !"Integer".equalsIgnoreCase(p.path("type").asText(""))) continue;
            JsonNode valuesNode = p.path("values");
            try {
                JsonNode values = valuesNode.isTextual() ? objectMapper.readTree(valuesNode.asText()) : valuesNode;
                JsonNode s = values == null ? null : values.get("scale");
                if (s != null && s.canConvertToInt()) out.put(code, s.asInt());
            } catch (Exception e) {
                log.debug("tuya_spec_values_unparsable device={} code={}: {}", deviceId, code, e.getMessage());
            }
        }
        return Map.copyOf(out);
    }

    // ===== Helpers =====

    /** Reads a numeric value (numbers-as-strings too) and divides by 10^scale. */
    static Double scaled(JsonNode n, int scale) {
        Double raw = num(n);
        if (raw == null) return null;
        return scale == 0 ? raw : raw / Math.pow(10, scale);
    }

    /** Finite numbers only: "NaN" / "Infinity" strings count as absent. */
    private static Double num(JsonNode n) {
        if (n == null) return null;
        double v;
        if (n.isNumber()) {
            v = n.asDouble();
        } else if (n.isTextual()) {
            try { v = Double.parseDouble(n.asText().trim()); } catch (NumberFormatException e) { return null; }
        } else {
            return null;
        }
        return Double.isFinite(v) ? v : null;
    }

    /** Tuya mixes epoch seconds (update_time) and millis (t); anything below 1e11 is seconds. */
    private static Long epochMs(JsonNode n) {
        Double v = num(n);
        if (v == null || v <= 0) return null;
        long l = v.longValue();
        return l < 100_000_000_000L ? l * 1000 : l;
    }

    private static Instant observedAt(JsonNode device, Long newestPointMs, Instant fetchedAt) {
        if (newestPointMs != null) return Instant.ofEpochMilli(newestPointMs);
        Long updateMs = epochMs(device.path("update_time"));
        if (updateMs != null) return Instant.ofEpochMilli(updateMs);
        return fetchedAt;
    }
}
