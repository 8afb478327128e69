package com.elssolution.tuyaexporter.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Normalized sensor snapshot for one device.
 *
 * temperatureCelsius / humidityPercent are null when the device does not report them.
 * observedAt is the platform's update time (falls back to fetchedAt), never the poll time.
 */
public record Reading(
        Double temperatureCelsius,
        Double humidityPercent,
        BatteryState batteryState,
        Instant observedAt,
        Instant fetchedAt
) {
    public Reading {
        Objects.requireNonNull(fetchedAt, "fetchedAt");
        if (batteryState == null) batteryState = BatteryState.UNKNOWN;
        if (observedAt == null) observedAt = fetchedAt;
    }
}
