package com.elssolution.tuyaexporter.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable store entry. A new instance replaces the old one on every update,
 * so readers only ever see whole entries.
 */
@Value
@Builder(toBuilder = true)
public class DeviceStatus {
    Device device;
    Reading latest;          // null until the first successful fetch
    FetchError lastError;    // null after a success
    int consecutiveFailures;

    public static DeviceStatus initial(Device device) {
        return DeviceStatus.builder().device(device).build();
    }

    public DeviceStatus apply(FetchOutcome outcome) {
        if (outcome.isSuccess()) {
            return toBuilder().latest(outcome.reading()).lastError(null).consecutiveFailures(0).build();
        }
        // keep the last good reading
        return toBuilder().lastError(outcome.error()).consecutiveFailures(consecutiveFailures + 1).build();
    }

    public boolean hasReading() {
        return latest != null;
    }
}
