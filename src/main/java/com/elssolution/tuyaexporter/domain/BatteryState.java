package com.elssolution.tuyaexporter.domain;

import java.util.Locale;

public enum BatteryState {
    UNKNOWN, LOW, MIDDLE, HIGH;

    /** Label value as reported by Tuya and exported to Prometheus. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Never fails: anything we don't recognise is UNKNOWN. */
    public static BatteryState fromRaw(String raw) {
        if (raw == null) return UNKNOWN;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "low" -> LOW;
            case "middle" -> MIDDLE;
            case "high" -> HIGH;
            default -> UNKNOWN;
        };
    }
}
