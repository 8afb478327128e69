package com.elssolution.tuyaexporter.domain;

import java.util.Objects;

/** A monitored sensor: Tuya device id plus the label used on every exported series. */
public record Device(String id, String name) {
    public Device {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
    }
}
