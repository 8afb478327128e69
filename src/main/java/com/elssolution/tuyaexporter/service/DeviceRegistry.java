package com.elssolution.tuyaexporter.service;

import com.elssolution.tuyaexporter.domain.Device;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Fixed set of monitored devices, read once from {@code tuya.devices}.
 * Entries are comma-separated, each {@code id} or {@code id=Display Name}.
 */
@Slf4j
@Component
public class DeviceRegistry {

    private final List<Device> devices;

    @Autowired
    public DeviceRegistry(@Value("${tuya.devices:}") String devicesCsv) {
        this(parse(devicesCsv));
        log.info("Device registry: {} device(s) {}", devices.size(), devices);
    }

    public DeviceRegistry(List<Device> devices) {
        if (devices == null || devices.isEmpty()) {
            throw new IllegalStateException("No Tuya device configured (set TUYA_DEVICE_ID)");
        }
        Set<String> ids = new HashSet<>();
        Set<String> names = new HashSet<>();
        for (Device d : devices) {
            if (!ids.add(d.id())) {
                throw new IllegalStateException("Duplicate Tuya device id: " + d.id());
            }
            // the name is the only label on exported series; two equal names collide in Prometheus
            if (!names.add(d.name())) {
                throw new IllegalStateException("Duplicate Tuya device name: '" + d.name()
                        + "' (device " + d.id() + "); give each device a distinct id=Name");
            }
        }
        this.devices = List.copyOf(devices);
    }

    public List<Device> list() {
        return devices;
    }

    public int size() {
        return devices.size();
    }

    static List<Device> parse(String csv) {
        if (csv == null || csv.isBlank()) return List.of();
        List<Device> out = new ArrayList<>();
        for (String entry : csv.split(",")) {
            String e = entry.trim();
            if (e.isEmpty()) continue;
            int eq = e.indexOf('=');
            String id = (eq < 0 ? e : e.substring(0, eq)).trim();
            String name = (eq < 0 ? "" : e.substring(eq + 1)).trim();
            if (id.isEmpty()) {
                throw new IllegalStateException("Empty device id in entry '" + e + "'");
            }
            out.add(new Device(id, name.isEmpty() ? id : name));
        }
        return out;
    }
}
