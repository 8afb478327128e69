package com.elssolution.tuyaexporter.service;

import com.elssolution.tuyaexporter.domain.Device;
import com.elssolution.tuyaexporter.domain.DeviceStatus;
import com.elssolution.tuyaexporter.domain.FetchOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Latest status per registered device.
 *
 * Entries are immutable {@link DeviceStatus} values replaced under the write lock;
 * {@link #snapshot()} copies them under the read lock. The PollScheduler is the only writer.
 */
@Slf4j
@Component
public class MetricStore {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, DeviceStatus> entries = new LinkedHashMap<>(); // registry order
    private boolean sealed = false; // guarded by lock

    public MetricStore(DeviceRegistry registry) {
        for (Device d : registry.list()) {
            entries.put(d.id(), DeviceStatus.initial(d));
        }
    }

    /**
     * Applies one fetch outcome to a device entry.
     *
     * @return false if the store is sealed and the update was dropped
     * @throws IllegalArgumentException for a device id that is not registered
     */
    public boolean update(String deviceId, FetchOutcome outcome) {
        lock.writeLock().lock();
        try {
            DeviceStatus current = entries.get(deviceId);
            if (current == null) {
                throw new IllegalArgumentException("Unknown device id: " + deviceId);
            }
            if (sealed) {
                log.debug("store_sealed: dropping update for {}", deviceId);
                return false;
            }
            entries.put(deviceId, current.apply(outcome));
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Point-in-time copy of all entries, in registry order. */
    public List<DeviceStatus> snapshot() {
        lock.readLock().lock();
        try {
            return List.copyOf(entries.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /** After this call every {@link #update} is a no-op. Used on shutdown. */
    public void seal() {
        lock.writeLock().lock();
        try {
            sealed = true;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
