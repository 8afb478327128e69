package com.elssolution.tuyaexporter.domain;

import lombok.Getter;

/** A failed telemetry fetch for one device, classified for the store and the logs. */
@Getter
public class FetchException extends Exception {

    public enum Kind { AUTH, NETWORK, NOT_FOUND, MALFORMED_RESPONSE, RATE_LIMITED }

    private final String deviceId;
    private final Kind kind;

    public FetchException(String deviceId, Kind kind, String message) {
        this(deviceId, kind, message, null);
    }

    public FetchException(String deviceId, Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.deviceId = deviceId;
        this.kind = kind;
    }
}
