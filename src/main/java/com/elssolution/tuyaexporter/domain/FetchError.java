package com.elssolution.tuyaexporter.domain;

import java.time.Instant;

/** What the store remembers about the last failed fetch of a device. */
public record FetchError(FetchException.Kind kind, String message, Instant occurredAt) {

    public static FetchError of(FetchException e, Instant at) {
        return new FetchError(e.getKind(), e.getMessage(), at);
    }
}
