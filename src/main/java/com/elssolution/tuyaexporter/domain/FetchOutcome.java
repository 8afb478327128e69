package com.elssolution.tuyaexporter.domain;

/** Result of one fetch: exactly one of reading / error is set. */
public record FetchOutcome(Reading reading, FetchError error) {

    public FetchOutcome {
        if ((reading == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of reading/error must be set");
        }
    }

    public static FetchOutcome success(Reading reading) { return new FetchOutcome(reading, null); }
    public static FetchOutcome failure(FetchError error) { return new FetchOutcome(null, error); }

    public boolean isSuccess() { return reading != null; }
}
