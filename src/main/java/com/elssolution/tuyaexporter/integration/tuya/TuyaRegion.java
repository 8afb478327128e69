package com.elssolution.tuyaexporter.integration.tuya;

import java.util.Arrays;
import java.util.Locale;

/** Tuya data centers and their OpenAPI hosts. */
public enum TuyaRegion {
    CN("cn", "https://openapi.tuyacn.com"),
    US("us", "https://openapi.tuyaus.com"),
    US_EAST("us-e", "https://openapi-ueaz.tuyaus.com"),
    EU("eu", "https://openapi.tuyaeu.com"),
    EU_WEST("eu-w", "https://openapi-weaz.tuyaeu.com"),
    IN("in", "https://openapi.tuyain.com");

    private final String code;
    private final String baseUri;

    TuyaRegion(String code, String baseUri) {
        this.code = code;
        this.baseUri = baseUri;
    }

    public String code() { return code; }
    public String baseUri() { return baseUri; }

    public static TuyaRegion fromCode(String code) {
        String c = code == null ? "" : code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(r -> r.code.equals(c))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException(
                        "Unknown Tuya region '" + code + "', expected one of "
                                + Arrays.stream(values()).map(TuyaRegion::code).toList()));
    }
}
