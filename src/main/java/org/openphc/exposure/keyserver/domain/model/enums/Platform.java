package org.openphc.exposure.keyserver.domain.model.enums;

import java.util.Locale;

/**
 * Client platform that produced a publish request. Selects the attestation verifier.
 */
public enum Platform {
    IOS,
    ANDROID,
    UNKNOWN;

    public static Platform fromValue(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "ios":
                return IOS;
            case "android":
                return ANDROID;
            default:
                return UNKNOWN;
        }
    }
}
