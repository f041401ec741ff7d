package org.openphc.exposure.keyserver.domain.model.enums;

/**
 * Closed set of reasons a publish request is rejected by validation.
 */
public enum PublishErrorKind {
    // per key
    INVALID_KEY_ENCODING,
    INVALID_KEY_LENGTH,
    INVALID_INTERVAL_COUNT,
    INTERVAL_TOO_OLD,
    INTERVAL_IN_FUTURE,
    KEY_STILL_VALID,
    INVALID_TRANSMISSION_RISK,

    // per batch
    EMPTY_KEY_SET,
    TOO_MANY_KEYS,
    INVALID_PUBLISH_DATA,
    MISALIGNED_OVERLAP
}
