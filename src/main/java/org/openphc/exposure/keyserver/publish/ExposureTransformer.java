package org.openphc.exposure.keyserver.publish;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.openphc.exposure.keyserver.api.exception.PublishValidationException;
import org.openphc.exposure.keyserver.domain.model.Exposure;
import org.openphc.exposure.keyserver.domain.model.ExposureKey;
import org.openphc.exposure.keyserver.domain.model.Publish;
import org.openphc.exposure.keyserver.domain.model.enums.PublishErrorKind;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns publish requests into validated {@link Exposure} records.
 * <p>
 * Instances are immutable; build a new one when the publish configuration changes.
 */
@Slf4j
@Getter
public class ExposureTransformer {

    /** Hard ceiling on keys per publish: 21 days of keys. */
    public static final int MAX_KEYS_PER_PUBLISH = 21;

    public static final int KEY_LENGTH = 16;

    public static final int MIN_TRANSMISSION_RISK = 0;
    public static final int MAX_TRANSMISSION_RISK = 8;

    /** 144 ten-minute intervals make a day. */
    public static final int MIN_INTERVAL_COUNT = 1;
    public static final int MAX_INTERVAL_COUNT = 144;

    private final int maxExposureKeys;
    private final Duration maxIntervalStartAge;
    private final Duration truncateWindow;
    /** Disables only the still-valid check. Never enable in production. */
    private final boolean skipKeyDateValidation;

    public ExposureTransformer(int maxExposureKeys, Duration maxIntervalStartAge, Duration truncateWindow,
                               boolean skipKeyDateValidation) {
        if (maxExposureKeys < 1 || maxExposureKeys > MAX_KEYS_PER_PUBLISH) {
            throw new IllegalArgumentException(String.format(
                    "maxExposureKeys must be > 0 and <= %d, got %d", MAX_KEYS_PER_PUBLISH, maxExposureKeys));
        }
        if (maxIntervalStartAge == null || maxIntervalStartAge.isNegative()) {
            throw new IllegalArgumentException("maxIntervalStartAge must be a non-negative duration");
        }
        this.maxExposureKeys = maxExposureKeys;
        this.maxIntervalStartAge = maxIntervalStartAge;
        this.truncateWindow = truncateWindow == null ? Duration.ZERO : truncateWindow;
        this.skipKeyDateValidation = skipKeyDateValidation;
        if (skipKeyDateValidation) {
            log.warn("Key date validation is DISABLED: keys that are still valid will be accepted");
        }
    }

    /**
     * Validates a single key against the acceptance window of its batch and converts it to a record.
     *
     * @param upcasedRegions    regions already upper-cased by the caller
     * @param minIntervalNumber oldest accepted start interval (inclusive)
     * @param maxIntervalNumber interval of the batch time; starts must be strictly before it
     * @throws PublishValidationException on the first violated constraint
     */
    public Exposure transformExposureKey(ExposureKey exposureKey, String appPackageName,
                                         List<String> upcasedRegions, Instant createdAt,
                                         int minIntervalNumber, int maxIntervalNumber) {
        byte[] binKey = decodeKey(exposureKey.getKey());

        if (binKey.length != KEY_LENGTH) {
            throw new PublishValidationException(PublishErrorKind.INVALID_KEY_LENGTH,
                    String.format("invalid key length, %d, must be %d", binKey.length, KEY_LENGTH),
                    details("keyLength", binKey.length, "required", KEY_LENGTH));
        }

        int intervalCount = exposureKey.getIntervalCount();
        if (intervalCount < MIN_INTERVAL_COUNT || intervalCount > MAX_INTERVAL_COUNT) {
            throw new PublishValidationException(PublishErrorKind.INVALID_INTERVAL_COUNT,
                    String.format("invalid interval count, %d, must be >= %d && <= %d",
                            intervalCount, MIN_INTERVAL_COUNT, MAX_INTERVAL_COUNT),
                    details("intervalCount", intervalCount, "min", MIN_INTERVAL_COUNT, "max", MAX_INTERVAL_COUNT));
        }

        int intervalNumber = exposureKey.getIntervalNumber();
        if (intervalNumber < minIntervalNumber) {
            throw new PublishValidationException(PublishErrorKind.INTERVAL_TOO_OLD,
                    String.format("interval number %d is too old, must be >= %d", intervalNumber, minIntervalNumber),
                    details("intervalNumber", intervalNumber, "minIntervalNumber", minIntervalNumber));
        }
        if (intervalNumber >= maxIntervalNumber) {
            throw new PublishValidationException(PublishErrorKind.INTERVAL_IN_FUTURE,
                    String.format("interval number %d is in the future, must be < %d", intervalNumber, maxIntervalNumber),
                    details("intervalNumber", intervalNumber, "maxIntervalNumber", maxIntervalNumber));
        }

        if (!skipKeyDateValidation && (long) intervalNumber + intervalCount > maxIntervalNumber) {
            throw new PublishValidationException(PublishErrorKind.KEY_STILL_VALID,
                    String.format("interval number %d + interval count %d represents a key that is still valid, "
                            + "must end <= %d", intervalNumber, intervalCount, maxIntervalNumber),
                    details("intervalNumber", intervalNumber, "intervalCount", intervalCount,
                            "maxIntervalNumber", maxIntervalNumber));
        }

        int transmissionRisk = exposureKey.getTransmissionRisk();
        if (transmissionRisk < MIN_TRANSMISSION_RISK || transmissionRisk > MAX_TRANSMISSION_RISK) {
            throw new PublishValidationException(PublishErrorKind.INVALID_TRANSMISSION_RISK,
                    String.format("invalid transmission risk: %d, must be >= %d && <= %d",
                            transmissionRisk, MIN_TRANSMISSION_RISK, MAX_TRANSMISSION_RISK),
                    details("transmissionRisk", transmissionRisk,
                            "min", MIN_TRANSMISSION_RISK, "max", MAX_TRANSMISSION_RISK));
        }

        return Exposure.builder()
                .exposureKey(binKey)
                .transmissionRisk(transmissionRisk)
                .appPackageName(appPackageName)
                .regions(upcasedRegions)
                .intervalNumber(intervalNumber)
                .intervalCount(intervalCount)
                .createdAt(createdAt)
                .localProvenance(true)
                .build();
    }

    /**
     * Validates a whole publish and converts every key to a record. All-or-nothing: any failure
     * rejects the batch and no record is returned.
     *
     * @param batchTime reference time of the batch, supplied by the caller
     * @return records in submission order
     * @throws PublishValidationException describing the first failure
     */
    public List<Exposure> transformPublish(Publish publish, Instant batchTime) {
        List<ExposureKey> keys = publish.getKeys() == null ? List.of() : publish.getKeys();
        if (keys.isEmpty()) {
            throw new PublishValidationException(PublishErrorKind.EMPTY_KEY_SET,
                    "no exposure keys in publish request", Map.of());
        }
        if (keys.size() > maxExposureKeys) {
            throw new PublishValidationException(PublishErrorKind.TOO_MANY_KEYS,
                    String.format("too many exposure keys in publish: %d, max of %d is allowed",
                            keys.size(), maxExposureKeys),
                    details("keyCount", keys.size(), "maxExposureKeys", maxExposureKeys));
        }

        Instant createdAt = IntervalClock.truncateWindow(batchTime, truncateWindow);
        int minIntervalNumber = IntervalClock.intervalNumber(batchTime.minus(maxIntervalStartAge));
        int maxIntervalNumber = IntervalClock.intervalNumber(batchTime);

        List<String> upcasedRegions = Regions.upcaseAll(publish.getRegions());

        List<Exposure> exposures = new ArrayList<>(keys.size());
        for (ExposureKey key : keys) {
            try {
                exposures.add(transformExposureKey(key, publish.getAppPackageName(), upcasedRegions, createdAt,
                        minIntervalNumber, maxIntervalNumber));
            } catch (PublishValidationException e) {
                throw PublishValidationException.invalidPublishData(e);
            }
        }

        OverlapValidator.validate(exposures);

        log.debug("Transformed {} keys for app={} window=[{}, {})", exposures.size(),
                publish.getAppPackageName(), minIntervalNumber, maxIntervalNumber);
        return Collections.unmodifiableList(exposures);
    }

    private static byte[] decodeKey(String encoded) {
        if (encoded == null) {
            throw new PublishValidationException(PublishErrorKind.INVALID_KEY_ENCODING,
                    "exposure key is missing", Map.of());
        }
        try {
            return Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException standard) {
            try {
                return Base64.getUrlDecoder().decode(encoded);
            } catch (IllegalArgumentException url) {
                throw new PublishValidationException(PublishErrorKind.INVALID_KEY_ENCODING,
                        "exposure key is not valid base64: " + standard.getMessage(), Map.of(), standard);
            }
        }
    }

    private static Map<String, Object> details(Object... pairs) {
        Map<String, Object> details = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            details.put((String) pairs[i], pairs[i + 1]);
        }
        return details;
    }
}
