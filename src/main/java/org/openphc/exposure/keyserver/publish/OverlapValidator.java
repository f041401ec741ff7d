package org.openphc.exposure.keyserver.publish;

import org.openphc.exposure.keyserver.api.exception.PublishValidationException;
import org.openphc.exposure.keyserver.domain.model.Exposure;
import org.openphc.exposure.keyserver.domain.model.enums.PublishErrorKind;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cross-key consistency check for the records of a single publish.
 * <p>
 * Keys may overlap only when they share the same start interval (a device that replaced its key
 * mid-day reports several keys starting at the same rolling period). A key that starts inside the
 * coverage of an earlier key with a different start is a misaligned overlap and rejects the batch.
 */
public final class OverlapValidator {

    static final Comparator<Exposure> BY_INTERVAL = Comparator
            .comparingInt(Exposure::getIntervalNumber)
            .thenComparingInt(Exposure::getIntervalCount);

    private OverlapValidator() {
    }

    /**
     * Scans a private copy of the records sorted by {@code (intervalNumber, intervalCount)}.
     * The input list is not modified.
     *
     * @throws PublishValidationException with {@link PublishErrorKind#MISALIGNED_OVERLAP}
     */
    public static void validate(List<Exposure> exposures) {
        if (exposures.isEmpty()) {
            return;
        }
        List<Exposure> sorted = new ArrayList<>(exposures);
        sorted.sort(BY_INTERVAL);

        int lastInterval = sorted.get(0).getIntervalNumber();
        int nextInterval = sorted.get(0).endInterval();

        for (Exposure exposure : sorted) {
            if (exposure.getIntervalNumber() == lastInterval) {
                nextInterval = exposure.endInterval();
                continue;
            }
            if (exposure.getIntervalNumber() < nextInterval) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("intervalNumber", exposure.getIntervalNumber());
                details.put("previousStart", lastInterval);
                details.put("previousEnd", nextInterval);
                throw new PublishValidationException(PublishErrorKind.MISALIGNED_OVERLAP,
                        String.format("exposure keys have non aligned overlapping intervals. %d overlaps with "
                                        + "previous key that is good from %d to %d.",
                                exposure.getIntervalNumber(), lastInterval, nextInterval),
                        details);
            }
            lastInterval = exposure.getIntervalNumber();
            nextInterval = exposure.endInterval();
        }
    }
}
