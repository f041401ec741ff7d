package org.openphc.exposure.keyserver.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * One temporary exposure key as reported by a device.
 * {@code key} is kept in its transport (base64) form; decoding happens during transformation.
 */
@Value
@Builder
public class ExposureKey {

    String key;
    int intervalNumber;
    int intervalCount;
    int transmissionRisk;

    @Override
    public String toString() {
        return "ExposureKey(intervalNumber=" + intervalNumber
                + ", intervalCount=" + intervalCount
                + ", transmissionRisk=" + transmissionRisk + ")";
    }
}
