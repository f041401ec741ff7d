package org.openphc.exposure.keyserver.domain.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A validated exposure record, ready to be stored.
 * Only {@link org.openphc.exposure.keyserver.publish.ExposureTransformer} creates these.
 */
@Value
@Builder
public class Exposure {

    @ToString.Exclude
    byte[] exposureKey;
    int transmissionRisk;
    String appPackageName;
    List<String> regions;
    int intervalNumber;
    int intervalCount;
    Instant createdAt;
    boolean localProvenance;
    Long federationSyncId;

    public byte[] getExposureKey() {
        return exposureKey.clone();
    }

    /**
     * First interval after this key stopped being valid.
     */
    public int endInterval() {
        return intervalNumber + intervalCount;
    }
}
