package org.openphc.exposure.keyserver.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.openphc.exposure.keyserver.domain.model.enums.Platform;

import java.util.List;

/**
 * A publish submission: a batch of exposure keys plus the identity and attestation
 * data of the submitting application. Immutable once built.
 */
@Value
@Builder
public class Publish {

    @Singular
    List<ExposureKey> keys;

    @Singular
    List<String> regions;

    String appPackageName;
    Platform platform;
    String deviceVerificationPayload;
    String verificationPayload;
}
