package org.openphc.exposure.keyserver.api.mapping;

import org.openphc.exposure.keyserver.api.dto.ExposureKeyRequest;
import org.openphc.exposure.keyserver.api.dto.PublishRequest;
import org.openphc.exposure.keyserver.domain.model.ExposureKey;
import org.openphc.exposure.keyserver.domain.model.Publish;
import org.openphc.exposure.keyserver.domain.model.enums.Platform;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Maps the v1 publish wire schema onto the domain values.
 * <pre>
 *   temporaryExposureKeys[].key                -> ExposureKey.key
 *   temporaryExposureKeys[].rollingStartNumber -> ExposureKey.intervalNumber
 *   temporaryExposureKeys[].rollingPeriod      -> ExposureKey.intervalCount
 *   temporaryExposureKeys[].transmissionRisk   -> ExposureKey.transmissionRisk
 *   regions                                    -> Publish.regions (as sent, null entries as "")
 *   appPackageName                             -> Publish.appPackageName
 *   platform                                   -> Publish.platform
 *   deviceVerificationPayload                  -> Publish.deviceVerificationPayload
 *   verificationPayload                        -> Publish.verificationPayload
 *   padding                                    -> (ignored)
 * </pre>
 * Renaming a wire field must not change the domain names, which feed the attestation nonce.
 */
@Component
public class PublishRequestMapper {

    public Publish toPublish(PublishRequest request) {
        Publish.PublishBuilder builder = Publish.builder()
                .appPackageName(request.getAppPackageName())
                .platform(Platform.fromValue(request.getPlatform()))
                .deviceVerificationPayload(request.getDeviceVerificationPayload())
                .verificationPayload(request.getVerificationPayload());

        if (request.getTemporaryExposureKeys() != null) {
            request.getTemporaryExposureKeys().stream()
                    .filter(Objects::nonNull)
                    .map(this::toExposureKey)
                    .forEach(builder::key);
        }
        if (request.getRegions() != null) {
            request.getRegions().stream()
                    .map(r -> r == null ? "" : r)
                    .forEach(builder::region);
        }
        return builder.build();
    }

    private ExposureKey toExposureKey(ExposureKeyRequest key) {
        return ExposureKey.builder()
                .key(key.getKey())
                .intervalNumber(key.getRollingStartNumber())
                .intervalCount(key.getRollingPeriod())
                .transmissionRisk(key.getTransmissionRisk())
                .build();
    }
}
