package org.openphc.exposure.keyserver.api.mapping;

import org.junit.jupiter.api.Test;
import org.openphc.exposure.keyserver.api.dto.ExposureKeyRequest;
import org.openphc.exposure.keyserver.api.dto.PublishRequest;
import org.openphc.exposure.keyserver.domain.model.ExposureKey;
import org.openphc.exposure.keyserver.domain.model.Publish;
import org.openphc.exposure.keyserver.domain.model.enums.Platform;
import org.openphc.exposure.keyserver.publish.PublishCanonicalizer;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PublishRequestMapper.
 */
class PublishRequestMapperTest {

    private final PublishRequestMapper mapper = new PublishRequestMapper();

    @Test
    void shouldMapWireFieldsToDomain() {
        PublishRequest request = PublishRequest.builder()
                .temporaryExposureKeys(List.of(ExposureKeyRequest.builder()
                        .key("AAAAAAAAAAAAAAAAAAAAAA==")
                        .rollingStartNumber(2704000)
                        .rollingPeriod(144)
                        .transmissionRisk(4)
                        .build()))
                .regions(List.of("us"))
                .appPackageName("com.example.tracer")
                .platform("android")
                .deviceVerificationPayload("attestation")
                .verificationPayload("cert")
                .padding("xxxxxxxx")
                .build();

        Publish publish = mapper.toPublish(request);

        assertEquals(1, publish.getKeys().size());
        ExposureKey key = publish.getKeys().get(0);
        assertEquals("AAAAAAAAAAAAAAAAAAAAAA==", key.getKey());
        assertEquals(2704000, key.getIntervalNumber());
        assertEquals(144, key.getIntervalCount());
        assertEquals(4, key.getTransmissionRisk());
        assertEquals(List.of("us"), publish.getRegions());
        assertEquals("com.example.tracer", publish.getAppPackageName());
        assertEquals(Platform.ANDROID, publish.getPlatform());
        assertEquals("attestation", publish.getDeviceVerificationPayload());
        assertEquals("cert", publish.getVerificationPayload());
    }

    @Test
    void shouldMapMissingListsToEmpty() {
        Publish publish = mapper.toPublish(PublishRequest.builder().appPackageName("app").build());

        assertTrue(publish.getKeys().isEmpty());
        assertTrue(publish.getRegions().isEmpty());
        assertEquals(Platform.UNKNOWN, publish.getPlatform());
    }

    @Test
    void shouldKeepEmptyRegionsSoTheyReachTheNonce() {
        Publish publish = mapper.toPublish(PublishRequest.builder()
                .appPackageName("app")
                .regions(Arrays.asList("US", "", null))
                .verificationPayload("v")
                .build());

        assertEquals(List.of("US", "", ""), publish.getRegions());
        assertEquals("app||,,US|v", PublishCanonicalizer.cleartext(publish));
    }

    @Test
    void shouldMatchCleartextOfSingleEmptyRegion() {
        Publish publish = mapper.toPublish(PublishRequest.builder()
                .appPackageName("app")
                .regions(List.of("US", ""))
                .verificationPayload("v")
                .build());

        assertEquals("app||,US|v", PublishCanonicalizer.cleartext(publish));
    }

    @Test
    void shouldParsePlatformLeniently() {
        assertEquals(Platform.IOS, mapper.toPublish(PublishRequest.builder().platform("iOS").build()).getPlatform());
        assertEquals(Platform.UNKNOWN,
                mapper.toPublish(PublishRequest.builder().platform("web").build()).getPlatform());
    }
}
