package org.openphc.exposure.keyserver.service;

import org.junit.jupiter.api.Test;
import org.openphc.exposure.keyserver.api.exception.AttestationFailedException;
import org.openphc.exposure.keyserver.domain.model.AuthorizedApp;
import org.openphc.exposure.keyserver.domain.model.Publish;
import org.openphc.exposure.keyserver.domain.model.enums.Platform;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AttestationService.
 */
class AttestationServiceTest {

    /** Records calls and answers with a fixed result. */
    private static final class RecordingVerifier implements DeviceAttestationVerifier {
        private final Platform platform;
        private final boolean result;
        private final List<String> nonces = new ArrayList<>();

        RecordingVerifier(Platform platform, boolean result) {
            this.platform = platform;
            this.result = result;
        }

        @Override
        public boolean supports(Platform platform) {
            return this.platform == platform;
        }

        @Override
        public boolean verify(AuthorizedApp app, String deviceVerificationPayload, String nonce) {
            nonces.add(nonce);
            return result;
        }
    }

    private static AuthorizedApp app(boolean attestationDisabled) {
        return AuthorizedApp.builder()
                .appPackageName("com.example.tracer")
                .platform(Platform.ANDROID)
                .attestationDisabled(attestationDisabled)
                .build();
    }

    private static Publish publish(Platform platform) {
        return Publish.builder()
                .appPackageName("com.example.tracer")
                .platform(platform)
                .deviceVerificationPayload("payload")
                .build();
    }

    @Test
    void shouldSkipVerifiersWhenAttestationDisabled() {
        RecordingVerifier verifier = new RecordingVerifier(Platform.ANDROID, false);
        AttestationService service = new AttestationService(List.of(verifier));

        assertDoesNotThrow(() -> service.verify(app(true), publish(Platform.ANDROID), "nonce"));
        assertTrue(verifier.nonces.isEmpty());
    }

    @Test
    void shouldPassNonceToPlatformVerifier() {
        RecordingVerifier ios = new RecordingVerifier(Platform.IOS, false);
        RecordingVerifier android = new RecordingVerifier(Platform.ANDROID, true);
        AttestationService service = new AttestationService(List.of(ios, android));

        service.verify(app(false), publish(Platform.ANDROID), "nonce-1");

        assertEquals(List.of("nonce-1"), android.nonces);
        assertTrue(ios.nonces.isEmpty());
    }

    @Test
    void shouldFailWhenVerifierRejects() {
        AttestationService service = new AttestationService(List.of(new RecordingVerifier(Platform.IOS, false)));

        assertThrows(AttestationFailedException.class,
                () -> service.verify(app(false), publish(Platform.IOS), "nonce"));
    }

    @Test
    void shouldFailClosedWithoutVerifierForPlatform() {
        AttestationService service = new AttestationService(List.of());

        assertThrows(AttestationFailedException.class,
                () -> service.verify(app(false), publish(Platform.ANDROID), "nonce"));
    }

    @Test
    void shouldWrapVerifierErrors() {
        DeviceAttestationVerifier broken = new DeviceAttestationVerifier() {
            @Override
            public boolean supports(Platform platform) {
                return true;
            }

            @Override
            public boolean verify(AuthorizedApp app, String deviceVerificationPayload, String nonce) {
                throw new IllegalStateException("payload is not a JWS");
            }
        };
        AttestationService service = new AttestationService(List.of(broken));

        AttestationFailedException ex = assertThrows(AttestationFailedException.class,
                () -> service.verify(app(false), publish(Platform.ANDROID), "nonce"));
        assertInstanceOf(IllegalStateException.class, ex.getCause());
    }
}
