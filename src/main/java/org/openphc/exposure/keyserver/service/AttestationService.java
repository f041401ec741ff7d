package org.openphc.exposure.keyserver.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openphc.exposure.keyserver.api.exception.AttestationFailedException;
import org.openphc.exposure.keyserver.domain.model.AuthorizedApp;
import org.openphc.exposure.keyserver.domain.model.Publish;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Dispatches the device attestation of a publish to the verifier for its platform. Fails closed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AttestationService {

    private final List<DeviceAttestationVerifier> verifiers;

    public void verify(AuthorizedApp app, Publish publish, String nonce) {
        if (app.isAttestationDisabled()) {
            log.debug("Attestation disabled for app={}", app.getAppPackageName());
            return;
        }

        DeviceAttestationVerifier verifier = verifiers.stream()
                .filter(v -> v.supports(publish.getPlatform()))
                .findFirst()
                .orElseThrow(() -> new AttestationFailedException(
                        "no attestation verifier available for platform " + publish.getPlatform()));

        boolean verified;
        try {
            verified = verifier.verify(app, publish.getDeviceVerificationPayload(), nonce);
        } catch (RuntimeException e) {
            throw new AttestationFailedException("device attestation could not be checked: " + e.getMessage(), e);
        }
        if (!verified) {
            log.warn("Device attestation rejected for app={}, platform={}",
                    app.getAppPackageName(), publish.getPlatform());
            throw new AttestationFailedException("unable to verify device attestation");
        }
    }
}
