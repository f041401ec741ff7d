package org.openphc.exposure.keyserver.service;

import org.openphc.exposure.keyserver.domain.model.AuthorizedApp;
import org.openphc.exposure.keyserver.domain.model.enums.Platform;

/**
 * Platform-specific check of a device attestation payload (DeviceCheck, SafetyNet).
 * Implementations are contributed as Spring beans.
 */
public interface DeviceAttestationVerifier {

    boolean supports(Platform platform);

    /**
     * @param nonce the canonical request nonce the attestation must have been issued for
     * @return true when the payload is a valid attestation for this app and nonce
     */
    boolean verify(AuthorizedApp app, String deviceVerificationPayload, String nonce);
}
