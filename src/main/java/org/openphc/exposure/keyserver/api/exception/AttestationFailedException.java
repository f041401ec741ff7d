package org.openphc.exposure.keyserver.api.exception;

/**
 * Exception thrown when the device attestation for a publish request cannot be verified.
 */
public class AttestationFailedException extends RuntimeException {

    public AttestationFailedException(String message) {
        super(message);
    }

    public AttestationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
