package org.openphc.exposure.keyserver.api.exception;

import lombok.Getter;

/**
 * Exception thrown when the submitting application is unknown or not allowed to write a region.
 */
@Getter
public class UnauthorizedAppException extends RuntimeException {

    private final String appPackageName;

    public UnauthorizedAppException(String appPackageName, String message) {
        super(message);
        this.appPackageName = appPackageName;
    }
}
