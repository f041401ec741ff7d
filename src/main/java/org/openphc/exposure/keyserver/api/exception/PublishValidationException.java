package org.openphc.exposure.keyserver.api.exception;

import lombok.Getter;
import org.openphc.exposure.keyserver.domain.model.enums.PublishErrorKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown when a publish request, or one of its keys, fails validation.
 * Callers branch on {@link #getKind()}; {@link #getDetails()} carries the offending values
 * and the bound that was violated.
 */
@Getter
public class PublishValidationException extends RuntimeException {

    private final PublishErrorKind kind;
    private final Map<String, Object> details;

    public PublishValidationException(PublishErrorKind kind, String message, Map<String, Object> details) {
        this(kind, message, details, null);
    }

    public PublishValidationException(PublishErrorKind kind, String message, Map<String, Object> details,
                                      Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    /**
     * Wrap a per-key failure so the whole batch is rejected.
     */
    public static PublishValidationException invalidPublishData(PublishValidationException cause) {
        Map<String, Object> details = new LinkedHashMap<>(cause.getDetails());
        details.put("cause", cause.getKind().name());
        return new PublishValidationException(PublishErrorKind.INVALID_PUBLISH_DATA,
                "invalid publish data: " + cause.getMessage(), details, cause);
    }

    /**
     * The kind of the innermost validation failure.
     */
    public PublishErrorKind getRootKind() {
        if (getCause() instanceof PublishValidationException) {
            return ((PublishValidationException) getCause()).getRootKind();
        }
        return kind;
    }
}
