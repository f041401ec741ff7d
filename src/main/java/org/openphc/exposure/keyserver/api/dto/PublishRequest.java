package org.openphc.exposure.keyserver.api.dto;

import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of POST /v1/publish.
 * Key count is deliberately not constrained here; the publish pipeline reports empty and oversized batches.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishRequest {

    @Valid
    private List<ExposureKeyRequest> temporaryExposureKeys;

    private List<String> regions;

    private String appPackageName;

    private String platform;            // "ios" or "android"

    private String deviceVerificationPayload;

    private String verificationPayload;

    private String padding;             // ignored; lets clients hide the real request size
}
