package org.openphc.exposure.keyserver.api.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openphc.exposure.keyserver.api.dto.ApiResponse;
import org.openphc.exposure.keyserver.api.dto.PublishRequest;
import org.openphc.exposure.keyserver.api.dto.PublishResponse;
import org.openphc.exposure.keyserver.api.mapping.PublishRequestMapper;
import org.openphc.exposure.keyserver.domain.model.Publish;
import org.openphc.exposure.keyserver.service.PublishService;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * POST /v1/publish — diagnosis key upload from mobile clients.
 */
@RestController
@RequestMapping("/v1/publish")
@RequiredArgsConstructor
@Slf4j
public class PublishController {

    private final PublishService publishService;
    private final PublishRequestMapper publishRequestMapper;

    @PostMapping
    public ResponseEntity<ApiResponse<PublishResponse>> publish(
            @Valid @RequestBody PublishRequest request,
            @RequestHeader(value = "X-Correlation-Id", required = false) String correlationId) {

        Publish publish = publishRequestMapper.toPublish(request);
        if (correlationId != null) {
            MDC.put("correlationId", correlationId);
        }
        MDC.put("appPackageName", publish.getAppPackageName());
        MDC.put("platform", publish.getPlatform().name());

        try {
            log.info("Received publish: app={}, platform={}, keys={}, regions={}",
                    publish.getAppPackageName(), publish.getPlatform(),
                    publish.getKeys().size(), publish.getRegions());

            PublishResponse response = publishService.publish(publish);
            return ResponseEntity.ok(ApiResponse.success(response));
        } finally {
            MDC.clear();
        }
    }
}
