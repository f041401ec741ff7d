package org.openphc.exposure.keyserver.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.openphc.exposure.keyserver.api.dto.PublishResponse;
import org.openphc.exposure.keyserver.api.exception.AttestationFailedException;
import org.openphc.exposure.keyserver.api.exception.PublishValidationException;
import org.openphc.exposure.keyserver.api.exception.UnauthorizedAppException;
import org.openphc.exposure.keyserver.domain.model.AuthorizedApp;
import org.openphc.exposure.keyserver.domain.model.Exposure;
import org.openphc.exposure.keyserver.domain.model.ExposureEntity;
import org.openphc.exposure.keyserver.domain.model.Publish;
import org.openphc.exposure.keyserver.domain.repository.ExposureRepository;
import org.openphc.exposure.keyserver.publish.ExposureTransformer;
import org.openphc.exposure.keyserver.publish.PublishCanonicalizer;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Publish flow: authorize app → derive nonce → verify attestation → transform → persist.
 * Nothing is stored unless every key of the request is valid.
 */
@Service
@Slf4j
public class PublishService {

    private final AuthorizedAppService authorizedAppService;
    private final AttestationService attestationService;
    private final ExposureTransformer transformer;
    private final ExposureRepository exposureRepository;
    private final Clock clock;

    private final Timer publishTimer;
    private final Counter insertedExposures;
    private final MeterRegistry meterRegistry;

    public PublishService(
            AuthorizedAppService authorizedAppService,
            AttestationService attestationService,
            ExposureTransformer transformer,
            ExposureRepository exposureRepository,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.authorizedAppService = authorizedAppService;
        this.attestationService = attestationService;
        this.transformer = transformer;
        this.exposureRepository = exposureRepository;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.publishTimer = Timer.builder("keyserver.publish.duration")
                .description("Publish request validation and persistence latency")
                .register(meterRegistry);
        this.insertedExposures = Counter.builder("keyserver.publish.exposures")
                .description("Exposure records accepted for storage")
                .register(meterRegistry);
    }

    /**
     * Validate and store a publish request.
     */
    @Transactional
    public PublishResponse publish(Publish publish) {
        return publishTimer.record(() -> doPublish(publish));
    }

    private PublishResponse doPublish(Publish publish) {
        AuthorizedApp app;
        try {
            app = authorizedAppService.requireAuthorized(publish.getAppPackageName(), publish.getRegions());
        } catch (UnauthorizedAppException e) {
            recordOutcome(publish, "unauthorized");
            throw e;
        }

        String nonce = PublishCanonicalizer.nonce(publish);
        try {
            attestationService.verify(app, publish, nonce);
        } catch (AttestationFailedException e) {
            recordOutcome(publish, "unauthorized");
            throw e;
        }

        Instant batchTime = clock.instant();
        List<Exposure> exposures;
        try {
            exposures = transformer.transformPublish(publish, batchTime);
        } catch (PublishValidationException e) {
            log.warn("Rejected publish from app={}: kind={}, cause={}, {}", publish.getAppPackageName(),
                    e.getKind(), e.getRootKind(), e.getMessage());
            recordOutcome(publish, "rejected");
            throw e;
        }

        List<ExposureEntity> entities = exposures.stream()
                .map(ExposureEntity::from)
                .collect(Collectors.toList());
        exposureRepository.saveAll(entities);

        insertedExposures.increment(entities.size());
        recordOutcome(publish, "accepted");
        log.info("Accepted publish from app={}: {} exposures, regions={}",
                publish.getAppPackageName(), entities.size(), exposures.get(0).getRegions());

        return PublishResponse.builder()
                .insertedExposures(entities.size())
                .receivedAt(batchTime.atOffset(ZoneOffset.UTC))
                .build();
    }

    private void recordOutcome(Publish publish, String outcome) {
        Counter.builder("keyserver.publish.requests")
                .tag("platform", publish.getPlatform() != null ? publish.getPlatform().name() : "UNKNOWN")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }
}
