package org.openphc.exposure.keyserver.domain.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

/**
 * Stored exposure row. The column layout is owned by this mapping, not by the {@link Exposure} value.
 */
@Entity
@Table(name = "exposure")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExposureEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "exposure_key", nullable = false, unique = true, length = 16)
    private byte[] exposureKey;

    @Column(name = "transmission_risk", nullable = false)
    private int transmissionRisk;

    @Column(name = "app_package_name", nullable = false)
    private String appPackageName;

    @Column(name = "regions", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    @Builder.Default
    private List<String> regions = List.of();

    @Column(name = "interval_number", nullable = false)
    private int intervalNumber;

    @Column(name = "interval_count", nullable = false)
    private int intervalCount;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "local_provenance", nullable = false)
    @Builder.Default
    private boolean localProvenance = true;

    @Column(name = "sync_id")
    private Long federationSyncId;

    public static ExposureEntity from(Exposure exposure) {
        return ExposureEntity.builder()
                .exposureKey(exposure.getExposureKey())
                .transmissionRisk(exposure.getTransmissionRisk())
                .appPackageName(exposure.getAppPackageName())
                .regions(List.copyOf(exposure.getRegions()))
                .intervalNumber(exposure.getIntervalNumber())
                .intervalCount(exposure.getIntervalCount())
                .createdAt(exposure.getCreatedAt().atOffset(ZoneOffset.UTC))
                .localProvenance(exposure.isLocalProvenance())
                .federationSyncId(exposure.getFederationSyncId())
                .build();
    }
}
