package org.openphc.exposure.keyserver.domain.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.openphc.exposure.keyserver.domain.model.enums.Platform;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Mobile application allowed to publish keys, and the regions it may publish for.
 */
@Entity
@Table(name = "authorized_app")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuthorizedApp {

    @Id
    @Column(name = "app_package_name", nullable = false)
    private String appPackageName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Platform platform;

    @Column(name = "allowed_regions", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    @Builder.Default
    private List<String> allowedRegions = List.of();

    // DeviceCheck / SafetyNet turned off for this app
    @Column(name = "attestation_disabled", nullable = false)
    private boolean attestationDisabled;

    @Column(name = "created_at", nullable = false)
    @Builder.Default
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    @Builder.Default
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
