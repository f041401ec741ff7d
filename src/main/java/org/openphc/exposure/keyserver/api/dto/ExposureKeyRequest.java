package org.openphc.exposure.keyserver.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One key on the wire. Field names follow the Exposure Notifications API naming.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExposureKeyRequest {

    @NotNull(message = "key is required")
    private String key;

    @NotNull(message = "rollingStartNumber is required")
    private Integer rollingStartNumber;

    @NotNull(message = "rollingPeriod is required")
    private Integer rollingPeriod;

    @NotNull(message = "transmissionRisk is required")
    private Integer transmissionRisk;
}
