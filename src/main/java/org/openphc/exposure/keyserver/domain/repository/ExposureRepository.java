package org.openphc.exposure.keyserver.domain.repository;

import org.openphc.exposure.keyserver.domain.model.ExposureEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface ExposureRepository extends JpaRepository<ExposureEntity, UUID> {
}
