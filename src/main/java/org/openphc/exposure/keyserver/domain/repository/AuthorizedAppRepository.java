package org.openphc.exposure.keyserver.domain.repository;

import org.openphc.exposure.keyserver.domain.model.AuthorizedApp;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AuthorizedAppRepository extends JpaRepository<AuthorizedApp, String> {
}
