package org.openphc.exposure.keyserver.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openphc.exposure.keyserver.api.exception.UnauthorizedAppException;
import org.openphc.exposure.keyserver.domain.model.AuthorizedApp;
import org.openphc.exposure.keyserver.domain.repository.AuthorizedAppRepository;
import org.openphc.exposure.keyserver.publish.Regions;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Looks up the publishing application and checks it may write the requested regions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthorizedAppService {

    private final AuthorizedAppRepository authorizedAppRepository;

    /**
     * @return the registration for {@code appPackageName}
     * @throws UnauthorizedAppException if the app is unknown, a region is blank, or a region is not allowed for it
     */
    public AuthorizedApp requireAuthorized(String appPackageName, List<String> regions) {
        if (appPackageName == null || appPackageName.isBlank()) {
            throw new UnauthorizedAppException(appPackageName, "appPackageName is required");
        }
        AuthorizedApp app = authorizedAppRepository.findById(appPackageName)
                .orElseThrow(() -> {
                    log.warn("Publish from unknown app: {}", appPackageName);
                    return new UnauthorizedAppException(appPackageName,
                            "application " + appPackageName + " is not authorized");
                });

        Set<String> allowed = app.getAllowedRegions().stream()
                .map(Regions::upcase)
                .collect(Collectors.toSet());
        for (String region : regions) {
            String upcased = Regions.upcase(region);
            if (upcased.isBlank()) {
                log.warn("App {} sent a blank region", appPackageName);
                throw new UnauthorizedAppException(appPackageName, "regions must not contain blank entries");
            }
            if (!allowed.contains(upcased)) {
                log.warn("App {} tried to publish for region {} (allowed: {})", appPackageName, upcased, allowed);
                throw new UnauthorizedAppException(appPackageName,
                        "application " + appPackageName + " is not authorized for region " + upcased);
            }
        }
        return app;
    }
}
