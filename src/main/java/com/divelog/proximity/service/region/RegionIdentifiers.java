package com.divelog.proximity.service.region;

import com.divelog.proximity.config.ProximityProperties;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Maps site ids to region identifiers and back ({@code dive_site_<siteId>}).
 */
@Component
public class RegionIdentifiers {

    private final String prefix;

    public RegionIdentifiers(ProximityProperties properties) {
        this.prefix = properties.getRegions().getIdentifierPrefix();
    }

    public String identifierFor(String siteId) {
        return prefix + siteId;
    }

    /**
     * @return the site id, or empty for identifiers another feature owns
     */
    public Optional<String> siteIdOf(String regionId) {
        if (regionId == null || !regionId.startsWith(prefix) || regionId.length() == prefix.length()) {
            return Optional.empty();
        }
        return Optional.of(regionId.substring(prefix.length()));
    }
}
