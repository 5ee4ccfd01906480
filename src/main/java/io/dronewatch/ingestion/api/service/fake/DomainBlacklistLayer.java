package io.dronewatch.ingestion.api.service.fake;

import io.dronewatch.ingestion.api.dto.FakeLayer;
import io.dronewatch.ingestion.api.dto.IncidentCandidate;
import io.dronewatch.ingestion.api.dto.SourceRef;
import io.dronewatch.ingestion.api.util.UrlNormalizer;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Fails when the primary source lives on a known satire or fake-news site. Entries are
 * either a bare domain (also matching its subdomains) or a domain with a path prefix.
 */
public class DomainBlacklistLayer implements FakeDetectionLayer {

    private final List<String> entries;

    public DomainBlacklistLayer(List<String> blacklistedDomains) {
        this.entries = blacklistedDomains == null ? List.of() : blacklistedDomains.stream()
                .filter(entry -> entry != null && !entry.isBlank())
                .map(entry -> UrlNormalizer.hostAndPath(entry.contains("://") ? entry : "https://" + entry.trim()))
                .map(entry -> entry.toLowerCase(Locale.ROOT))
                .toList();
    }

    @Override
    public FakeLayer layer() {
        return FakeLayer.DOMAIN_BLACKLIST;
    }

    @Override
    public boolean passes(IncidentCandidate candidate, Instant now) {
        SourceRef primary = candidate.primarySource();
        if (primary == null) return true;

        String location = UrlNormalizer.hostAndPath(primary.url());
        return entries.stream().noneMatch(entry -> isListed(location, entry));
    }

    private boolean isListed(String location, String entry) {
        if (entry.contains("/")) {
            return location.startsWith(entry) || location.contains("." + entry);
        }
        String host = location.contains("/") ? location.substring(0, location.indexOf('/')) : location;
        return host.equals(entry) || host.endsWith("." + entry);
    }
}
