package io.dronewatch.ingestion.api.service;

import io.dronewatch.ingestion.api.dto.ConsolidatedIncident;
import io.dronewatch.ingestion.api.dto.SourceRef;
import io.dronewatch.ingestion.api.util.KeywordMatcher;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;

/**
 * Assigns the 1 to 4 evidence tier of an incident from its complete source set.
 *
 * <ul>
 *   <li>4: at least one official source (trust 4)</li>
 *   <li>3: two or more credible sources (trust 2 or higher) and a quote attributable to an official</li>
 *   <li>2: at least one credible source</li>
 *   <li>1: otherwise</li>
 * </ul>
 */
@Service
public class EvidenceScorer {

    public static final int OFFICIAL = 4;
    public static final int VERIFIED = 3;
    public static final int REPORTED = 2;
    public static final int UNCONFIRMED = 1;

    static final double OFFICIAL_TRUST = 4.0;
    static final double CREDIBLE_TRUST = 2.0;

    private static final KeywordMatcher OFFICIAL_ATTRIBUTION = KeywordMatcher.of(List.of(
            "police", "politi", "politiet", "polisen", "poliisi", "polizei", "police spokesperson",
            "authority", "authorities", "myndighed", "myndigheder", "myndigheter", "myndigheten",
            "forsvaret", "forsvarsministeriet", "försvarsmakten", "military", "armed forces", "defence", "defense",
            "ministry", "minister", "spokesperson", "spokesman", "spokeswoman", "talsperson", "talsmand",
            "vagtchef", "vagtchefen", "vakthavende", "presstalesperson", "pressetalsmand", "politiinspektør",
            "confirms", "confirmed by", "bekræfter", "bekrefter", "bekräftar",
            "trafikstyrelsen", "naviair", "avinor", "luftfartstilsynet", "transportstyrelsen", "luftfartsverket",
            "aviation authority", "air traffic control", "airport operator"
    ));

    public int score(ConsolidatedIncident incident) {
        return score(incident.sources());
    }

    public int score(Collection<SourceRef> sources) {
        if (sources == null || sources.isEmpty()) return UNCONFIRMED;

        double maxTrust = sources.stream().mapToDouble(SourceRef::trustWeight).max().orElse(0.0);
        if (maxTrust >= OFFICIAL_TRUST) {
            return OFFICIAL;
        }

        long credible = sources.stream()
                .filter(source -> source.trustWeight() >= CREDIBLE_TRUST)
                .map(SourceRef::normalizedUrl)
                .distinct()
                .count();
        if (credible >= 2 && sources.stream().anyMatch(EvidenceScorer::hasOfficialQuote)) {
            return VERIFIED;
        }

        return maxTrust >= CREDIBLE_TRUST ? REPORTED : UNCONFIRMED;
    }

    /**
     * Monotone upgrade: an incident never loses evidence when sources are added.
     */
    public int upgrade(int currentScore, Collection<SourceRef> mergedSources) {
        return Math.max(currentScore, score(mergedSources));
    }

    static boolean hasOfficialQuote(SourceRef source) {
        return source.hasQuote() && OFFICIAL_ATTRIBUTION.matches(source.quote());
    }
}
