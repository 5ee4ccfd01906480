package io.dronewatch.ingestion.api.service.fake;

import io.dronewatch.ingestion.api.dto.FakeLayer;
import io.dronewatch.ingestion.api.dto.IncidentCandidate;
import io.dronewatch.ingestion.api.util.KeywordMatcher;

import java.time.Instant;
import java.util.List;

public class SatireKeywordLayer implements FakeDetectionLayer {

    private static final KeywordMatcher SATIRE_TERMS = KeywordMatcher.of(List.of(
            // English
            "satire", "satirical", "parody", "spoof", "joke", "april fools", "april fool's",
            // Danish / Norwegian
            "satirisk", "satiriske", "parodi", "spøg", "spøk", "aprilsnar", "aprilsspøk",
            // Swedish
            "satir", "skämt", "aprilskämt",
            // German, French, Dutch
            "satirisch", "aprilscherz", "parodie", "satirique", "poisson d'avril", "grap"
    ));

    @Override
    public FakeLayer layer() {
        return FakeLayer.SATIRE_KEYWORD;
    }

    @Override
    public boolean passes(IncidentCandidate candidate, Instant now) {
        return !SATIRE_TERMS.matches(candidate.fullText());
    }
}
