package io.dronewatch.ingestion.api.service.fake;

import io.dronewatch.ingestion.api.dto.FakeLayer;
import io.dronewatch.ingestion.api.dto.IncidentCandidate;
import io.dronewatch.ingestion.api.util.KeywordMatcher;

import java.time.Instant;
import java.util.List;

public class ConspiracyLayer implements FakeDetectionLayer {

    private static final KeywordMatcher CONSPIRACY_TERMS = KeywordMatcher.of(List.of(
            "chemtrail", "chemtrails", "false flag", "deep state", "cover-up", "cover up",
            "new world order", "illuminati", "reptilian", "reptilians", "mind control",
            "they don't want you to know", "what they're not telling you", "wake up sheeple",
            "extraterrestrial", "alien spacecraft", "ufo", "ufos",
            "konspiration", "mørklægning", "sammensværgelse", "konspirasjon",
            "mörkläggning", "verschwörung", "complot"
    ));

    @Override
    public FakeLayer layer() {
        return FakeLayer.CONSPIRACY;
    }

    @Override
    public boolean passes(IncidentCandidate candidate, Instant now) {
        return !CONSPIRACY_TERMS.matches(candidate.fullText());
    }
}
