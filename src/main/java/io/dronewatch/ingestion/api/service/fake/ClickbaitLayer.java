package io.dronewatch.ingestion.api.service.fake;

import io.dronewatch.ingestion.api.dto.FakeLayer;
import io.dronewatch.ingestion.api.dto.IncidentCandidate;
import io.dronewatch.ingestion.api.util.KeywordMatcher;

import java.time.Instant;
import java.util.List;
import java.util.regex.Pattern;

public class ClickbaitLayer implements FakeDetectionLayer {

    private static final KeywordMatcher CLICKBAIT_PHRASES = KeywordMatcher.of(List.of(
            "you won't believe", "you will not believe", "won't believe what", "what happened next",
            "shocking truth", "the truth about", "mind-blowing", "jaw-dropping", "gone wrong",
            "this is why", "will shock you", "number 7", "click here", "must see", "must-see",
            "du vil ikke tro", "chokerende", "vanvittig", "sjokkerende", "du kommer inte att tro",
            "chockerande", "sie werden nicht glauben", "unglaublich"
    ));

    // "!!", "?!", "!?!" and the like
    private static final Pattern STACKED_PUNCTUATION = Pattern.compile("[!?]{2,}");

    @Override
    public FakeLayer layer() {
        return FakeLayer.CLICKBAIT;
    }

    @Override
    public boolean passes(IncidentCandidate candidate, Instant now) {
        return !CLICKBAIT_PHRASES.matches(candidate.fullText())
                && !STACKED_PUNCTUATION.matcher(candidate.title()).find();
    }
}
