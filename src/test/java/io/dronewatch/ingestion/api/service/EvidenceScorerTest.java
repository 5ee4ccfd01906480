package io.dronewatch.ingestion.api.service;

import io.dronewatch.ingestion.api.dto.SourceRef;
import io.dronewatch.ingestion.api.dto.SourceType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.dronewatch.ingestion.PipelineFixtures.source;
import static org.assertj.core.api.Assertions.assertThat;

class EvidenceScorerTest {

    private final EvidenceScorer scorer = new EvidenceScorer();

    private static final SourceRef POLICE = source("https://politi.dk/nordjylland/drone", SourceType.POLICE, 4.0);
    private static final SourceRef TV2 = source("https://nyheder.tv2.dk/drone", SourceType.MEDIA, 2.0);
    private static final SourceRef DR = source("https://dr.dk/nyheder/drone", SourceType.VERIFIED_MEDIA, 3.0);
    private static final SourceRef TWEET = source("https://x.com/user/status/1", SourceType.SOCIAL, 1.0);

    @Test
    @DisplayName("Any official source gives the top tier")
    void officialSourceScoresFour() {
        assertThat(scorer.score(List.of(POLICE))).isEqualTo(4);
        assertThat(scorer.score(List.of(TWEET, POLICE))).isEqualTo(4);
    }

    @Test
    @DisplayName("Two credible sources with an official quote score three")
    void twoCredibleWithQuoteScoresThree() {
        SourceRef quoted = source("https://nyheder.tv2.dk/drone", SourceType.MEDIA, 2.0,
                "\"We observed a drone over the runway,\" says the police duty officer.");

        assertThat(scorer.score(List.of(quoted, DR))).isEqualTo(3);
    }

    @Test
    @DisplayName("Two credible sources without an attributable quote stay at two")
    void twoCredibleWithoutQuoteScoresTwo() {
        SourceRef eyewitness = source("https://nyheder.tv2.dk/drone", SourceType.MEDIA, 2.0,
                "\"It was huge,\" a passenger said.");

        assertThat(scorer.score(List.of(TV2, DR))).isEqualTo(2);
        assertThat(scorer.score(List.of(eyewitness, DR))).isEqualTo(2);
    }

    @Test
    @DisplayName("The same URL twice does not count as corroboration")
    void duplicateUrlsCountOnce() {
        SourceRef quoted = source("https://dr.dk/nyheder/drone/", SourceType.VERIFIED_MEDIA, 3.0,
                "Politiet bekræfter observationen.");

        assertThat(scorer.score(List.of(DR, quoted))).isEqualTo(2);
    }

    @Test
    @DisplayName("Low trust sources only give the bottom tier")
    void lowTrustScoresOne() {
        assertThat(scorer.score(List.of(TWEET))).isEqualTo(1);
        assertThat(scorer.score(List.of())).isEqualTo(1);
    }

    @Test
    @DisplayName("Upgrades never lower an existing score")
    void upgradeIsMonotone() {
        assertThat(scorer.upgrade(4, List.of(TWEET))).isEqualTo(4);
        assertThat(scorer.upgrade(2, List.of(TV2, POLICE))).isEqualTo(4);
        assertThat(scorer.upgrade(1, List.of(TV2))).isEqualTo(2);
    }
}
