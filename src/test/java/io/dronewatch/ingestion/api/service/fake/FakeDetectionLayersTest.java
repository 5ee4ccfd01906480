package io.dronewatch.ingestion.api.service.fake;

import io.dronewatch.ingestion.PipelineFixtures;
import io.dronewatch.ingestion.api.dto.AssetType;
import io.dronewatch.ingestion.api.dto.IncidentCandidate;
import io.dronewatch.ingestion.api.dto.SourceRef;
import io.dronewatch.ingestion.api.dto.SourceType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static io.dronewatch.ingestion.PipelineFixtures.NOW;
import static io.dronewatch.ingestion.PipelineFixtures.source;
import static org.assertj.core.api.Assertions.assertThat;

class FakeDetectionLayersTest {

    private static final Instant OCCURRED = NOW.minus(Duration.ofHours(1));
    private static final SourceRef POLICE = source("https://politi.dk/nordjylland/drone", SourceType.POLICE, 4.0);

    @Nested
    class DomainBlacklist {

        private final DomainBlacklistLayer layer =
                new DomainBlacklistLayer(List.of("rokokoposten.dk", "nrk.no/satiriks"));

        @Test
        @DisplayName("Should fail when the primary source is a listed domain or subdomain")
        void shouldFailListedDomain() {
            assertThat(layer.passes(withPrimary("https://rokokoposten.dk/2025/09/drone"), NOW)).isFalse();
            assertThat(layer.passes(withPrimary("https://www.rokokoposten.dk/drone"), NOW)).isFalse();
            assertThat(layer.passes(withPrimary("https://blog.rokokoposten.dk/drone"), NOW)).isFalse();
        }

        @Test
        @DisplayName("Should match path-prefixed entries only under that path")
        void shouldMatchPathPrefix() {
            assertThat(layer.passes(withPrimary("https://www.nrk.no/satiriks/drone-over-oslo"), NOW)).isFalse();
            assertThat(layer.passes(withPrimary("https://www.nrk.no/nyheter/drone-over-oslo"), NOW)).isTrue();
        }

        @Test
        @DisplayName("Should not match look-alike domains")
        void shouldNotMatchLookAlike() {
            assertThat(layer.passes(withPrimary("https://notrokokoposten.dk/drone"), NOW)).isTrue();
        }
    }

    @Test
    @DisplayName("Satire layer should catch satire and joke markers in several languages")
    void satireLayer() {
        SatireKeywordLayer layer = new SatireKeywordLayer();

        assertThat(layer.passes(withText("Satire: drone demands asylum in Aalborg", ""), NOW)).isFalse();
        assertThat(layer.passes(withText("Drone over Odense", "Det var en aprilsnar fra avisen."), NOW)).isFalse();
        assertThat(layer.passes(withText("Drönare över Malmö", "Ett skämt som spreds på nätet."), NOW)).isFalse();
        assertThat(layer.passes(withText("Drone over Odense", "Police investigate the sighting."), NOW)).isTrue();
    }

    @Test
    @DisplayName("Clickbait layer should catch bait phrases and stacked punctuation")
    void clickbaitLayer() {
        ClickbaitLayer layer = new ClickbaitLayer();

        assertThat(layer.passes(withText("You won't believe what this drone did", ""), NOW)).isFalse();
        assertThat(layer.passes(withText("Drone over Aalborg?!", ""), NOW)).isFalse();
        assertThat(layer.passes(withText("Drone over Aalborg", "Sjokkerende video fra lufthavnen"), NOW)).isFalse();
        assertThat(layer.passes(withText("Drone over Aalborg", "Flights halted for an hour."), NOW)).isTrue();
    }

    @Test
    @DisplayName("Conspiracy layer should catch conspiracy vocabulary")
    void conspiracyLayer() {
        ConspiracyLayer layer = new ConspiracyLayer();

        assertThat(layer.passes(withText("Drones spraying chemtrails over Copenhagen", ""), NOW)).isFalse();
        assertThat(layer.passes(withText("Drone incident was a false flag", ""), NOW)).isFalse();
        assertThat(layer.passes(withText("Drone over Copenhagen", "Police are investigating."), NOW)).isTrue();
    }

    @Nested
    class Temporal {

        private final TemporalConsistencyLayer layer =
                new TemporalConsistencyLayer(Duration.ofDays(30), Duration.ofHours(1));

        @Test
        @DisplayName("Should fail dates beyond the future tolerance")
        void shouldFailFutureDate() {
            assertThat(layer.passes(at(NOW.plus(Duration.ofHours(2))), NOW)).isFalse();
            assertThat(layer.passes(at(NOW.plus(Duration.ofMinutes(30))), NOW)).isTrue();
        }

        @Test
        @DisplayName("Should fail reports older than the staleness window")
        void shouldFailStaleDate() {
            assertThat(layer.passes(at(NOW.minus(Duration.ofDays(31))), NOW)).isFalse();
            assertThat(layer.passes(at(NOW.minus(Duration.ofDays(30))), NOW)).isTrue();
        }

        @Test
        @DisplayName("Should depend only on the supplied time")
        void shouldUseSuppliedNow() {
            IncidentCandidate candidate = at(Instant.parse("2020-01-01T12:00:00Z"));

            assertThat(layer.passes(candidate, Instant.parse("2020-01-02T00:00:00Z"))).isTrue();
            assertThat(layer.passes(candidate, NOW)).isFalse();
        }
    }

    @Test
    @DisplayName("Source credibility should fail when average trust is too low")
    void sourceCredibilityLayer() {
        SourceCredibilityLayer layer = new SourceCredibilityLayer(0.3);

        IncidentCandidate lowTrust = PipelineFixtures.aalborgCandidate(OCCURRED,
                source("https://anon.example/a", SourceType.OTHER, 0.0),
                source("https://anon.example/b", SourceType.OTHER, 0.5));
        IncidentCandidate social = PipelineFixtures.aalborgCandidate(OCCURRED,
                source("https://x.com/someone/status/1", SourceType.SOCIAL, 1.0));

        assertThat(layer.passes(lowTrust, NOW)).isFalse();
        assertThat(layer.passes(social, NOW)).isTrue();
    }

    private static IncidentCandidate withPrimary(String url) {
        return PipelineFixtures.aalborgCandidate(OCCURRED, source(url, SourceType.MEDIA, 2.0), POLICE);
    }

    private static IncidentCandidate withText(String title, String narrative) {
        return PipelineFixtures.candidate(title, narrative, 57.05, 9.92, AssetType.OTHER, OCCURRED, POLICE);
    }

    private static IncidentCandidate at(Instant occurredAt) {
        return PipelineFixtures.aalborgCandidate(occurredAt, POLICE);
    }
}
