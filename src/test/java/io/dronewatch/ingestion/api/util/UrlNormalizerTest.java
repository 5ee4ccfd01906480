package io.dronewatch.ingestion.api.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UrlNormalizerTest {

    @Test
    @DisplayName("Should treat scheme, www, trailing slash and tracking parameters as irrelevant")
    void shouldNormalizeEquivalentUrls() {
        String canonical = UrlNormalizer.normalize("https://www.dr.dk/nyheder/drone-aalborg");

        assertThat(UrlNormalizer.normalize("http://DR.dk/nyheder/drone-aalborg/")).isEqualTo(canonical);
        assertThat(UrlNormalizer.normalize("https://www.dr.dk/nyheder/drone-aalborg?utm_source=x&fbclid=1"))
                .isEqualTo(canonical);
    }

    @Test
    @DisplayName("Should keep meaningful query parameters in a stable order")
    void shouldKeepMeaningfulQuery() {
        assertThat(UrlNormalizer.normalize("https://tv2.dk/article?b=2&a=1"))
                .isEqualTo("tv2.dk/article?a=1&b=2");
    }

    @Test
    void shouldExposeHostAndPathForPrefixMatching() {
        assertThat(UrlNormalizer.hostAndPath("https://www.nrk.no/satiriks/drone-123"))
                .isEqualTo("nrk.no/satiriks/drone-123");
    }

    @Test
    void shouldHandleMissingInput() {
        assertThat(UrlNormalizer.normalize(null)).isEmpty();
        assertThat(UrlNormalizer.normalize("not a url/")).isEqualTo("not a url");
    }
}
