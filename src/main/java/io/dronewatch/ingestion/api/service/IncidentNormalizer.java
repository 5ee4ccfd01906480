package io.dronewatch.ingestion.api.service;

import io.dronewatch.ingestion.api.dto.AssetType;
import io.dronewatch.ingestion.api.dto.IncidentCandidate;
import io.dronewatch.ingestion.api.dto.RawIncidentReport;
import io.dronewatch.ingestion.api.dto.RawSource;
import io.dronewatch.ingestion.api.dto.SourceRef;
import io.dronewatch.ingestion.api.dto.SourceType;
import io.dronewatch.ingestion.api.exception.MalformedCandidateException;
import io.dronewatch.ingestion.api.util.TextCleaner;
import io.dronewatch.ingestion.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Converts raw scraped reports into canonical {@link IncidentCandidate}s.
 */
@Service
public class IncidentNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(IncidentNormalizer.class);

    private final PipelineConfig config;

    public IncidentNormalizer(PipelineConfig config) {
        this.config = config;
    }

    public IncidentCandidate normalize(RawIncidentReport raw, Instant ingestedAt) throws MalformedCandidateException {
        if (raw == null) {
            throw new MalformedCandidateException("Report is null");
        }

        String title = TextCleaner.clean(raw.title());
        if (title.isBlank()) {
            throw new MalformedCandidateException("Report has no title");
        }

        Instant occurredAt = parseOccurredAt(raw.occurredAt());
        List<SourceRef> sources = normalizeSources(raw.sources());
        if (sources.isEmpty()) {
            throw new MalformedCandidateException("Report has no usable source: " + title);
        }

        Double lat = raw.latitude();
        Double lon = raw.longitude();
        if (!isCoordinate(lat, 90) || !isCoordinate(lon, 180)) {
            if (lat != null || lon != null) {
                logger.debug("Dropping partial or invalid coordinates ({}, {}) for '{}'", lat, lon, title);
            }
            lat = null;
            lon = null;
        }

        return new IncidentCandidate(
                title,
                TextCleaner.clean(raw.narrative()),
                occurredAt,
                lat,
                lon,
                AssetType.fromString(raw.assetType()),
                normalizeCountry(raw.country()),
                sources,
                ingestedAt
        );
    }

    private List<SourceRef> normalizeSources(List<RawSource> rawSources) {
        if (rawSources == null) return List.of();

        List<SourceRef> sources = new ArrayList<>();
        for (RawSource rawSource : rawSources) {
            if (rawSource == null || rawSource.url() == null || rawSource.url().isBlank()) {
                continue;
            }

            SourceType type = SourceType.fromString(rawSource.sourceType());
            double trust = rawSource.trustWeight() != null && !rawSource.trustWeight().isNaN()
                    ? rawSource.trustWeight()
                    : config.trustWeightFor(type);
            trust = Math.max(0.0, Math.min(SourceRef.MAX_TRUST, trust));

            String quote = TextCleaner.clean(rawSource.quote());
            sources.add(new SourceRef(rawSource.url().trim(), type, trust, quote.isBlank() ? null : quote));
        }
        return sources;
    }

    static Instant parseOccurredAt(String value) throws MalformedCandidateException {
        if (value == null || value.isBlank()) {
            throw new MalformedCandidateException("Report has no occurrence time");
        }

        String text = value.trim();
        try {
            if (Character.isLetter(text.charAt(0))) {
                // RSS style, e.g. "Mon, 22 Sep 2025 20:15:00 +0200"
                return ZonedDateTime.parse(text, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            }
            if (text.length() == 10) {
                return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text, ZonedDateTime::from, LocalDateTime::from);
            return parsed instanceof ZonedDateTime zoned
                    ? zoned.toInstant()
                    : ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new MalformedCandidateException("Unparseable occurrence time: " + text, e);
        }
    }

    private static boolean isCoordinate(Double value, double limit) {
        return value != null && Double.isFinite(value) && Math.abs(value) <= limit;
    }

    private static String normalizeCountry(String country) {
        if (country == null || country.isBlank()) return null;
        return country.trim().toUpperCase(Locale.ROOT);
    }
}
