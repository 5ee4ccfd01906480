package io.dronewatch.ingestion.api.service;

import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEntry;
import io.dronewatch.ingestion.api.dto.AssetType;
import io.dronewatch.ingestion.api.dto.RawIncidentReport;
import io.dronewatch.ingestion.api.dto.RawSource;
import io.dronewatch.ingestion.config.FeedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Date;
import java.util.List;
import java.util.Optional;

/**
 * Maps feed entries fetched elsewhere into raw reports. Feed entries carry no coordinates,
 * so the resulting reports are located by text only.
 */
@Component
public class FeedEntryMapper {

    private static final Logger logger = LoggerFactory.getLogger(FeedEntryMapper.class);

    public Optional<RawIncidentReport> toRawReport(SyndEntry entry, FeedSource feed) {
        if (entry == null) {
            return Optional.empty();
        }

        var title = entry.getTitle() != null ? entry.getTitle().trim() : "";
        var link = entry.getLink() != null ? entry.getLink().trim() : "";
        if (title.isBlank() || link.isBlank()) {
            logger.debug("Skipping entry from {} with missing title or link: title='{}', link='{}'",
                    feed.getSimpleName(), title, link);
            return Optional.empty();
        }

        Date date = entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate();
        if (date == null) {
            logger.debug("Skipping undated entry from {}: {}", feed.getSimpleName(), title);
            return Optional.empty();
        }

        AssetType assetType = feed.defaultAssetType() != null ? feed.defaultAssetType() : AssetType.OTHER;
        var source = new RawSource(link, feed.sourceType() != null ? feed.sourceType().key() : null, null, null);

        return Optional.of(new RawIncidentReport(
                title,
                narrativeOf(entry),
                date.toInstant().toString(),
                null,
                null,
                assetType.key(),
                feed.country(),
                List.of(source)
        ));
    }

    private String narrativeOf(SyndEntry entry) {
        if (entry.getDescription() != null && entry.getDescription().getValue() != null) {
            return entry.getDescription().getValue();
        }
        if (entry.getContents() != null) {
            return entry.getContents().stream()
                    .map(SyndContent::getValue)
                    .filter(value -> value != null && !value.isBlank())
                    .findFirst()
                    .orElse("");
        }
        return "";
    }
}
