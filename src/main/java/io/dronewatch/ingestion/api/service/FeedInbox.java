package io.dronewatch.ingestion.api.service;

import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import io.dronewatch.ingestion.api.dto.RawIncidentReport;
import io.dronewatch.ingestion.api.exception.ErrorCategory;
import io.dronewatch.ingestion.api.exception.FeedDocumentException;
import io.dronewatch.ingestion.config.FeedConfig;
import io.dronewatch.ingestion.config.FeedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Receives feed documents fetched by the external scrapers for the configured feed sources and
 * queues their entries as raw reports until the next scheduled pipeline run drains them.
 */
@Service
public class FeedInbox implements CandidateFeed {

    private static final Logger logger = LoggerFactory.getLogger(FeedInbox.class);

    private final FeedConfig feedConfig;
    private final FeedEntryMapper entryMapper;
    private final Queue<RawIncidentReport> pending = new ConcurrentLinkedQueue<>();

    public FeedInbox(FeedConfig feedConfig, FeedEntryMapper entryMapper) {
        this.feedConfig = feedConfig;
        this.entryMapper = entryMapper;
    }

    @Override
    public String name() {
        return "feed-inbox";
    }

    /**
     * Parses a feed document for a configured source and queues its usable entries.
     *
     * @return number of entries queued
     */
    public int submit(String feedName, String document) throws FeedDocumentException {
        FeedSource source = feedConfig.findEnabled(feedName)
                .orElseThrow(() -> new FeedDocumentException("Unknown or disabled feed: " + feedName, ErrorCategory.NOT_FOUND));

        if (document == null || document.isBlank()) {
            throw new FeedDocumentException("Empty feed document from " + source.getSimpleName(), ErrorCategory.PARSE_ERROR);
        }

        SyndFeed feed;
        try {
            feed = new SyndFeedInput().build(new StringReader(document));
        } catch (FeedException | IllegalArgumentException e) {
            throw new FeedDocumentException("Feed parsing error for " + source.getSimpleName() + ": " + e.getMessage(),
                    e, ErrorCategory.PARSE_ERROR);
        }

        if (feed.getEntries() == null || feed.getEntries().isEmpty()) {
            logger.warn("Feed document from {} has no entries", source.getSimpleName());
            return 0;
        }

        List<RawIncidentReport> reports = feed.getEntries().stream()
                .map(entry -> entryMapper.toRawReport(entry, source))
                .flatMap(Optional::stream)
                .toList();
        pending.addAll(reports);

        logger.info("Queued {} of {} entries from {}", reports.size(), feed.getEntries().size(), source.getSimpleName());
        return reports.size();
    }

    @Override
    public List<RawIncidentReport> fetch() {
        List<RawIncidentReport> drained = new ArrayList<>();
        RawIncidentReport report;
        while ((report = pending.poll()) != null) {
            drained.add(report);
        }
        return drained;
    }

    public int pendingCount() {
        return pending.size();
    }
}
