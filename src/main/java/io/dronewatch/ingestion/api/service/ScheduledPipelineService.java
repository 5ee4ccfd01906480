package io.dronewatch.ingestion.api.service;

import io.dronewatch.ingestion.api.dto.BatchResult;
import io.dronewatch.ingestion.api.dto.RawIncidentReport;
import io.dronewatch.ingestion.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ScheduledPipelineService {
    private static final Logger logger = LoggerFactory.getLogger(ScheduledPipelineService.class);

    private final IncidentPipelineService pipelineService;
    private final List<CandidateFeed> feeds;
    private final PipelineConfig config;

    public ScheduledPipelineService(IncidentPipelineService pipelineService,
                                    List<CandidateFeed> feeds,
                                    PipelineConfig config) {
        this.pipelineService = pipelineService;
        this.feeds = feeds;
        this.config = config;
    }

    @Scheduled(
            fixedRateString = "#{@pipelineProps.scheduleIntervalMs}",
            initialDelayString = "#{@pipelineProps.initialDelayMs}"
    )
    public void processAllFeeds() {
        if (!config.processing().enableScheduling()) {
            logger.debug("Scheduled processing disabled");
            return;
        }

        logger.info("Starting scheduled pipeline run for {} feeds", feeds.size());
        long startTime = System.currentTimeMillis();

        int totalReceived = 0;
        int totalRejected = 0;

        for (CandidateFeed feed : feeds) {
            try {
                List<RawIncidentReport> reports = feed.fetch();
                if (reports == null || reports.isEmpty()) {
                    logger.debug("Feed {} returned no reports", feed.name());
                    continue;
                }

                BatchResult result = pipelineService.processBatch(feed.name(), reports);

                totalReceived += result.received();
                totalRejected += result.rejections().size();

                logger.info("Processed {}: {} received, {} created, {} merged",
                        feed.name(), result.received(), result.created(), result.merged());

            } catch (Exception e) {
                logger.error("Failed to process feed {}: {}", feed.name(), e.getMessage());
            }
        }

        long duration = System.currentTimeMillis() - startTime;

        logger.info("Scheduled pipeline run completed: {} received, {} rejected in {}ms",
                totalReceived, totalRejected, duration);
    }
}
