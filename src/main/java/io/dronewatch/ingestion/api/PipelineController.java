package io.dronewatch.ingestion.api;

import io.dronewatch.ingestion.api.dto.BatchResult;
import io.dronewatch.ingestion.api.dto.RawIncidentReport;
import io.dronewatch.ingestion.api.exception.ErrorCategory;
import io.dronewatch.ingestion.api.exception.FeedDocumentException;
import io.dronewatch.ingestion.api.service.FeedInbox;
import io.dronewatch.ingestion.api.service.IncidentPipelineService;
import io.dronewatch.ingestion.api.service.IncidentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/pipeline")
public class PipelineController {

    private static final Logger logger = LoggerFactory.getLogger(PipelineController.class);

    private final IncidentPipelineService pipelineService;
    private final IncidentRepository incidentRepository;
    private final FeedInbox feedInbox;
    private final Clock clock;

    public PipelineController(IncidentPipelineService pipelineService,
                              IncidentRepository incidentRepository,
                              FeedInbox feedInbox,
                              Clock clock) {
        this.pipelineService = pipelineService;
        this.incidentRepository = incidentRepository;
        this.feedInbox = feedInbox;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "service", "DroneWatch Ingestion Pipeline",
                "timestamp", clock.instant().toString()
        ));
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("storedIncidents", incidentRepository.count());
        status.put("pendingFeedEntries", feedInbox.pendingCount());

        pipelineService.getLastBatch().ifPresentOrElse(
                batch -> status.put("lastBatch", Map.of(
                        "batchId", batch.batchId(),
                        "received", batch.received(),
                        "rejected", batch.rejections().size(),
                        "created", batch.created(),
                        "merged", batch.merged(),
                        "completed", batch.completed(),
                        "startedAt", batch.startedAt().toString(),
                        "durationMs", batch.durationMs()
                )),
                () -> status.put("lastBatch", "none")
        );

        return ResponseEntity.ok(status);
    }

    @PostMapping("/batches")
    public ResponseEntity<BatchResult> processBatch(@RequestBody List<RawIncidentReport> reports) {
        if (reports == null || reports.isEmpty()) {
            return ResponseEntity.badRequest().build();
        }

        logger.info("Manual batch requested with {} reports", reports.size());
        return ResponseEntity.ok(pipelineService.processBatch("manual", reports));
    }

    @PostMapping(value = "/feeds/{name}", consumes = {
            "application/rss+xml", "application/atom+xml", MediaType.APPLICATION_XML_VALUE, MediaType.TEXT_XML_VALUE})
    public ResponseEntity<Map<String, Object>> submitFeed(@PathVariable String name, @RequestBody String document) {
        try {
            int accepted = feedInbox.submit(name, document);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
                    "feed", name,
                    "accepted", accepted,
                    "pending", feedInbox.pendingCount()
            ));
        } catch (FeedDocumentException e) {
            logger.warn("Rejected feed document for {}: {} (category: {})", name, e.getMessage(), e.getCategory());
            HttpStatus status = e.getCategory() == ErrorCategory.NOT_FOUND ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
            return ResponseEntity.status(status).body(Map.of(
                    "feed", name,
                    "error", e.getCategory().name()
            ));
        }
    }
}
