package io.dronewatch.ingestion.api.util;

import io.dronewatch.ingestion.config.PipelineConfig;
import org.springframework.stereotype.Component;

@Component
public class PipelineProps {
    private final long scheduleIntervalMs;
    private final long initialDelayMs;

    public PipelineProps(PipelineConfig config) {
        this.scheduleIntervalMs = config.processing().getScheduleIntervalMs();
        this.initialDelayMs = config.processing().getInitialDelayMs();
    }

    // schedule
    public long getScheduleIntervalMs() { return scheduleIntervalMs; }
    public long getInitialDelayMs() { return initialDelayMs; }
}
