package io.dronewatch.ingestion.config;

import java.time.Duration;

public record ProcessingConfig(
        Duration scheduleInterval,
        Duration initialDelay,
        boolean enableScheduling,
        int parallelism
) {
    public long getScheduleIntervalMs() {
        return scheduleInterval.toMillis();
    }

    public long getInitialDelayMs() {
        return initialDelay.toMillis();
    }
}
