package io.dronewatch.ingestion.config;

import io.dronewatch.ingestion.api.dto.SourceType;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Map;

@ConfigurationProperties(prefix = "pipeline")
public record PipelineConfig(
        GeoConfig geo,
        ConsolidationConfig consolidation,
        Map<String, Double> trustWeights,
        FakeDetectionConfig fake,
        AiConfig ai,
        ProcessingConfig processing
) {

    /**
     * Trust weight for a source type from the configured table, 1.0 when the table has no entry.
     */
    public double trustWeightFor(SourceType sourceType) {
        if (trustWeights == null || sourceType == null) return 1.0;

        Double weight = trustWeights.get(sourceType.key());
        if (weight == null) {
            weight = trustWeights.get(sourceType.name());
        }
        return weight != null ? weight : 1.0;
    }
}
