package io.dronewatch.ingestion.api.service.ai;

import io.dronewatch.ingestion.api.dto.ClassificationRequest;
import io.dronewatch.ingestion.api.dto.ClassifierResponse;
import io.dronewatch.ingestion.api.dto.IncidentCandidate;
import io.dronewatch.ingestion.api.dto.IncidentCategory;
import io.dronewatch.ingestion.api.dto.VerifyResult;
import io.dronewatch.ingestion.api.exception.ClassifierException;
import io.dronewatch.ingestion.api.util.TextCleaner;
import io.dronewatch.ingestion.config.AiConfig;
import io.dronewatch.ingestion.config.PipelineConfig;
import jakarta.annotation.PreDestroy;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wraps the external classifier with a verdict cache and a hard timeout. Any failure of the
 * classifier degrades to "no opinion" so the candidate continues on rule-based verdicts.
 */
@Service
public class AiVerifier {

    private static final Logger logger = LoggerFactory.getLogger(AiVerifier.class);

    static final int MAX_REASONING_LENGTH = 4000;
    private static final Duration MAX_TIMEOUT = Duration.ofSeconds(10);
    private static final int DEFAULT_POOL_SIZE = 4;

    private final IncidentClassifier classifier;
    private final AiVerdictCache cache;
    private final boolean enabled;
    private final double rejectThreshold;
    private final Duration timeout;
    private final ExecutorService executor;

    public AiVerifier(IncidentClassifier classifier, AiVerdictCache cache, PipelineConfig config) {
        AiConfig ai = config.ai();
        this.classifier = classifier;
        this.cache = cache;
        this.enabled = ai != null && ai.enabled();
        this.rejectThreshold = ai != null ? ai.rejectThreshold() : 0.6;
        this.timeout = ai != null && ai.timeout() != null && ai.timeout().compareTo(MAX_TIMEOUT) < 0
                ? ai.timeout()
                : MAX_TIMEOUT;

        // a timed-out call keeps its thread until the HTTP read timeout, so the pool is capped
        int poolSize = config.processing() != null && config.processing().parallelism() > 0
                ? config.processing().parallelism()
                : DEFAULT_POOL_SIZE;
        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(poolSize, runnable -> {
            Thread thread = new Thread(runnable, "ai-verifier-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public VerifyResult verify(IncidentCandidate candidate) {
        if (!enabled || !classifier.isAvailable()) {
            return VerifyResult.noOpinion("classifier not configured");
        }

        String key = cacheKey(candidate);
        Optional<VerifyResult> cached = cache.get(key);
        if (cached.isPresent()) {
            logger.debug("AI verdict cache hit for '{}'", candidate.title());
            return cached.get();
        }

        var request = new ClassificationRequest(candidate.title(), candidate.narrative(), locationHint(candidate));
        CompletableFuture<ClassifierResponse> call = CompletableFuture.supplyAsync(() -> {
            try {
                return classifier.classify(request);
            } catch (ClassifierException e) {
                throw new CompletionException(e);
            }
        }, executor);

        ClassifierResponse response;
        try {
            response = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);

        } catch (TimeoutException e) {
            call.cancel(true);
            logger.warn("AI verification timed out after {}ms for '{}'", timeout.toMillis(), candidate.title());
            return VerifyResult.noOpinion("timeout");

        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ClassifierException classifierError) {
                logger.warn("AI verification failed for '{}': {} (category: {})",
                        candidate.title(), classifierError.getMessage(), classifierError.getCategory());
                return VerifyResult.noOpinion(classifierError.getCategory().name().toLowerCase(Locale.ROOT));
            }
            logger.error("Unexpected AI verification error for '{}': {}", candidate.title(), String.valueOf(cause), cause);
            return VerifyResult.noOpinion("unknown");

        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            return VerifyResult.noOpinion("interrupted");
        }

        Optional<VerifyResult> validated = validate(response);
        if (validated.isEmpty()) {
            logger.warn("Discarding malformed AI verdict for '{}': {}", candidate.title(), response);
            return VerifyResult.noOpinion("malformed_response");
        }

        cache.put(key, validated.get());
        return validated.get();
    }

    /**
     * True when the classifier is confident the text is not an incident.
     */
    public boolean isConfidentRejection(VerifyResult result) {
        return result.hasOpinion() && !result.isIncident() && result.confidence() > rejectThreshold;
    }

    static Optional<VerifyResult> validate(ClassifierResponse response) {
        if (response == null || response.isIncident() == null) return Optional.empty();

        Optional<IncidentCategory> category = IncidentCategory.parse(response.category());
        if (category.isEmpty()) return Optional.empty();

        Double confidence = response.confidence();
        if (confidence == null || !Double.isFinite(confidence) || confidence < 0.0 || confidence > 1.0) {
            return Optional.empty();
        }

        String reasoning = response.reasoning();
        if (reasoning == null || reasoning.isBlank() || reasoning.length() > MAX_REASONING_LENGTH) {
            return Optional.empty();
        }

        return Optional.of(VerifyResult.of(response.isIncident(), category.get(), confidence, reasoning));
    }

    static String cacheKey(IncidentCandidate candidate) {
        return DigestUtils.sha256Hex(TextCleaner.canonical(candidate.title()) + "\n" + TextCleaner.canonical(candidate.narrative()));
    }

    private static String locationHint(IncidentCandidate candidate) {
        if (candidate.hasCoordinates()) {
            return String.format(Locale.ROOT, "%.4f,%.4f %s", candidate.latitude(), candidate.longitude(),
                    candidate.country() != null ? candidate.country() : "").trim();
        }
        return candidate.country();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
