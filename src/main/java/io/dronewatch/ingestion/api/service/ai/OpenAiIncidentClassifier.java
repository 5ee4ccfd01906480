package io.dronewatch.ingestion.api.service.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dronewatch.ingestion.api.dto.ClassificationRequest;
import io.dronewatch.ingestion.api.dto.ClassifierResponse;
import io.dronewatch.ingestion.api.exception.ClassifierException;
import io.dronewatch.ingestion.api.exception.ErrorCategory;
import io.dronewatch.ingestion.config.AiConfig;
import io.dronewatch.ingestion.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.HttpURLConnection;
import java.net.MalformedURLException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.URL;
import java.net.UnknownHostException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Classifier backed by an OpenAI-compatible chat completions endpoint.
 */
@Component
public class OpenAiIncidentClassifier implements IncidentClassifier {

    private static final Logger logger = LoggerFactory.getLogger(OpenAiIncidentClassifier.class);

    private static final String SYSTEM_PROMPT = """
            You verify reports of drone incidents near sensitive facilities in Europe.
            Decide whether the text describes an actual drone sighting or intrusion that happened,
            as opposed to policy news, defense procurement or deployment, exercises, or general discussion.
            Reply with strict JSON: {"is_incident": boolean, "category": "incident"|"policy"|"defense"|"discussion",
            "confidence": number between 0 and 1, "reasoning": short explanation}.""";

    private final AiConfig aiConfig;
    private final ObjectMapper objectMapper;

    public OpenAiIncidentClassifier(PipelineConfig config, ObjectMapper objectMapper) {
        this.aiConfig = config.ai();
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean isAvailable() {
        return aiConfig != null && aiConfig.enabled() && aiConfig.hasApiKey();
    }

    @Override
    public ClassifierResponse classify(ClassificationRequest request) throws ClassifierException {
        if (aiConfig == null || !aiConfig.hasApiKey()) {
            throw new ClassifierException("No API key configured", ErrorCategory.AUTH_REQUIRED);
        }

        String endpoint = aiConfig.baseUrl() + "/chat/completions";
        HttpURLConnection connection = null;

        try {
            byte[] body = objectMapper.writeValueAsBytes(buildRequest(request));

            connection = (HttpURLConnection) new URL(endpoint).openConnection();
            configureConnection(connection);

            try (OutputStream out = connection.getOutputStream()) {
                out.write(body);
            }

            validateHttpResponse(connection, endpoint);

            try (InputStream in = connection.getInputStream()) {
                return parseResponse(in.readAllBytes());
            }

        } catch (MalformedURLException e) {
            throw new ClassifierException("Invalid classifier URL: " + endpoint, e, ErrorCategory.INVALID_URL);

        } catch (SocketTimeoutException e) {
            throw new ClassifierException("Classifier timeout: " + endpoint, e, ErrorCategory.TIMEOUT);

        } catch (ConnectException e) {
            throw new ClassifierException("Connection refused: " + endpoint, e, ErrorCategory.CONNECTION_REFUSED);

        } catch (UnknownHostException e) {
            throw new ClassifierException("Unknown host: " + endpoint, e, ErrorCategory.DNS_ERROR);

        } catch (SocketException e) {
            throw new ClassifierException("Network error: " + endpoint, e, ErrorCategory.NETWORK_ERROR);

        } catch (IOException e) {
            throw new ClassifierException("I/O error calling classifier: " + e.getMessage(), e, ErrorCategory.IO_ERROR);

        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    private Map<String, Object> buildRequest(ClassificationRequest request) {
        String user = "Title: " + request.title() + "\n"
                + "Text: " + request.narrative() + "\n"
                + "Location: " + (request.locationHint() != null ? request.locationHint() : "unknown");

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", aiConfig.model());
        payload.put("temperature", 0);
        payload.put("response_format", Map.of("type", "json_object"));
        payload.put("messages", List.of(
                Map.of("role", "system", "content", SYSTEM_PROMPT),
                Map.of("role", "user", "content", user)
        ));
        return payload;
    }

    private void configureConnection(HttpURLConnection connection) throws IOException {
        if (aiConfig.http() != null) {
            connection.setConnectTimeout(aiConfig.http().connectTimeout());
            connection.setReadTimeout(aiConfig.http().readTimeout());
            if (aiConfig.http().userAgent() != null) {
                connection.setRequestProperty("User-Agent", aiConfig.http().userAgent());
            }
        }

        connection.setRequestMethod("POST");
        connection.setRequestProperty("Authorization", "Bearer " + aiConfig.apiKey());
        connection.setRequestProperty("Content-Type", "application/json");
        connection.setRequestProperty("Accept", "application/json");

        connection.setUseCaches(false);
        connection.setDoInput(true);
        connection.setDoOutput(true);
    }

    private void validateHttpResponse(HttpURLConnection connection, String endpoint) throws IOException, ClassifierException {
        int responseCode = connection.getResponseCode();

        switch (responseCode) {
            case HttpURLConnection.HTTP_OK:
                break;

            case HttpURLConnection.HTTP_NOT_FOUND:
                throw new ClassifierException("Classifier endpoint not found (404): " + endpoint, ErrorCategory.NOT_FOUND);

            case HttpURLConnection.HTTP_FORBIDDEN:
                throw new ClassifierException("Access forbidden (403): " + endpoint, ErrorCategory.ACCESS_FORBIDDEN);

            case HttpURLConnection.HTTP_UNAUTHORIZED:
                throw new ClassifierException("Authentication required (401): " + endpoint, ErrorCategory.AUTH_REQUIRED);

            case 429:
                throw new ClassifierException("Rate limited (429): " + endpoint, ErrorCategory.RATE_LIMITED);

            case HttpURLConnection.HTTP_INTERNAL_ERROR:
                throw new ClassifierException("Server error (500): " + endpoint, ErrorCategory.SERVER_ERROR);

            case HttpURLConnection.HTTP_BAD_GATEWAY:
            case HttpURLConnection.HTTP_UNAVAILABLE:
            case HttpURLConnection.HTTP_GATEWAY_TIMEOUT:
                throw new ClassifierException("Classifier temporarily unavailable (" + responseCode + "): " + endpoint,
                        ErrorCategory.SERVER_UNAVAILABLE);

            default:
                if (responseCode >= 400) {
                    throw new ClassifierException(
                            String.format("HTTP error %d (%s): %s", responseCode, connection.getResponseMessage(), endpoint),
                            ErrorCategory.HTTP_ERROR
                    );
                }
        }
    }

    ClassifierResponse parseResponse(byte[] body) throws ClassifierException {
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode content = root.path("choices").path(0).path("message").path("content");
            if (!content.isTextual() || content.asText().isBlank()) {
                throw new ClassifierException("Classifier response has no message content", ErrorCategory.PARSE_ERROR);
            }

            ClassifierResponse response = objectMapper.readValue(content.asText(), ClassifierResponse.class);
            logger.debug("Classifier answered is_incident={} category={} confidence={}",
                    response.isIncident(), response.category(), response.confidence());
            return response;

        } catch (JsonProcessingException e) {
            throw new ClassifierException("Unreadable classifier response: " + e.getOriginalMessage(), e, ErrorCategory.PARSE_ERROR);
        } catch (IOException e) {
            throw new ClassifierException("I/O error reading classifier response", e, ErrorCategory.IO_ERROR);
        }
    }
}
