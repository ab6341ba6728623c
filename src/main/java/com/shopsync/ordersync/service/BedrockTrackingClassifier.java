package com.shopsync.ordersync.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.util.concurrent.RateLimiter;
import com.shopsync.ordersync.model.TrackingAnalysisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.BedrockRuntimeException;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Classifies tracking text with a chat model hosted on Amazon Bedrock.
 * <p>
 * Empty, non-JSON or failed responses become {@link TrackingAnalysisResult#unclassified(String)};
 * a JSON verdict missing its fields falls back to In-Transit / Yellow.
 */
@Service
public class BedrockTrackingClassifier implements TrackingClassifier {

    private static final Logger logger = LoggerFactory.getLogger(BedrockTrackingClassifier.class);

    private final BedrockRuntimeClient bedrockClient;
    private final ObjectMapper objectMapper;
    private final ClassifierResultNormalizer resultNormalizer;
    private final RateLimiter classifierRateLimiter;
    private final String modelId;
    private final int maxTokens;
    private final String promptTemplate;

    @SuppressWarnings("UnstableApiUsage")
    public BedrockTrackingClassifier(BedrockRuntimeClient bedrockClient,
                                     ObjectMapper objectMapper,
                                     ClassifierResultNormalizer resultNormalizer,
                                     @Qualifier("classifierRateLimiter") RateLimiter classifierRateLimiter,
                                     @Value("${aws.bedrock.modelId}") String modelId,
                                     @Value("${app.bedrock.maxTokens:150}") int maxTokens) {
        this.bedrockClient = bedrockClient;
        this.objectMapper = objectMapper;
        this.resultNormalizer = resultNormalizer;
        this.classifierRateLimiter = classifierRateLimiter;
        this.modelId = modelId;
        this.maxTokens = Math.max(64, maxTokens);
        this.promptTemplate = loadPromptTemplate();
        logger.info("BedrockTrackingClassifier initialized with model ID: {}", modelId);
    }

    @Override
    @SuppressWarnings("UnstableApiUsage")
    public TrackingAnalysisResult classify(String normalizedText) {
        if (normalizedText == null || normalizedText.isBlank()) {
            return TrackingAnalysisResult.unclassified("No tracking text to classify");
        }

        try {
            InvokeModelRequest request = buildRequest(promptTemplate.replace("{tracking_text}", normalizedText));
            classifierRateLimiter.acquire();
            InvokeModelResponse response = invokeWithRetry(request);
            return parseResponse(response.body().asUtf8String());
        } catch (ThrottledException te) {
            throw te;
        } catch (BedrockRuntimeException e) {
            String message = e.awsErrorDetails() != null ? e.awsErrorDetails().errorMessage() : e.getMessage();
            logger.error("Bedrock API error during tracking classification for model {}: {}", modelId, message, e);
            return TrackingAnalysisResult.unclassified("Bedrock API error: " + message);
        } catch (Exception e) {
            logger.error("Unexpected error during tracking classification: {}", e.getMessage(), e);
            return TrackingAnalysisResult.unclassified("Unexpected error during classification: " + e.getMessage());
        }
    }

    private InvokeModelRequest buildRequest(String prompt) throws JsonProcessingException {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("anthropic_version", "bedrock-2023-05-31");
        payload.put("max_tokens", maxTokens);
        payload.put("temperature", 0.3);
        ObjectNode userMessage = objectMapper.createObjectNode();
        userMessage.put("role", "user");
        userMessage.put("content", prompt);
        payload.putArray("messages").add(userMessage);

        return InvokeModelRequest.builder()
                .modelId(modelId)
                .contentType("application/json")
                .accept("application/json")
                .body(SdkBytes.fromUtf8String(objectMapper.writeValueAsString(payload)))
                .build();
    }

    /**
     * Reads the model's text block and pulls the verdict object out of it.
     */
    TrackingAnalysisResult parseResponse(String responseBody) {
        String text;
        try {
            JsonNode content = objectMapper.readTree(responseBody).path("content");
            text = content.isArray() && content.size() > 0 ? content.get(0).path("text").asText("") : "";
        } catch (JsonProcessingException e) {
            logger.warn("Bedrock response body is not JSON: {}", e.getOriginalMessage());
            return TrackingAnalysisResult.unclassified("Malformed classifier response");
        }
        return parseVerdict(text);
    }

    TrackingAnalysisResult parseVerdict(String modelText) {
        String text = stripJsonFences(modelText);
        if (text == null || text.isBlank()) {
            logger.warn("Classifier returned an empty response.");
            return TrackingAnalysisResult.unclassified("Empty classifier response");
        }

        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            logger.warn("Classifier response contains no JSON object: {}", text);
            return TrackingAnalysisResult.unclassified("Could not parse classifier response");
        }

        try {
            JsonNode verdict = objectMapper.readTree(text.substring(start, end + 1));
            String status = verdict.path("status").asText("");
            String color = verdict.path("color").asText("");
            return resultNormalizer.normalize(status, color, null);
        } catch (JsonProcessingException e) {
            logger.warn("Failed to parse classifier verdict {}: {}", text, e.getOriginalMessage());
            return TrackingAnalysisResult.unclassified("Could not parse classifier response");
        }
    }

    private String stripJsonFences(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (trimmed.startsWith("```") && trimmed.endsWith("```") && trimmed.length() >= 6) {
            trimmed = trimmed.substring(3, trimmed.length() - 3).trim();
            if (trimmed.startsWith("json")) {
                trimmed = trimmed.substring(4).trim();
            }
        }
        return trimmed;
    }

    /**
     * Repeatedly invokes Bedrock with exponential backoff, surfacing throttling as {@link ThrottledException}.
     */
    private InvokeModelResponse invokeWithRetry(InvokeModelRequest request) {
        final int maxAttempts = 4;
        final long baseBackoffMs = 800L;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return bedrockClient.invokeModel(request);
            } catch (BedrockRuntimeException e) {
                String code = e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : null;
                boolean throttled = e.statusCode() == 429
                        || "ThrottlingException".equalsIgnoreCase(code)
                        || "TooManyRequestsException".equalsIgnoreCase(code);

                if (!throttled) {
                    throw e;
                }
                if (attempt == maxAttempts) {
                    logger.warn("Bedrock throttled after {} attempts; surfacing throttling.", maxAttempts);
                    throw new ThrottledException("Bedrock throttling after retries", e);
                }

                long jitter = ThreadLocalRandom.current().nextLong(50, 200);
                long sleepMs = (long) Math.min(10_000, baseBackoffMs * Math.pow(2, attempt - 1) + jitter);
                logger.warn("Bedrock throttled (attempt {}/{}). Backing off for {} ms.", attempt, maxAttempts, sleepMs);
                try {
                    Thread.sleep(sleepMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new ThrottledException("Interrupted during backoff", ie);
                }
            }
        }
        throw new IllegalStateException("Unreachable");
    }

    private String loadPromptTemplate() {
        try {
            ClassPathResource resource = new ClassPathResource("prompts/tracking_classifier_prompt.txt");
            byte[] bytes = resource.getInputStream().readAllBytes();
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.warn("Failed to load tracking classifier prompt template: {}", e.getMessage());
            return "Classify this courier tracking information. Return ONLY JSON {\"status\": \"...\", \"color\": \"...\"} "
                    + "with status one of Delivered, In-Transit, Stuck, Failed, Return, Customer Not Picking Phone "
                    + "and color one of Green, Yellow, Orange, Red.\n\n{tracking_text}";
        }
    }
}
