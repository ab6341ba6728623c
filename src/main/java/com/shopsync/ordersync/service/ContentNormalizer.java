package com.shopsync.ordersync.service;

import com.shopsync.ordersync.model.ContentType;
import com.shopsync.ordersync.model.NormalizedContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Turns an arbitrary courier tracking payload into bounded text for the classifier.
 * Whatever path produced the text, the result never exceeds {@code app.content.max-length}.
 */
@Service
public class ContentNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(ContentNormalizer.class);

    static final int MIN_SIGNAL_LENGTH = 50;
    static final int CLEANED_RAW_MAX_LENGTH = 1000;

    private final ContentTypeDetector contentTypeDetector;
    private final JsonFieldExtractor jsonFieldExtractor;
    private final PatternFallbackExtractor patternFallbackExtractor;
    private final XmlTagExtractor xmlTagExtractor;
    private final HtmlTextExtractor htmlTextExtractor;
    private final IntelligentTruncator truncator;
    private final int maxLength;
    private final int extractMaxLength;

    public ContentNormalizer(ContentTypeDetector contentTypeDetector,
                             JsonFieldExtractor jsonFieldExtractor,
                             PatternFallbackExtractor patternFallbackExtractor,
                             XmlTagExtractor xmlTagExtractor,
                             HtmlTextExtractor htmlTextExtractor,
                             IntelligentTruncator truncator,
                             @Value("${app.content.max-length:2000}") int maxLength,
                             @Value("${app.content.extract-max-length:1500}") int extractMaxLength) {
        this.contentTypeDetector = contentTypeDetector;
        this.jsonFieldExtractor = jsonFieldExtractor;
        this.patternFallbackExtractor = patternFallbackExtractor;
        this.xmlTagExtractor = xmlTagExtractor;
        this.htmlTextExtractor = htmlTextExtractor;
        this.truncator = truncator;
        this.maxLength = Math.max(1, maxLength);
        this.extractMaxLength = Math.min(this.maxLength, Math.max(1, extractMaxLength));
    }

    public String normalize(String rawPayload) {
        return analyze(rawPayload).text();
    }

    public NormalizedContent analyze(String rawPayload) {
        ContentType type = contentTypeDetector.detect(rawPayload);
        int originalLength = rawPayload == null ? 0 : rawPayload.length();

        Extraction extraction = switch (type) {
            case JSON -> extractJson(rawPayload);
            case XML -> extractXml(rawPayload);
            case HTML -> new Extraction(htmlTextExtractor.name(),
                    truncator.truncate(htmlTextExtractor.extract(rawPayload), extractMaxLength));
            case PLAIN_TEXT -> plainText(rawPayload);
            case UNKNOWN -> new Extraction("none", "");
        };

        String text = extraction.text();
        if (text.length() > maxLength) {
            logger.debug("Normalized {} output still {} chars, cutting to {}", type, text.length(), maxLength);
            text = text.substring(0, maxLength);
        }
        logger.debug("Normalized {} payload via {}: {} -> {} chars", type, extraction.strategy(), originalLength, text.length());
        return new NormalizedContent(type, text, originalLength, extraction.strategy());
    }

    /**
     * Structured fields, then regex patterns, then the whitespace-collapsed payload. The first
     * strategy carrying enough signal wins; short structured output still beats raw JSON.
     */
    private Extraction extractJson(String payload) {
        List<ExtractionStrategy> cascade = List.of(jsonFieldExtractor, patternFallbackExtractor);
        Extraction weak = null;
        for (ExtractionStrategy strategy : cascade) {
            String result = strategy.extract(payload).trim();
            if (result.length() >= MIN_SIGNAL_LENGTH) {
                return new Extraction(strategy.name(), cut(result, extractMaxLength));
            }
            if (weak == null && !result.isEmpty()) {
                weak = new Extraction(strategy.name(), result);
            }
            logger.debug("Strategy {} yielded only {} chars", strategy.name(), result.length());
        }
        if (weak != null) {
            return new Extraction(weak.strategy(), cut(weak.text(), extractMaxLength));
        }
        return new Extraction("cleaned-raw", cut(HtmlTextExtractor.collapseWhitespace(payload), CLEANED_RAW_MAX_LENGTH));
    }

    private Extraction extractXml(String payload) {
        String result = xmlTagExtractor.extract(payload);
        if (!result.isBlank()) {
            return new Extraction(xmlTagExtractor.name(), truncator.truncate(result, extractMaxLength));
        }
        // No tracking elements: handled exactly like plain text.
        return plainText(payload);
    }

    private Extraction plainText(String payload) {
        return new Extraction("plain-text",
                truncator.truncate(HtmlTextExtractor.collapseWhitespace(payload), extractMaxLength));
    }

    private static String cut(String text, int limit) {
        return text.length() > limit ? text.substring(0, limit) : text;
    }

    private record Extraction(String strategy, String text) {
    }
}
