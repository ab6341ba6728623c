package com.shopsync.ordersync.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopsync.ordersync.model.ContentType;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Classifies a raw tracking payload so the normalizer can pick an extractor.
 */
@Service
public class ContentTypeDetector {

    private static final String[] HTML_MARKERS = {"<html", "<body", "<div", "<script"};

    private final ObjectMapper objectMapper;

    public ContentTypeDetector(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ContentType detect(String content) {
        if (content == null || content.isBlank()) {
            return ContentType.UNKNOWN;
        }

        String trimmed = content.stripLeading();

        if ((trimmed.startsWith("{") || trimmed.startsWith("[")) && isValidJson(trimmed)) {
            return ContentType.JSON;
        }

        // Any markup document with closing tags takes the XML path, including full HTML pages.
        if (trimmed.startsWith("<") && trimmed.contains("</") && trimmed.contains(">")) {
            return ContentType.XML;
        }

        String lower = trimmed.toLowerCase(Locale.ROOT);
        for (String marker : HTML_MARKERS) {
            if (lower.contains(marker)) {
                return ContentType.HTML;
            }
        }

        return ContentType.PLAIN_TEXT;
    }

    private boolean isValidJson(String candidate) {
        try {
            objectMapper.readTree(candidate);
            return true;
        } catch (JsonProcessingException e) {
            return false;
        }
    }
}
