package com.shopsync.ordersync.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopsync.ordersync.model.ContentType;
import com.shopsync.ordersync.model.NormalizedContent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ContentNormalizerTest {

    private static final int MAX_LENGTH = 2000;

    private ContentNormalizer normalizer;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        normalizer = new ContentNormalizer(
                new ContentTypeDetector(objectMapper),
                new JsonFieldExtractor(objectMapper),
                new PatternFallbackExtractor(),
                new XmlTagExtractor(),
                new HtmlTextExtractor(),
                new IntelligentTruncator(),
                MAX_LENGTH,
                1500);
    }

    @Test
    void smallJsonKeepsTaggedStatusAndLocation() {
        NormalizedContent content = normalizer.analyze("{\"status\":\"In Transit\",\"city\":\"Lahore\"}");

        assertThat(content.contentType()).isEqualTo(ContentType.JSON);
        assertThat(content.text())
                .containsPattern("\\[STATUS\\][^\\n]*In Transit")
                .containsPattern("\\[LOCATION\\][^\\n]*Lahore");
        assertThat(content.length()).isLessThanOrEqualTo(MAX_LENGTH);
    }

    @Test
    void jsonWithoutKnownFieldsFallsBackToCleanedRaw() {
        NormalizedContent content = normalizer.analyze("{\n  \"foo\": \"bar\",\n  \"baz\": 1\n}");

        assertThat(content.extractedBy()).isEqualTo("cleaned-raw");
        assertThat(content.text()).isEqualTo("{ \"foo\": \"bar\", \"baz\": 1 }");
    }

    @Test
    void cleanedRawJsonIsCappedAtItsOwnCeiling() {
        StringBuilder json = new StringBuilder("{");
        for (int i = 0; i < 400; i++) {
            json.append("\"k").append(i).append("\":").append(i).append(',');
        }
        json.append("\"end\":0}");

        NormalizedContent content = normalizer.analyze(json.toString());

        assertThat(content.extractedBy()).isEqualTo("cleaned-raw");
        assertThat(content.length()).isEqualTo(ContentNormalizer.CLEANED_RAW_MAX_LENGTH);
    }

    @Test
    void richJsonUsesStructuredExtraction() {
        String json = "{\"data\":{\"status\":\"Out for delivery\",\"current_location\":\"Lahore Hub\","
                + "\"updated_at\":\"2024-05-09 10:15\",\"remarks\":\"Rider assigned\"}}";

        NormalizedContent content = normalizer.analyze(json);

        assertThat(content.extractedBy()).isEqualTo("json-fields");
        assertThat(content.text()).contains("[STATUS] status: Out for delivery")
                .contains("[LOCATION] current_location: Lahore Hub")
                .contains("[TIME] updated_at: 2024-05-09 10:15")
                .contains("[DETAILS] remarks: Rider assigned");
    }

    @Test
    void xmlTrackingElementsAreJoinedByNewline() {
        String xml = "<?xml version=\"1.0\"?><tracking><status>In Transit</status>"
                + "<location>Karachi &amp; Hub</location><carrier>TCS</carrier></tracking>";

        NormalizedContent content = normalizer.analyze(xml);

        assertThat(content.contentType()).isEqualTo(ContentType.XML);
        assertThat(content.text()).isEqualTo("In Transit\nKarachi & Hub");
    }

    @Test
    void xmlWithoutTrackingElementsIsReadAsText() {
        NormalizedContent content = normalizer.analyze("<shipment><carrier>TCS</carrier><ref>A1</ref></shipment>");

        assertThat(content.contentType()).isEqualTo(ContentType.XML);
        assertThat(content.extractedBy()).isEqualTo("plain-text");
        assertThat(content.text()).isEqualTo("<shipment><carrier>TCS</carrier><ref>A1</ref></shipment>");
    }

    @Test
    void htmlPageWithTrackingElementsUsesElementText() {
        NormalizedContent content = normalizer.analyze(
                "<html><body><status>Delivered</status><p>Call us 0800</p></body></html>");

        assertThat(content.contentType()).isEqualTo(ContentType.XML);
        assertThat(content.extractedBy()).isEqualTo("xml-tags");
        assertThat(content.text()).isEqualTo("Delivered");
    }

    @Test
    void htmlDropsScriptsStylesAndComments() {
        String html = "Tracking result\n<html><head><script>var secret = 1;</script><style>.x { color: red }</style></head>"
                + "<body><!-- hidden --><div>Status:   Delivered &amp; signed</div></body></html>";

        NormalizedContent content = normalizer.analyze(html);

        assertThat(content.contentType()).isEqualTo(ContentType.HTML);
        assertThat(content.text()).isEqualTo("Tracking result Status: Delivered & signed");
    }

    @Test
    void longPlainTextIsBounded() {
        String text = "Lorem ipsum dolor sit amet ".repeat(1000);

        NormalizedContent content = normalizer.analyze(text);

        assertThat(content.contentType()).isEqualTo(ContentType.PLAIN_TEXT);
        assertThat(content.length()).isLessThanOrEqualTo(1500);
        assertThat(content.originalLength()).isEqualTo(text.length());
    }

    @Test
    void blankPayloadNormalizesToEmpty() {
        assertThat(normalizer.normalize("   ")).isEmpty();
        assertThat(normalizer.normalize(null)).isEmpty();
    }

    @Test
    void hardCeilingAppliesWhenExtractionLimitIsLarger() {
        ObjectMapper objectMapper = new ObjectMapper();
        ContentNormalizer tight = new ContentNormalizer(
                new ContentTypeDetector(objectMapper),
                new JsonFieldExtractor(objectMapper),
                new PatternFallbackExtractor(),
                new XmlTagExtractor(),
                new HtmlTextExtractor(),
                new IntelligentTruncator(),
                100,
                5000);

        assertThat(tight.normalize("word ".repeat(500)).length()).isLessThanOrEqualTo(100);
    }
}
