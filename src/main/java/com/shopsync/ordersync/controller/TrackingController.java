package com.shopsync.ordersync.controller;

import com.shopsync.ordersync.dto.AnalyzeRequest;
import com.shopsync.ordersync.dto.NormalizeResponse;
import com.shopsync.ordersync.model.TrackingAnalysisResult;
import com.shopsync.ordersync.service.ContentNormalizer;
import com.shopsync.ordersync.service.TrackingAnalysisService;
import com.shopsync.ordersync.service.TrackingFetchException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/tracking")
@Tag(name = "Tracking", description = "Courier tracking payload normalization and classification")
public class TrackingController {

    private final ContentNormalizer contentNormalizer;
    private final TrackingAnalysisService trackingAnalysisService;

    public TrackingController(ContentNormalizer contentNormalizer,
                              TrackingAnalysisService trackingAnalysisService) {
        this.contentNormalizer = contentNormalizer;
        this.trackingAnalysisService = trackingAnalysisService;
    }

    @Operation(
            summary = "Normalize a raw tracking payload",
            description = "Detects JSON, XML, HTML or plain text and reduces the payload to bounded tracking text."
    )
    @PostMapping("/normalize")
    public ResponseEntity<NormalizeResponse> normalize(
            @Parameter(description = "Raw courier response body")
            @RequestBody(required = false) String payload) {
        return ResponseEntity.ok(NormalizeResponse.from(contentNormalizer.analyze(payload)));
    }

    @Operation(
            summary = "Classify a tracking URL",
            description = "Downloads the tracking payload (through a configured courier API when one matches), " +
                    "normalizes it and returns the classifier verdict."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Verdict returned; unclassifiable payloads carry an error message"),
            @ApiResponse(responseCode = "400", description = "Missing tracking URL"),
            @ApiResponse(responseCode = "502", description = "Tracking payload could not be downloaded")
    })
    @PostMapping("/analyze")
    public ResponseEntity<?> analyze(@RequestBody(required = false) AnalyzeRequest request) {
        if (request == null || !StringUtils.hasText(request.getTrackingUrl())) {
            return ResponseEntity.badRequest().body(Map.of("error", "tracking_url is required"));
        }
        try {
            TrackingAnalysisResult result = trackingAnalysisService.analyzeUrl(request.getTrackingUrl().trim());
            return ResponseEntity.ok(result);
        } catch (TrackingFetchException e) {
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(Map.of("error", e.getMessage()));
        }
    }
}
