package com.claimflow.api;

import com.claimflow.pipeline.ClaimsPipeline;
import com.claimflow.pipeline.PipelineResult;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * POST /v1/claims
 *
 * Runs a transcribed claim document through the decision pipeline.
 *
 * Expected request body:
 * {
 *   "document_text": "Claimant Name: ... Policy No: PN-AUTO-1001 ..."
 * }
 *
 * Responds 200 for both "Success" and "Failed" results.
 */
@RestController
@RequestMapping("/v1/claims")
public class ClaimController {

    private final ClaimsPipeline pipeline;

    public ClaimController(ClaimsPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @PostMapping
    public PipelineResult process(@RequestBody Map<String, Object> request) {
        String documentText = RequestFields.requireString(request, "document_text");
        return pipeline.processText(documentText);
    }
}
