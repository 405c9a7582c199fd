package com.claimflow.pipeline;

import com.claimflow.classification.ClaimClassifier;
import com.claimflow.classification.ClassificationResult;
import com.claimflow.compliance.ComplianceEngine;
import com.claimflow.compliance.ComplianceResult;
import com.claimflow.extraction.DocumentExtractor;
import com.claimflow.extraction.ExtractionOutcome;
import com.claimflow.routing.ClaimRecord;
import com.claimflow.routing.RoutingDecision;
import com.claimflow.routing.RoutingEngine;
import com.claimflow.routing.RoutingThresholds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Runs one claim through extraction, classification, compliance and routing.
 *
 * State machine:
 * EXTRACTING -> CLASSIFYING -> CHECKING_COMPLIANCE -> ROUTING -> DONE,
 * with FAILED reachable from any stage.
 *
 * Only extraction and classification can fail the run. Once compliance is
 * reached the run always completes, because both engines return a result for
 * every input. Nothing is retried; every failure is reported once as a
 * {@link PipelineResult.Failed}.
 *
 * The pipeline holds no per-run state, so one instance serves concurrent callers.
 */
@Service
public class ClaimsPipeline {

    private static final Logger log = LoggerFactory.getLogger(ClaimsPipeline.class);

    static final String MDC_RUN_ID = "claimRunId";

    static final String EXTRACTION_FAILED_REASON =
        "Could not process document. The image may be unreadable or blank.";
    static final String CLASSIFICATION_FAILED_REASON =
        "Could not classify the claim from the text.";

    private final DocumentExtractor extractor;
    private final ClaimClassifier classifier;
    private final ComplianceEngine complianceEngine;
    private final RoutingEngine routingEngine;
    private final RoutingThresholds thresholds;

    public ClaimsPipeline(DocumentExtractor extractor,
                          ClaimClassifier classifier,
                          ComplianceEngine complianceEngine,
                          RoutingEngine routingEngine,
                          RoutingThresholds thresholds) {
        this.extractor = extractor;
        this.classifier = classifier;
        this.complianceEngine = complianceEngine;
        this.routingEngine = routingEngine;
        this.thresholds = thresholds;
        log.info("ClaimsPipeline initialized");
    }

    /** Processes a claim document stored at {@code document}. */
    public PipelineResult process(Path document) {
        return run(String.valueOf(document), () -> extractor.extract(document));
    }

    /** Processes a claim whose document text has already been transcribed. */
    public PipelineResult processText(String documentText) {
        return run("inline text", () -> extractor.extractText(documentText));
    }

    private PipelineResult run(String source, Supplier<ExtractionOutcome> extraction) {
        String runId = "claim-" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put(MDC_RUN_ID, runId);
        PipelineState state = PipelineState.EXTRACTING;
        try {
            log.info("Pipeline run {} started for {}", runId, source);

            ExtractionOutcome.Extracted document = null;
            ClassificationResult classification = null;
            ComplianceResult compliance = null;
            RoutingDecision routing = null;
            PipelineResult.Failed failure = null;

            while (!state.isTerminal()) {
                log.debug("Pipeline run {} entering {}", runId, state);
                switch (state) {
                    case EXTRACTING -> {
                        StageResult<ExtractionOutcome.Extracted> result = extract(extraction);
                        if (result instanceof StageResult.Failure<?> stageFailure) {
                            failure = fail(state, stageFailure.reason());
                            state = PipelineState.FAILED;
                        } else {
                            document = result.value();
                            state = PipelineState.CLASSIFYING;
                        }
                    }
                    case CLASSIFYING -> {
                        StageResult<ClassificationResult> result = classify(document.rawText());
                        if (result instanceof StageResult.Failure<?> stageFailure) {
                            failure = fail(state, stageFailure.reason());
                            state = PipelineState.FAILED;
                        } else {
                            classification = result.value();
                            state = PipelineState.CHECKING_COMPLIANCE;
                        }
                    }
                    case CHECKING_COMPLIANCE -> {
                        compliance = complianceEngine.checkCompliance(
                            document.entities().policyNumber(),
                            classification.claimType(),
                            document.rawText());
                        state = PipelineState.ROUTING;
                    }
                    case ROUTING -> {
                        routing = routingEngine.route(
                            new ClaimRecord(document.entities(), classification, compliance),
                            thresholds);
                        state = PipelineState.DONE;
                    }
                    default -> throw new IllegalStateException("unexpected pipeline state " + state);
                }
            }

            if (state == PipelineState.FAILED) {
                return failure;
            }

            log.info("Pipeline run {} done: decision={}", runId, routing.decision());
            return new PipelineResult.Completed(
                document.entities(),
                PipelineResult.ClassificationSummary.of(classification),
                compliance,
                routing);
        } catch (RuntimeException ex) {
            log.error("A critical error occurred in pipeline run {} during {}", runId, state, ex);
            return new PipelineResult.Failed(state, "An unexpected error occurred: " + ex.getMessage());
        } finally {
            MDC.remove(MDC_RUN_ID);
        }
    }

    private StageResult<ExtractionOutcome.Extracted> extract(Supplier<ExtractionOutcome> extraction) {
        ExtractionOutcome outcome = extraction.get();
        if (outcome instanceof ExtractionOutcome.Extracted extracted
                && extracted.entities() != null
                && extracted.rawText() != null
                && !extracted.rawText().isBlank()) {
            return StageResult.success(extracted);
        }
        if (outcome instanceof ExtractionOutcome.Unreadable unreadable) {
            log.warn("Document processing failed: {}", unreadable.reason());
        } else {
            log.warn("Document processing failed: no entities or text extracted");
        }
        return StageResult.failure(EXTRACTION_FAILED_REASON);
    }

    private StageResult<ClassificationResult> classify(String text) {
        ClassificationResult result = classifier.classify(text);
        if (result == null || !result.isClassified()) {
            log.warn("Claim classification failed");
            return StageResult.failure(CLASSIFICATION_FAILED_REASON);
        }
        return StageResult.success(result);
    }

    private PipelineResult.Failed fail(PipelineState stage, String reason) {
        log.warn("Pipeline failed during {}: {}", stage, reason);
        return new PipelineResult.Failed(stage, reason);
    }
}
