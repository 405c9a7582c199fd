package com.claimflow.extraction;

/**
 * What the extraction collaborator hands back for one document: either the
 * entities plus the raw text they were read from, or the reason nothing usable
 * came out.
 */
public sealed interface ExtractionOutcome {

    record Extracted(ExtractedEntities entities, String rawText) implements ExtractionOutcome {}

    record Unreadable(String reason) implements ExtractionOutcome {}
}
