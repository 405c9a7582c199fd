package com.claimflow.extraction;

import java.nio.file.Path;

/**
 * Turns a claim document into entities and raw text.
 * Implementations report unreadable input as {@link ExtractionOutcome.Unreadable}
 * and never throw.
 */
public interface DocumentExtractor {

    ExtractionOutcome extract(Path document);

    ExtractionOutcome extractText(String rawText);
}
