package com.claimflow.extraction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Extracts claim fields from an already-transcribed claim document (UTF-8 text).
 *
 * Text shorter than {@value #MIN_TEXT_LENGTH} characters after trimming is treated
 * as a blank or unreadable scan.
 */
@Component
public class TranscriptDocumentExtractor implements DocumentExtractor {

    private static final Logger log = LoggerFactory.getLogger(TranscriptDocumentExtractor.class);

    static final int MIN_TEXT_LENGTH = 50;

    private final ClaimFieldExtractor fieldExtractor;

    public TranscriptDocumentExtractor(ClaimFieldExtractor fieldExtractor) {
        this.fieldExtractor = fieldExtractor;
    }

    @Override
    public ExtractionOutcome extract(Path document) {
        log.info("Starting document processing for: {}", document);
        if (document == null || !Files.isRegularFile(document) || !Files.isReadable(document)) {
            log.error("Document not found or not readable: {}", document);
            return new ExtractionOutcome.Unreadable("document not found: " + document);
        }

        String text;
        try {
            text = Files.readString(document, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            log.error("Failed to read document {}", document, ex);
            return new ExtractionOutcome.Unreadable("document could not be read: " + ex.getMessage());
        }
        return extractText(text);
    }

    @Override
    public ExtractionOutcome extractText(String rawText) {
        if (rawText == null || rawText.strip().length() < MIN_TEXT_LENGTH) {
            log.warn("Insufficient text extracted; the document might be blank or unreadable");
            return new ExtractionOutcome.Unreadable("insufficient text");
        }

        ExtractedEntities entities = fieldExtractor.extract(rawText);
        log.info("Extracted entities: policy_number={}, claim_value={}, persons={}, dates={}",
            entities.policyNumber(), entities.claimValue(),
            entities.personNames().size(), entities.dates().size());
        return new ExtractionOutcome.Extracted(entities, rawText);
    }
}
