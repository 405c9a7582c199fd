package com.claimflow.classification;

/**
 * Statistical claim-type classifier. Returns {@link ClassificationResult#unclassified()}
 * rather than throwing when the text cannot be classified.
 */
@FunctionalInterface
public interface ClaimClassifier {

    ClassificationResult classify(String claimText);
}
