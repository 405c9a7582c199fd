package com.claimflow.classification;

import com.claimflow.config.ClaimsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import weka.classifiers.bayes.NaiveBayesMultinomial;
import weka.classifiers.meta.FilteredClassifier;
import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instance;
import weka.core.Instances;
import weka.core.Utils;
import weka.filters.unsupervised.attribute.StringToWordVector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Multinomial naive Bayes over TF-IDF weighted words, built on Weka's
 * {@link StringToWordVector} and {@link NaiveBayesMultinomial}.
 *
 * Trained once in the constructor. Weka filters keep state between calls, so
 * {@link #classify(String)} serializes access to the model. Words never seen in
 * training carry no weight, which leaves the class priors to decide.
 */
public class NaiveBayesClaimClassifier implements ClaimClassifier {

    private static final Logger log = LoggerFactory.getLogger(NaiveBayesClaimClassifier.class);

    private static final Pattern NON_WORD = Pattern.compile("[^a-z0-9]+");
    private static final String RELATION = "claims";
    private static final int TEXT_INDEX = 0;
    private static final int CLASS_INDEX = 1;

    // sorted so ties resolve the same way on every run
    private final List<String> labels;
    private final FilteredClassifier model;

    public NaiveBayesClaimClassifier(List<ClaimsConfig.TrainingSample> samples) {
        if (samples == null || samples.size() < 2) {
            throw new IllegalArgumentException("at least 2 training samples are required");
        }

        TreeSet<String> sorted = new TreeSet<>();
        for (ClaimsConfig.TrainingSample sample : samples) {
            sorted.add(sample.claimType());
        }
        this.labels = List.copyOf(sorted);

        Instances training = emptyDataset(samples.size());
        for (ClaimsConfig.TrainingSample sample : samples) {
            double[] values = new double[2];
            values[TEXT_INDEX] = training.attribute(TEXT_INDEX).addStringValue(normalize(sample.description()));
            values[CLASS_INDEX] = labels.indexOf(sample.claimType());
            training.add(new DenseInstance(1.0, values));
        }

        this.model = new FilteredClassifier();
        model.setFilter(wordVector());
        model.setClassifier(new NaiveBayesMultinomial());
        try {
            model.buildClassifier(training);
        } catch (Exception e) {
            throw new IllegalStateException("failed to train claim classification model", e);
        }

        log.info("Claim classification model trained: {} labels, {} samples", labels.size(), samples.size());
    }

    @Override
    public ClassificationResult classify(String claimText) {
        if (claimText == null || claimText.isBlank()) {
            log.warn("Blank claim text; cannot classify");
            return ClassificationResult.unclassified();
        }

        String normalized = normalize(claimText);
        if (normalized.isEmpty()) {
            log.warn("Claim text contains no words; cannot classify");
            return ClassificationResult.unclassified();
        }

        double[] distribution;
        try {
            Instances dataset = emptyDataset(1);
            double[] values = {dataset.attribute(TEXT_INDEX).addStringValue(normalized), Utils.missingValue()};
            Instance instance = new DenseInstance(1.0, values);
            instance.setDataset(dataset);
            synchronized (model) {
                distribution = model.distributionForInstance(instance);
            }
        } catch (Exception e) {
            log.error("Failed to classify claim: {}", e.getMessage(), e);
            return ClassificationResult.unclassified();
        }

        int best = Utils.maxIndex(distribution);
        String claimType = labels.get(best);
        double confidence = Math.max(0.0, Math.min(1.0, distribution[best]));

        Priority priority = PriorityResolver.resolve(claimText);
        log.info("Claim classified as type={}, priority={}, confidence={}",
            claimType, priority.getValue(), String.format(Locale.ROOT, "%.2f", confidence));
        return new ClassificationResult(claimType, confidence, priority);
    }

    public Set<String> labels() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(labels));
    }

    /** Lower-cases and collapses every run of non-alphanumerics into one space. */
    static String normalize(String text) {
        return NON_WORD.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    // fresh attributes per dataset; string values are not shared between calls
    private Instances emptyDataset(int capacity) {
        ArrayList<Attribute> attributes = new ArrayList<>(2);
        attributes.add(new Attribute("text", (List<String>) null));
        attributes.add(new Attribute("claim_type", new ArrayList<>(labels)));
        Instances dataset = new Instances(RELATION, attributes, capacity);
        dataset.setClassIndex(CLASS_INDEX);
        return dataset;
    }

    private static StringToWordVector wordVector() {
        StringToWordVector vector = new StringToWordVector();
        vector.setAttributeIndices("first");
        vector.setLowerCaseTokens(true);
        vector.setOutputWordCounts(true);
        vector.setTFTransform(true);
        vector.setIDFTransform(true);
        vector.setWordsToKeep(100_000);
        return vector;
    }
}
