package com.claimflow.extraction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-based field extraction over the transcribed text of a claim form.
 */
@Component
public class ClaimFieldExtractor {

    private static final Logger log = LoggerFactory.getLogger(ClaimFieldExtractor.class);

    private static final Pattern POLICY_NUMBER = Pattern.compile(
        "Policy No[:\\s]+([A-Z0-9\\-]+)", Pattern.CASE_INSENSITIVE);

    private static final Pattern CLAIM_AMOUNT = Pattern.compile(
        "Claim Amount[:\\s]+\\$?([\\d,]+\\.?\\d*)", Pattern.CASE_INSENSITIVE);

    // "Claimant:", "Insured Name:", a bare "Name:" and so on, then two or more capitalized words
    private static final Pattern PERSON = Pattern.compile(
        "\\b(?:(?:Claimant|Insured|Policyholder)(?:[ \\t]+Name)?|Name)[ \\t]*:[ \\t]*"
            + "([A-Z][a-z]+(?:[ \\t]+[A-Z][a-z]+)+)");

    private static final Pattern DATE = Pattern.compile(
        "\\b(\\d{1,2}/\\d{1,2}/\\d{4}"
            + "|\\d{4}-\\d{2}-\\d{2}"
            + "|(?:January|February|March|April|May|June|July|August|September|October|November|December)"
            + "[ \\t]+\\d{1,2},[ \\t]*\\d{4})\\b");

    public ExtractedEntities extract(String text) {
        return new ExtractedEntities(
            findAll(PERSON, text),
            findAll(DATE, text),
            findPolicyNumber(text),
            findClaimValue(text)
        );
    }

    private String findPolicyNumber(String text) {
        Matcher m = POLICY_NUMBER.matcher(text);
        return m.find() ? m.group(1).strip() : null;
    }

    private Double findClaimValue(String text) {
        Matcher m = CLAIM_AMOUNT.matcher(text);
        if (!m.find()) {
            return null;
        }
        String amount = m.group(1).replace(",", "");
        try {
            return Double.parseDouble(amount);
        } catch (NumberFormatException ex) {
            log.warn("Ignoring unparseable claim amount '{}'", m.group(1));
            return null;
        }
    }

    private List<String> findAll(Pattern pattern, String text) {
        Set<String> found = new LinkedHashSet<>();
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            found.add(m.group(1).strip());
        }
        return new ArrayList<>(found);
    }
}
