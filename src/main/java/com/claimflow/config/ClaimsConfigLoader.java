package com.claimflow.config;

import com.claimflow.policy.Policy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and validates the claims configuration document.
 *
 * Loading happens once, at startup. Any missing section or out-of-range value
 * raises {@link ConfigurationException}; there is no partial configuration.
 */
public class ClaimsConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ClaimsConfigLoader.class);

    private static final int MIN_TRAINING_SAMPLES = 2;

    private final ObjectMapper objectMapper;

    public ClaimsConfigLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ClaimsConfig load(Resource resource) {
        if (resource == null || !resource.exists()) {
            throw new ConfigurationException("configuration document not found: "
                + (resource != null ? resource.getDescription() : "null"));
        }

        ClaimsConfig raw;
        try (InputStream in = resource.getInputStream()) {
            raw = objectMapper.readValue(in, ClaimsConfig.class);
        } catch (JsonProcessingException ex) {
            throw new ConfigurationException("invalid configuration document format: "
                + ex.getOriginalMessage(), ex);
        } catch (FileNotFoundException ex) {
            throw new ConfigurationException("configuration document not found: "
                + resource.getDescription(), ex);
        } catch (IOException ex) {
            throw new ConfigurationException("configuration document could not be read: "
                + resource.getDescription(), ex);
        }

        ClaimsConfig config = validate(raw);
        log.info("Loaded claims configuration from {}: {} policies, {} training samples",
            resource.getDescription(), config.policyDb().size(), config.trainingData().size());
        return config;
    }

    private ClaimsConfig validate(ClaimsConfig raw) {
        if (raw == null) {
            throw new ConfigurationException("configuration document is empty");
        }

        Map<String, ClaimsConfig.PolicyDefinition> policyDb = validatePolicyDb(raw.policyDb());

        Double confidenceThreshold = raw.confidenceThreshold();
        if (confidenceThreshold == null) {
            throw new ConfigurationException("confidence_threshold is required");
        }
        if (confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
            throw new ConfigurationException("confidence_threshold must be within [0, 1]: " + confidenceThreshold);
        }

        ClaimsConfig.RoutingRules routingRules = validateRoutingRules(raw.routingRules());
        List<ClaimsConfig.TrainingSample> trainingData = validateTrainingData(raw.trainingData());

        return new ClaimsConfig(policyDb, confidenceThreshold, routingRules, trainingData);
    }

    private Map<String, ClaimsConfig.PolicyDefinition> validatePolicyDb(
            Map<String, ClaimsConfig.PolicyDefinition> policyDb) {
        if (policyDb == null) {
            throw new ConfigurationException("policy_db is required");
        }

        Map<String, ClaimsConfig.PolicyDefinition> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ClaimsConfig.PolicyDefinition> entry : policyDb.entrySet()) {
            String policyId = entry.getKey();
            if (!Policy.ID_FORMAT.matcher(policyId).matches()) {
                throw new ConfigurationException("policy_db contains malformed policy id: " + policyId);
            }
            ClaimsConfig.PolicyDefinition definition = entry.getValue();
            if (definition == null || definition.coverage() == null) {
                throw new ConfigurationException("policy_db." + policyId + ".coverage is required");
            }
            if (definition.exclusions() == null) {
                throw new ConfigurationException("policy_db." + policyId + ".exclusions is required");
            }
            if (definition.coverage().contains(null) || definition.exclusions().contains(null)) {
                throw new ConfigurationException("policy_db." + policyId + " contains null entries");
            }
            // a blank exclusion phrase would match every claim text
            if (containsBlank(definition.coverage())) {
                throw new ConfigurationException("policy_db." + policyId + ".coverage contains a blank label");
            }
            if (containsBlank(definition.exclusions())) {
                throw new ConfigurationException("policy_db." + policyId + ".exclusions contains a blank phrase");
            }
            copy.put(policyId, new ClaimsConfig.PolicyDefinition(
                List.copyOf(definition.coverage()),
                List.copyOf(definition.exclusions())
            ));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static boolean containsBlank(List<String> values) {
        for (String value : values) {
            if (value.isBlank()) {
                return true;
            }
        }
        return false;
    }

    private ClaimsConfig.RoutingRules validateRoutingRules(ClaimsConfig.RoutingRules rules) {
        if (rules == null) {
            throw new ConfigurationException("routing_rules is required");
        }
        if (rules.highValueThreshold() == null) {
            throw new ConfigurationException("routing_rules.high_value_threshold is required");
        }
        if (rules.stpThreshold() == null) {
            throw new ConfigurationException("routing_rules.stp_threshold is required");
        }
        if (rules.highValueThreshold() < 0 || rules.stpThreshold() < 0) {
            throw new ConfigurationException("routing_rules thresholds must be non-negative");
        }
        if (rules.stpThreshold() > rules.highValueThreshold()) {
            // Accepted as-is: senior adjuster routing is evaluated first and claims the overlap.
            log.warn("routing_rules.stp_threshold ({}) exceeds high_value_threshold ({})",
                rules.stpThreshold(), rules.highValueThreshold());
        }
        return rules;
    }

    private List<ClaimsConfig.TrainingSample> validateTrainingData(List<ClaimsConfig.TrainingSample> samples) {
        if (samples == null) {
            throw new ConfigurationException("training_data is required");
        }
        if (samples.size() < MIN_TRAINING_SAMPLES) {
            throw new ConfigurationException("training_data must contain at least "
                + MIN_TRAINING_SAMPLES + " samples");
        }
        for (int i = 0; i < samples.size(); i++) {
            ClaimsConfig.TrainingSample sample = samples.get(i);
            if (sample == null || isBlank(sample.description()) || isBlank(sample.claimType())) {
                throw new ConfigurationException("training_data[" + i + "] requires description and claim_type");
            }
        }
        return List.copyOf(samples);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
