package com.claimflow.classification;

import com.claimflow.config.ClaimsConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClassificationConfiguration {

    /** Trained once at startup from the configured samples. */
    @Bean
    public ClaimClassifier claimClassifier(ClaimsConfig config) {
        return new NaiveBayesClaimClassifier(config.trainingData());
    }
}
