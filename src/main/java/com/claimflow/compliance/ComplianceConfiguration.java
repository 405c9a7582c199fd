package com.claimflow.compliance;

import com.claimflow.policy.PolicyStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ComplianceConfiguration {

    @Bean
    public ComplianceEngine complianceEngine(PolicyStore policyStore) {
        return ComplianceEngine.standard(policyStore);
    }
}
