package com.claimflow.policy;

import com.claimflow.config.ClaimsConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;

@Component
public class InMemoryPolicyStore implements PolicyStore {

    private final Map<String, Policy> policies;

    @Autowired
    public InMemoryPolicyStore(ClaimsConfig config) {
        this(toPolicies(config.policyDb()));
    }

    public InMemoryPolicyStore(Collection<Policy> policies) {
        Map<String, Policy> byId = new LinkedHashMap<>();
        for (Policy policy : policies) {
            if (byId.putIfAbsent(policy.policyId(), policy) != null) {
                throw new IllegalArgumentException("duplicate policy id: " + policy.policyId());
            }
        }
        this.policies = Collections.unmodifiableMap(byId);
    }

    @Override
    public Optional<Policy> findById(String policyId) {
        if (policyId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(policies.get(policyId));
    }

    @Override
    public Collection<Policy> all() {
        return policies.values();
    }

    @Override
    public int size() {
        return policies.size();
    }

    private static Collection<Policy> toPolicies(Map<String, ClaimsConfig.PolicyDefinition> policyDb) {
        return policyDb.entrySet().stream()
            .map(e -> new Policy(e.getKey(), new LinkedHashSet<>(e.getValue().coverage()),
                e.getValue().exclusions()))
            .toList();
    }
}
