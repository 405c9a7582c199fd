package com.claimflow.api;

import com.claimflow.policy.Policy;
import com.claimflow.policy.PolicyStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collection;

/**
 * GET /v1/policies
 * GET /v1/policies/{policyId}
 */
@RestController
@RequestMapping("/v1/policies")
public class PolicyController {

    private final PolicyStore policyStore;

    public PolicyController(PolicyStore policyStore) {
        this.policyStore = policyStore;
    }

    @GetMapping
    public Collection<Policy> listPolicies() {
        return policyStore.all();
    }

    @GetMapping("/{policyId}")
    public ResponseEntity<Policy> getPolicy(@PathVariable String policyId) {
        return policyStore.findById(policyId)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }
}
