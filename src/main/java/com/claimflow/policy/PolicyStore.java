package com.claimflow.policy;

import java.util.Collection;
import java.util.Optional;

/**
 * Read-only lookup of policies by identifier. Populated once at startup.
 */
public interface PolicyStore {

    Optional<Policy> findById(String policyId);

    Collection<Policy> all();

    int size();
}
