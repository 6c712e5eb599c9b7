package com.platform.driftcontrol.api;

import com.platform.driftcontrol.remediation.RemediationPlan;
import com.platform.driftcontrol.remediation.RemediationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory store of plans created through the API and their execution results.
 * The oldest plans are evicted once {@link #MAX_PLANS} is exceeded.
 */
@Slf4j
@Component
public class PlanRepository {
    
    static final int MAX_PLANS = 200;
    
    private final Map<String, RemediationPlan> plans = new LinkedHashMap<>();
    private final Map<String, List<RemediationResult>> results = new LinkedHashMap<>();
    
    public synchronized RemediationPlan save(RemediationPlan plan) {
        plans.put(plan.getId(), plan);
        while (plans.size() > MAX_PLANS) {
            String eldest = plans.keySet().iterator().next();
            plans.remove(eldest);
            results.remove(eldest);
            log.debug("Evicted plan {} from the plan store", eldest);
        }
        return plan;
    }
    
    public synchronized Optional<RemediationPlan> findById(String planId) {
        return Optional.ofNullable(plans.get(planId));
    }
    
    /**
     * Plans, newest first.
     */
    public synchronized List<RemediationPlan> findAll() {
        List<RemediationPlan> all = new ArrayList<>(plans.values());
        all.sort(Comparator.comparing(RemediationPlan::getCreatedAt,
            Comparator.nullsLast(Comparator.<Instant>reverseOrder())));
        return all;
    }
    
    public synchronized void saveResults(String planId, List<RemediationResult> planResults) {
        if (plans.containsKey(planId)) {
            results.put(planId, List.copyOf(planResults));
        }
    }
    
    public synchronized Optional<List<RemediationResult>> findResults(String planId) {
        return Optional.ofNullable(results.get(planId));
    }
}
