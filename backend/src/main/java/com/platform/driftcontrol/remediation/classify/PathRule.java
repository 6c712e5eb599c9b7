package com.platform.driftcontrol.remediation.classify;

import com.platform.driftcontrol.drift.ChangeType;

import java.util.List;
import java.util.function.BiPredicate;

/**
 * One entry of an ordered classification table: a named predicate over
 * (lower-cased property path, change type) and the outcome it selects.
 *
 * @param <T> outcome type (severity or strategy)
 */
record PathRule<T>(String name, BiPredicate<String, ChangeType> predicate, T outcome) {
    
    boolean matches(String lowerPath, ChangeType changeType) {
        return predicate.test(lowerPath, changeType);
    }
    
    static <T> PathRule<T> containsAny(T outcome, String... markers) {
        List<String> list = List.of(markers);
        return new PathRule<>(
            "contains any of " + list,
            (path, change) -> list.stream().anyMatch(path::contains),
            outcome
        );
    }
}
