package com.vidnyan.linthub.domain.rule;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Read-only override table: for each code, the codes that suppress it when reported on the same line.
 */
public record Overrides(Map<String, Set<String>> suppressors) {

    public Overrides {
        Map<String, Set<String>> copy = new HashMap<>();
        suppressors.forEach((code, by) -> copy.put(code, Set.copyOf(by)));
        suppressors = Map.copyOf(copy);
    }

    public static Overrides none() {
        return new Overrides(Map.of());
    }

    /**
     * Codes that suppress {@code code}; empty when the code has no entry.
     */
    public Set<String> suppressorsOf(String code) {
        return suppressors.getOrDefault(code, Set.of());
    }
}
