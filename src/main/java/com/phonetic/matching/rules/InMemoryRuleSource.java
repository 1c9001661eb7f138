package com.phonetic.matching.rules;

import java.util.Map;
import java.util.Optional;

/**
 * Rule source backed by a name-to-text map.
 */
public class InMemoryRuleSource implements RuleSource {

    private final Map<String, String> resources;

    public InMemoryRuleSource(Map<String, String> resources) {
        this.resources = Map.copyOf(resources);
    }

    @Override
    public Optional<String> read(String name) {
        return Optional.ofNullable(resources.get(name));
    }

    @Override
    public String describe() {
        return "memory" + resources.keySet();
    }
}
