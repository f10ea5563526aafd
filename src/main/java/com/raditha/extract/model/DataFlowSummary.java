package com.raditha.extract.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Data flow facts for every local variable a selection touches, in order of first use.
 */
public record DataFlowSummary(List<VariableFlowFact> facts) {

    public DataFlowSummary {
        facts = List.copyOf(facts);
    }

    public List<VariableFlowFact> withRole(VariableRole role) {
        return facts.stream().filter(f -> f.role() == role).toList();
    }

    public List<VariableFlowFact> parameters() {
        return facts.stream().filter(VariableFlowFact::isParameter).toList();
    }

    public List<VariableFlowFact> carried() {
        return facts.stream().filter(VariableFlowFact::isCarried).toList();
    }

    public Set<String> dataFlowsIn() {
        return names(facts.stream().filter(VariableFlowFact::flowsIn).toList());
    }

    public Set<String> writtenInside() {
        return names(facts.stream().filter(VariableFlowFact::writtenInside).toList());
    }

    public Set<String> readAfter() {
        return names(facts.stream().filter(VariableFlowFact::readAfter).toList());
    }

    public VariableFlowFact fact(String name) {
        return facts.stream().filter(f -> f.name().equals(name)).findFirst().orElse(null);
    }

    private static Set<String> names(List<VariableFlowFact> selected) {
        Set<String> names = new LinkedHashSet<>();
        selected.forEach(f -> names.add(f.name()));
        return names;
    }
}
