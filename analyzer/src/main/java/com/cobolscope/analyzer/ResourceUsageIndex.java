package com.cobolscope.analyzer;

import com.cobolscope.parser.model.Resource;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Which programs use which embedded resource, keyed by {@code TYPE:NAME}. Entries are only
 * ever added.
 */
public class ResourceUsageIndex {
    
    private final Map<String, Set<String>> usage = new LinkedHashMap<>(); // TYPE:NAME -> programs
    
    public void record(Resource resource, String program) {
        record(resource.usageKey(), program);
    }
    
    void record(String key, String program) {
        usage.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(program);
    }
    
    public Set<String> programsUsing(String key) {
        Set<String> programs = usage.get(key);
        return programs != null ? Collections.unmodifiableSet(new LinkedHashSet<>(programs)) : Set.of();
    }
    
    public Set<String> programsUsing(String type, String name) {
        return programsUsing(Resource.usageKey(type, name));
    }
    
    public Set<String> getKeys() {
        return Collections.unmodifiableSet(usage.keySet());
    }
    
    public int size() {
        return usage.size();
    }
    
    public void merge(ResourceUsageIndex other) {
        other.usage.forEach((key, programs) -> programs.forEach(program -> record(key, program)));
    }
    
    public Map<String, Set<String>> asMap() {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        usage.forEach((key, programs) -> copy.put(key, Collections.unmodifiableSet(new LinkedHashSet<>(programs))));
        return Collections.unmodifiableMap(copy);
    }
    
    @Override
    public String toString() {
        return "ResourceUsageIndex{resources=" + usage.size() + '}';
    }
}
