package com.cobolscope.analyzer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Directed caller -> callee graph over program names. A callee gets its own node as soon as it
 * is first called, so programs that are never analyzed still appear, with no outgoing edges.
 * Edges are only ever added.
 */
public class CallGraph {
    
    private final Map<String, Set<String>> callees = new LinkedHashMap<>(); // caller -> callees
    
    public void addNode(String program) {
        callees.computeIfAbsent(program, k -> new LinkedHashSet<>());
    }
    
    public void addEdge(String caller, String callee) {
        callees.computeIfAbsent(caller, k -> new LinkedHashSet<>()).add(callee);
        addNode(callee);
    }
    
    public boolean containsNode(String program) {
        return callees.containsKey(program);
    }
    
    /**
     * Programs called by {@code program}; empty if it has no node
     */
    public Set<String> calleesOf(String program) {
        Set<String> result = callees.get(program);
        return result != null ? Collections.unmodifiableSet(new LinkedHashSet<>(result)) : Set.of();
    }
    
    /**
     * Programs whose callee set contains {@code program}. Linear in the number of nodes.
     */
    public Set<String> callersOf(String program) {
        Set<String> callers = new LinkedHashSet<>();
        for (Map.Entry<String, Set<String>> entry : callees.entrySet()) {
            if (entry.getValue().contains(program)) {
                callers.add(entry.getKey());
            }
        }
        return callers;
    }
    
    public Set<String> getNodes() {
        return Collections.unmodifiableSet(callees.keySet());
    }
    
    public int edgeCount() {
        return callees.values().stream().mapToInt(Set::size).sum();
    }
    
    /**
     * Union another graph's nodes and edges into this one
     */
    public void merge(CallGraph other) {
        for (Map.Entry<String, Set<String>> entry : other.callees.entrySet()) {
            addNode(entry.getKey());
            for (String callee : entry.getValue()) {
                addEdge(entry.getKey(), callee);
            }
        }
    }
    
    /**
     * Snapshot of the adjacency map
     */
    public Map<String, Set<String>> asMap() {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        callees.forEach((caller, targets) -> copy.put(caller, Collections.unmodifiableSet(new LinkedHashSet<>(targets))));
        return Collections.unmodifiableMap(copy);
    }
    
    @Override
    public String toString() {
        return "CallGraph{nodes=" + callees.size() + ", edges=" + edgeCount() + '}';
    }
}
