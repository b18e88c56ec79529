package com.cobolscope.parser.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One of the four program divisions with its line range and sections.
 */
public final class Division {
    
    public static final String IDENTIFICATION = "IDENTIFICATION";
    public static final String ENVIRONMENT = "ENVIRONMENT";
    public static final String DATA = "DATA";
    public static final String PROCEDURE = "PROCEDURE";
    
    private final String name;
    private final int startLine;
    private final int endLine;
    private final Map<String, Section> sections;
    
    @JsonCreator
    public Division(@JsonProperty("name") String name,
                    @JsonProperty("startLine") int startLine,
                    @JsonProperty("endLine") int endLine,
                    @JsonProperty("sections") Map<String, Section> sections) {
        this.name = Objects.requireNonNull(name, "Division name cannot be null");
        this.startLine = startLine;
        this.endLine = endLine;
        this.sections = sections != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(sections))
                : Map.of();
    }
    
    public String getName() { return name; }
    public int getStartLine() { return startLine; }
    public int getEndLine() { return endLine; }
    public Map<String, Section> getSections() { return sections; }
    
    public boolean contains(int line) {
        return line >= startLine && line <= endLine;
    }
    
    public Optional<Section> sectionAt(int line) {
        return sections.values().stream()
                .filter(s -> s.contains(line))
                .findFirst();
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Division that = (Division) o;
        return startLine == that.startLine &&
               endLine == that.endLine &&
               name.equals(that.name) &&
               sections.equals(that.sections);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(name, startLine, endLine, sections);
    }
    
    @Override
    public String toString() {
        return "Division{" + name + ", lines=" + startLine + "-" + endLine +
                ", sections=" + sections.size() + '}';
    }
}
