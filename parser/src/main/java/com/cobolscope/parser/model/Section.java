package com.cobolscope.parser.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A section with its line range and the paragraphs it contains, keyed by upper-cased name
 * in source order.
 */
public final class Section {
    
    private final String name;
    private final int startLine;
    private final int endLine;
    private final Map<String, Paragraph> paragraphs;
    
    @JsonCreator
    public Section(@JsonProperty("name") String name,
                   @JsonProperty("startLine") int startLine,
                   @JsonProperty("endLine") int endLine,
                   @JsonProperty("paragraphs") Map<String, Paragraph> paragraphs) {
        this.name = Objects.requireNonNull(name, "Section name cannot be null");
        this.startLine = startLine;
        this.endLine = endLine;
        this.paragraphs = paragraphs != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(paragraphs))
                : Map.of();
    }
    
    public String getName() { return name; }
    public int getStartLine() { return startLine; }
    public int getEndLine() { return endLine; }
    public Map<String, Paragraph> getParagraphs() { return paragraphs; }
    
    public boolean contains(int line) {
        return line >= startLine && line <= endLine;
    }
    
    public Optional<Paragraph> paragraphAt(int line) {
        return paragraphs.values().stream()
                .filter(p -> p.contains(line))
                .findFirst();
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Section that = (Section) o;
        return startLine == that.startLine &&
               endLine == that.endLine &&
               name.equals(that.name) &&
               paragraphs.equals(that.paragraphs);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(name, startLine, endLine, paragraphs);
    }
    
    @Override
    public String toString() {
        return "Section{" + name + ", lines=" + startLine + "-" + endLine +
                ", paragraphs=" + paragraphs.size() + '}';
    }
}
