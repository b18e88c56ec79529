package com.cobolscope.parser.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Everything the parser extracts from one COBOL source file. Immutable once built; a program
 * is only ever replaced by parsing its source again.
 */
public final class CobolProgram {
    
    private final String name;
    private final String sourcePath;
    private final Map<String, Division> divisions;
    private final Map<String, DataItem> dataItems;
    private final List<FileReference> files;
    private final List<ProgramCall> calls;
    private final List<Resource> resources;
    private final Set<String> copybooks;
    private final Set<String> mapsUsed;
    private final Map<String, String> paragraphSources;
    
    @JsonCreator
    public CobolProgram(
            @JsonProperty("name") String name,
            @JsonProperty("sourcePath") String sourcePath,
            @JsonProperty("divisions") Map<String, Division> divisions,
            @JsonProperty("dataItems") Map<String, DataItem> dataItems,
            @JsonProperty("files") List<FileReference> files,
            @JsonProperty("calls") List<ProgramCall> calls,
            @JsonProperty("resources") List<Resource> resources,
            @JsonProperty("copybooks") Set<String> copybooks,
            @JsonProperty("mapsUsed") Set<String> mapsUsed,
            @JsonProperty("paragraphSources") Map<String, String> paragraphSources) {
        
        this.name = Objects.requireNonNull(name, "Program name cannot be null");
        this.sourcePath = Objects.requireNonNull(sourcePath, "Source path cannot be null");
        this.divisions = unmodifiableOrderedCopy(divisions);
        this.dataItems = unmodifiableOrderedCopy(dataItems);
        this.files = files != null ? List.copyOf(files) : List.of();
        this.calls = calls != null ? List.copyOf(calls) : List.of();
        this.resources = resources != null ? List.copyOf(resources) : List.of();
        this.copybooks = unmodifiableOrderedCopy(copybooks);
        this.mapsUsed = unmodifiableOrderedCopy(mapsUsed);
        this.paragraphSources = unmodifiableOrderedCopy(paragraphSources);
    }
    
    /**
     * Mutable accumulator the extraction passes write into while a source file is parsed.
     * Every builder owns its own containers.
     */
    public static class Builder {
        private final String name;
        private final String sourcePath;
        private final Map<String, Division> divisions = new LinkedHashMap<>();
        private final Map<String, DataItem> dataItems = new LinkedHashMap<>();
        private final List<FileReference> files = new ArrayList<>();
        private final List<ProgramCall> calls = new ArrayList<>();
        private final List<Resource> resources = new ArrayList<>();
        private final Set<String> copybooks = new LinkedHashSet<>();
        private final Set<String> mapsUsed = new LinkedHashSet<>();
        private final Map<String, String> paragraphSources = new LinkedHashMap<>();
        
        private Builder(String name, String sourcePath) {
            this.name = Objects.requireNonNull(name, "Program name cannot be null");
            this.sourcePath = Objects.requireNonNull(sourcePath, "Source path cannot be null");
        }
        
        public String getName() { return name; }
        
        public Builder division(Division division) {
            divisions.put(division.getName(), division);
            return this;
        }
        
        public Optional<Division> getDivision(String divisionName) {
            return Optional.ofNullable(divisions.get(divisionName));
        }
        
        public Builder dataItem(DataItem item) {
            dataItems.put(item.getName(), item);
            return this;
        }
        
        public Builder file(FileReference file) {
            files.add(file);
            return this;
        }
        
        public boolean hasFile(String fileName) {
            return files.stream().anyMatch(f -> f.getName().equals(fileName));
        }
        
        public Builder call(ProgramCall call) {
            calls.add(call);
            return this;
        }
        
        public Builder resource(Resource resource) {
            resources.add(resource);
            return this;
        }
        
        public Builder copybook(String copybook) {
            copybooks.add(copybook);
            return this;
        }
        
        public Builder map(String mapName) {
            mapsUsed.add(mapName);
            return this;
        }
        
        public Builder paragraphSource(String paragraphName, String text) {
            paragraphSources.put(paragraphName, text);
            return this;
        }
        
        public CobolProgram build() {
            return new CobolProgram(name, sourcePath, divisions, dataItems, files, calls,
                    resources, copybooks, mapsUsed, paragraphSources);
        }
    }
    
    public static Builder builder(String name, String sourcePath) {
        return new Builder(name, sourcePath);
    }
    
    public String getName() { return name; }
    public String getSourcePath() { return sourcePath; }
    public Map<String, Division> getDivisions() { return divisions; }
    public Map<String, DataItem> getDataItems() { return dataItems; }
    public List<FileReference> getFiles() { return files; }
    public List<ProgramCall> getCalls() { return calls; }
    public List<Resource> getResources() { return resources; }
    public Set<String> getCopybooks() { return copybooks; }
    public Set<String> getMapsUsed() { return mapsUsed; }
    
    /**
     * Source text of each PROCEDURE paragraph keyed by paragraph name, sequence area removed
     */
    public Map<String, String> getParagraphSources() { return paragraphSources; }
    
    public Optional<Division> division(String divisionName) {
        return Optional.ofNullable(divisions.get(divisionName));
    }
    
    public Optional<String> paragraphSource(String paragraphName) {
        return Optional.ofNullable(paragraphSources.get(paragraphName));
    }
    
    public Optional<DataItem> dataItem(String itemName) {
        return Optional.ofNullable(dataItems.get(itemName));
    }
    
    /**
     * Level-01 records in declaration order
     */
    public List<DataItem> topLevelRecords() {
        return dataItems.values().stream()
                .filter(DataItem::isTopLevel)
                .toList();
    }
    
    /**
     * Items grouped under a record. Grouping is textual: any item with a level above 01 whose
     * name starts with the record's name counts as a child, whether or not it is declared
     * inside that record.
     */
    public List<DataItem> childrenOf(DataItem record) {
        return dataItems.values().stream()
                .filter(item -> item.getLevel() > DataItem.TOP_LEVEL)
                .filter(item -> item.getName().startsWith(record.getName()))
                .toList();
    }
    
    /**
     * Paragraph whose line range encloses the given line, searching every division
     */
    public Optional<Paragraph> paragraphAt(int line) {
        return divisions.values().stream()
                .filter(d -> d.contains(line))
                .flatMap(d -> d.getSections().values().stream())
                .map(s -> s.paragraphAt(line))
                .flatMap(Optional::stream)
                .findFirst();
    }
    
    private static <K, V> Map<K, V> unmodifiableOrderedCopy(Map<K, V> source) {
        return source != null ? Collections.unmodifiableMap(new LinkedHashMap<>(source)) : Map.of();
    }
    
    private static <T> Set<T> unmodifiableOrderedCopy(Set<T> source) {
        return source != null ? Collections.unmodifiableSet(new LinkedHashSet<>(source)) : Set.of();
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CobolProgram that = (CobolProgram) o;
        return name.equals(that.name) && sourcePath.equals(that.sourcePath);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(name, sourcePath);
    }
    
    @Override
    public String toString() {
        return "CobolProgram{" +
                "name='" + name + '\'' +
                ", source='" + sourcePath + '\'' +
                ", divisions=" + divisions.keySet() +
                ", dataItems=" + dataItems.size() +
                ", files=" + files.size() +
                ", calls=" + calls.size() +
                ", resources=" + resources.size() +
                '}';
    }
}
