package com.cobolscope.parser.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A level-numbered data declaration from the DATA DIVISION together with the clauses found on
 * its declaration line. Optional clauses are {@code null} when absent.
 */
public final class DataItem {
    
    public static final int TOP_LEVEL = 1;
    
    private final String name;
    private final int level;
    private final String picture;
    private final String usage;
    private final String value;
    private final String redefines;
    private final Integer occurs;
    private final List<String> indexedBy;
    private final SourceLocation location;
    
    @JsonCreator
    public DataItem(
            @JsonProperty("name") String name,
            @JsonProperty("level") int level,
            @JsonProperty("picture") String picture,
            @JsonProperty("usage") String usage,
            @JsonProperty("value") String value,
            @JsonProperty("redefines") String redefines,
            @JsonProperty("occurs") Integer occurs,
            @JsonProperty("indexedBy") List<String> indexedBy,
            @JsonProperty("location") SourceLocation location) {
        
        this.name = Objects.requireNonNull(name, "Data item name cannot be null");
        this.level = level;
        this.picture = picture;
        this.usage = usage;
        this.value = value;
        this.redefines = redefines;
        this.occurs = occurs;
        this.indexedBy = indexedBy != null ? List.copyOf(indexedBy) : List.of();
        this.location = location;
    }
    
    public static class Builder {
        private String name;
        private int level;
        private String picture;
        private String usage;
        private String value;
        private String redefines;
        private Integer occurs;
        private List<String> indexedBy;
        private SourceLocation location;
        
        public Builder name(String name) {
            this.name = name;
            return this;
        }
        
        public Builder level(int level) {
            this.level = level;
            return this;
        }
        
        public Builder picture(String picture) {
            this.picture = picture;
            return this;
        }
        
        public Builder usage(String usage) {
            this.usage = usage;
            return this;
        }
        
        public Builder value(String value) {
            this.value = value;
            return this;
        }
        
        public Builder redefines(String redefines) {
            this.redefines = redefines;
            return this;
        }
        
        public Builder occurs(Integer occurs) {
            this.occurs = occurs;
            return this;
        }
        
        public Builder indexedBy(List<String> indexedBy) {
            this.indexedBy = indexedBy;
            return this;
        }
        
        public Builder location(SourceLocation location) {
            this.location = location;
            return this;
        }
        
        public boolean hasUsage() {
            return usage != null;
        }
        
        public DataItem build() {
            return new DataItem(name, level, picture, usage, value, redefines, occurs, indexedBy, location);
        }
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public String getName() { return name; }
    public int getLevel() { return level; }
    public String getPicture() { return picture; }
    public String getUsage() { return usage; }
    public String getValue() { return value; }
    public String getRedefines() { return redefines; }
    public Integer getOccurs() { return occurs; }
    public List<String> getIndexedBy() { return indexedBy; }
    public SourceLocation getLocation() { return location; }
    
    @JsonIgnore
    public boolean isTopLevel() {
        return level == TOP_LEVEL;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DataItem that = (DataItem) o;
        return level == that.level &&
               name.equals(that.name) &&
               Objects.equals(picture, that.picture) &&
               Objects.equals(usage, that.usage) &&
               Objects.equals(value, that.value) &&
               Objects.equals(redefines, that.redefines) &&
               Objects.equals(occurs, that.occurs) &&
               indexedBy.equals(that.indexedBy) &&
               Objects.equals(location, that.location);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(name, level, picture, usage, value, redefines, occurs, indexedBy, location);
    }
    
    @Override
    public String toString() {
        return "DataItem{" + String.format("%02d", level) + " " + name +
                (picture != null ? " PIC " + picture : "") +
                (occurs != null ? " OCCURS " + occurs : "") +
                '}';
    }
}
