package com.cobolscope.parser.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A file the program declares with SELECT, or touches with an I/O verb without declaring it.
 */
public final class FileReference {
    
    public static final String ACCESS_SEQUENTIAL = "SEQUENTIAL";
    public static final String ACCESS_UNKNOWN = "UNKNOWN";
    
    private final String name;
    private final String accessMode;
    private final String organization;
    private final String recordKey;
    private final SourceLocation location;
    
    @JsonCreator
    public FileReference(@JsonProperty("name") String name,
                         @JsonProperty("accessMode") String accessMode,
                         @JsonProperty("organization") String organization,
                         @JsonProperty("recordKey") String recordKey,
                         @JsonProperty("location") SourceLocation location) {
        this.name = Objects.requireNonNull(name, "File name cannot be null");
        this.accessMode = accessMode != null ? accessMode : ACCESS_SEQUENTIAL;
        this.organization = organization;
        this.recordKey = recordKey;
        this.location = location;
    }
    
    public String getName() { return name; }
    public String getAccessMode() { return accessMode; }
    public String getOrganization() { return organization; }
    public String getRecordKey() { return recordKey; }
    public SourceLocation getLocation() { return location; }
    
    /**
     * True when the file was inferred from an I/O verb rather than declared with SELECT
     */
    @JsonIgnore
    public boolean isUndeclared() {
        return ACCESS_UNKNOWN.equals(accessMode);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FileReference that = (FileReference) o;
        return name.equals(that.name) &&
               accessMode.equals(that.accessMode) &&
               Objects.equals(organization, that.organization) &&
               Objects.equals(recordKey, that.recordKey) &&
               Objects.equals(location, that.location);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(name, accessMode, organization, recordKey, location);
    }
    
    @Override
    public String toString() {
        return String.format("FileReference{%s, access=%s, organization=%s, key=%s}",
                name, accessMode, organization, recordKey);
    }
}
