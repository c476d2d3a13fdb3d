package com.toolpack.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Tool metadata: author, name, version, license, entry and module.
 * {@code entry} is the JAR or class directory (relative to the tool root) holding the implementation;
 * {@code module} is the binary name of the implementation class.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ToolMetadata {

    public static final String DEFAULT_LICENSE = "Unknown";
    public static final String DEFAULT_ENTRY = "tool.jar";
    public static final String DEFAULT_MODULE = "Tool";

    private final String author;
    private final String name;
    private final String version;
    private final String license;
    private final String entry;
    private final String module;

    @JsonCreator
    public ToolMetadata(
            @JsonProperty("author") String author,
            @JsonProperty("name") String name,
            @JsonProperty("version") String version,
            @JsonProperty("license") String license,
            @JsonProperty("entry") String entry,
            @JsonProperty("module") String module) {
        this.author = author;
        this.name = name;
        this.version = version;
        this.license = license != null ? license : DEFAULT_LICENSE;
        this.entry = entry != null ? entry : DEFAULT_ENTRY;
        this.module = module != null ? module : DEFAULT_MODULE;
    }

    public String getAuthor() {
        return author;
    }

    public String getName() {
        return name;
    }

    /** Concrete version; may be null for draft packages built without {@code meta.version}. */
    public String getVersion() {
        return version;
    }

    public String getLicense() {
        return license;
    }

    public String getEntry() {
        return entry;
    }

    public String getModule() {
        return module;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ToolMetadata that = (ToolMetadata) o;
        return Objects.equals(author, that.author) && Objects.equals(name, that.name)
                && Objects.equals(version, that.version) && Objects.equals(license, that.license)
                && Objects.equals(entry, that.entry) && Objects.equals(module, that.module);
    }

    @Override
    public int hashCode() {
        return Objects.hash(author, name, version, license, entry, module);
    }

    @Override
    public String toString() {
        return author + "/" + name + " (v" + version + ")";
    }
}
