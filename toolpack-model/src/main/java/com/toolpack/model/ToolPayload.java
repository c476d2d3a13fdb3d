package com.toolpack.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Transportable package: the body of {@code POST /tools/upload} and of the
 * {@code GET /tools/download} response. File contents are base64 strings.
 * Required fields are not validated so draft packages can be built and inspected.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ToolPayload {

    private final String author;
    private final String name;
    private final String version;
    private final String license;
    private final List<PackageFile> files;
    private final String entry;
    private final String module;

    @JsonCreator
    public ToolPayload(
            @JsonProperty("author") String author,
            @JsonProperty("name") String name,
            @JsonProperty("version") String version,
            @JsonProperty("license") String license,
            @JsonProperty("files") List<PackageFile> files,
            @JsonProperty("entry") String entry,
            @JsonProperty("module") String module) {
        this.author = author;
        this.name = name;
        this.version = version;
        this.license = license;
        this.files = files != null ? List.copyOf(files) : List.of();
        this.entry = entry;
        this.module = module;
    }

    public String getAuthor() {
        return author;
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public String getLicense() {
        return license;
    }

    public List<PackageFile> getFiles() {
        return files;
    }

    public String getEntry() {
        return entry;
    }

    public String getModule() {
        return module;
    }

    /** Metadata view with the documented defaults applied. */
    @JsonIgnore
    public ToolMetadata toMetadata() {
        return new ToolMetadata(author, name, version, license, entry, module);
    }

    /** Same payload with {@code version} replaced (e.g. resolved by the registry). */
    public ToolPayload withVersion(String newVersion) {
        return new ToolPayload(author, name, newVersion, license, files, entry, module);
    }
}
