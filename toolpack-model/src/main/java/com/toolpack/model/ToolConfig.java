package com.toolpack.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Typed view of a tool's {@code config.json}:
 * <pre>
 * { "name": ..., "license": ..., "meta": { "author": ..., "version": ... },
 *   "build": { "entry": ..., "module": ... } }
 * </pre>
 * Every field is optional here; callers decide which ones are required.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ToolConfig {

    private final String name;
    private final String license;
    private final Meta meta;
    private final Build build;

    @JsonCreator
    public ToolConfig(
            @JsonProperty("name") String name,
            @JsonProperty("license") String license,
            @JsonProperty("meta") Meta meta,
            @JsonProperty("build") Build build) {
        this.name = name;
        this.license = license;
        this.meta = meta != null ? meta : new Meta(null, null);
        this.build = build != null ? build : new Build(null, null);
    }

    /** Config with every field absent (a folder without {@code config.json}). */
    public static ToolConfig empty() {
        return new ToolConfig(null, null, null, null);
    }

    /** Config mirroring the given metadata, used when a package carries no {@code config.json}. */
    public static ToolConfig of(ToolMetadata metadata) {
        return new ToolConfig(metadata.getName(), metadata.getLicense(),
                new Meta(metadata.getAuthor(), metadata.getVersion()),
                new Build(metadata.getEntry(), metadata.getModule()));
    }

    public String getName() {
        return name;
    }

    public String getLicense() {
        return license;
    }

    public Meta getMeta() {
        return meta;
    }

    public Build getBuild() {
        return build;
    }

    /** Metadata with defaults for absent license, entry and module. */
    public ToolMetadata toMetadata() {
        return new ToolMetadata(meta.getAuthor(), name, meta.getVersion(), license,
                build.getEntry(), build.getModule());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Meta {
        private final String author;
        private final String version;

        @JsonCreator
        public Meta(@JsonProperty("author") String author, @JsonProperty("version") String version) {
            this.author = author;
            this.version = version;
        }

        public String getAuthor() {
            return author;
        }

        public String getVersion() {
            return version;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Build {
        private final String entry;
        private final String module;

        @JsonCreator
        public Build(@JsonProperty("entry") String entry, @JsonProperty("module") String module) {
            this.entry = entry;
            this.module = module;
        }

        public String getEntry() {
            return entry;
        }

        public String getModule() {
            return module;
        }
    }
}
