package com.toolpack.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** One entry of {@code GET /tools/list}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ToolListing {

    private static final String DEFAULT_TYPE = "generic";

    private final String author;
    private final String name;
    private final String version;
    private final String toolType;
    private final String description;

    @JsonCreator
    public ToolListing(
            @JsonProperty("author") String author,
            @JsonProperty("name") String name,
            @JsonProperty("version") String version,
            @JsonProperty("tool_type") String toolType,
            @JsonProperty("description") String description) {
        this.author = author;
        this.name = name;
        this.version = version;
        this.toolType = toolType;
        this.description = description;
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

    @JsonProperty("tool_type")
    public String getToolType() {
        return toolType;
    }

    public String getDescription() {
        return description;
    }

    /** Display id {@code author/name/version}. */
    @JsonIgnore
    public String getTool() {
        return author + "/" + name + "/" + version;
    }

    /** Tool type, {@code generic} when the registry did not send one. */
    @JsonIgnore
    public String getType() {
        return toolType != null ? toolType : DEFAULT_TYPE;
    }

    /** Description, empty when the registry did not send one. */
    @JsonIgnore
    public String getDescriptionOrEmpty() {
        return description != null ? description : "";
    }
}
