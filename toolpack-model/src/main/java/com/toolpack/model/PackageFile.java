package com.toolpack.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One file of a transportable payload: package-root-relative path and base64-encoded content.
 */
public final class PackageFile {

    private final String path;
    private final String content;

    @JsonCreator
    public PackageFile(
            @JsonProperty("path") String path,
            @JsonProperty("content") String content) {
        this.path = path;
        this.content = content;
    }

    public String getPath() {
        return path;
    }

    /** Base64 (RFC 4648, with padding) of the raw file bytes. */
    public String getContent() {
        return content;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PackageFile that = (PackageFile) o;
        return Objects.equals(path, that.path) && Objects.equals(content, that.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, content);
    }
}
