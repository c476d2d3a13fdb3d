package com.toolpack.model;

import java.util.Objects;

/** Resolved (author, name, version) of a cached tool. */
public final class ToolCoordinates {

    private final String author;
    private final String name;
    private final String version;

    public ToolCoordinates(String author, String name, String version) {
        this.author = author;
        this.name = name;
        this.version = version;
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

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ToolCoordinates that = (ToolCoordinates) o;
        return Objects.equals(author, that.author) && Objects.equals(name, that.name)
                && Objects.equals(version, that.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(author, name, version);
    }

    @Override
    public String toString() {
        return author + "/" + name + "/" + version;
    }
}
