package com.pantiviewer.model;

import java.util.Objects;

public class Tag {
    private final int id;
    private final String name;   // Normalized unique value (e.g., "vacation")

    public Tag(int id, String name) {
        this.id = id;
        this.name = name;
    }

    public int getId() { return id; }
    public String getName() { return name; }

    /**
     * Tags are stored trimmed and lower-cased so "Family" and "family " are one tag.
     */
    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        return name.trim().toLowerCase();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tag)) return false;
        Tag tag = (Tag) o;
        return id == tag.id && Objects.equals(name, tag.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name);
    }

    @Override
    public String toString() {
        return name;
    }
}
