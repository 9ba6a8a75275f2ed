package com.pbxguard.graph;

import com.pbxguard.value.DictValue;
import com.pbxguard.value.Value;

/**
 * View over one entry of the {@code objects} table. The fields are the live
 * dictionary from the document, so reads always reflect the current tree.
 */
public class ObjectRecord {
    public static final String ISA = "isa";

    private final String id;
    private final String keyComment;
    private final DictValue fields;
    private final String section;

    ObjectRecord(String id, String keyComment, DictValue fields, String section) {
        this.id = id;
        this.keyComment = keyComment;
        this.fields = fields;
        this.section = section;
    }

    public String getId() {
        return id;
    }

    public String getKeyComment() {
        return keyComment;
    }

    /**
     * The record's dictionary, or null when the entry's value is not a dictionary.
     */
    public DictValue getFields() {
        return fields;
    }

    public String getIsa() {
        if (fields == null) {
            return null;
        }
        Value isa = fields.get(ISA);
        return isa != null && isa.isString() ? isa.asString().getText() : null;
    }

    public boolean isA(String isa) {
        return isa.equals(getIsa());
    }

    public String getSection() {
        return section;
    }

    public String getString(String field) {
        return fields != null ? fields.getString(field) : null;
    }

    public Value get(String field) {
        return fields != null ? fields.get(field) : null;
    }

    /**
     * Best human-readable label: {@code name}, then {@code path}, then the key comment.
     */
    public String displayName() {
        String name = getString("name");
        if (name != null) return name;
        String path = getString("path");
        if (path != null) return path;
        return keyComment;
    }

    @Override
    public String toString() {
        return id + " (" + getIsa() + (displayName() != null ? " " + displayName() : "") + ")";
    }
}
