package com.pbxguard.value;

import java.util.Objects;

/**
 * A cross-reference to another object record. The optional comment is the
 * human-readable annotation written after the id ({@code ID /* name *&#47;}).
 */
public final class IdentValue extends Value {
    private final String id;
    private final String comment;

    public IdentValue(String id, String comment) {
        this.id = Objects.requireNonNull(id, "id");
        this.comment = Comments.normalize(comment);
    }

    public static IdentValue of(String id) {
        return new IdentValue(id, null);
    }

    public static IdentValue of(String id, String comment) {
        return new IdentValue(id, comment);
    }

    public String getId() {
        return id;
    }

    public String getComment() {
        return comment;
    }

    public boolean refersTo(String targetId) {
        return id.equals(targetId);
    }

    @Override
    public IdentValue deepCopy() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IdentValue)) return false;
        return id.equals(((IdentValue) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return comment == null ? "Ident(" + id + ")" : "Ident(" + id + " /* " + comment + " */)";
    }
}
