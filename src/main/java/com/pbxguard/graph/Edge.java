package com.pbxguard.graph;

/**
 * One occurrence of an identifier inside a record (or the root dictionary, in
 * which case {@code fromId} is null).
 */
public record Edge(String fromId, String field, String targetId, EdgeKind kind) {

    public boolean fromRoot() {
        return fromId == null;
    }
}
