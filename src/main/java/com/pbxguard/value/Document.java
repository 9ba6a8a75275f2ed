package com.pbxguard.value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A parsed project file: the magic header plus the root dictionary.
 */
public class Document {
    public static final String MAGIC_HEADER = "// !$*UTF8*$!";
    public static final String OBJECTS_KEY = "objects";
    public static final String ROOT_OBJECT_KEY = "rootObject";

    private DictValue root;
    private final List<String> misnestedSections;

    public Document(DictValue root) {
        this(root, Collections.emptyList());
    }

    public Document(DictValue root, List<String> misnestedSections) {
        this.root = root;
        this.misnestedSections = new ArrayList<>(misnestedSections);
    }

    public DictValue getRoot() {
        return root;
    }

    /**
     * Swaps in a new root, used by the editor to roll a failed transaction back.
     */
    public void replaceRoot(DictValue root) {
        this.root = root;
    }

    public DictValue getObjects() {
        Value objects = root.get(OBJECTS_KEY);
        return objects != null && objects.isDict() ? objects.asDict() : null;
    }

    /**
     * Section names whose {@code Begin}/{@code End} markers were missing, repeated or interleaved.
     */
    public List<String> getMisnestedSections() {
        return Collections.unmodifiableList(misnestedSections);
    }

    public Document deepCopy() {
        return new Document(root.deepCopy(), misnestedSections);
    }

    /**
     * Graph equality: same root tree, ignoring dictionary order and comments.
     */
    public boolean graphEquals(Document other) {
        return other != null && root.equals(other.root);
    }
}
