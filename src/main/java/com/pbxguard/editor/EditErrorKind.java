package com.pbxguard.editor;

public enum EditErrorKind {
    DUPLICATE_IDENTIFIER,
    TARGET_NOT_FOUND,
    DUPLICATE_EDGE,
    WOULD_VIOLATE_INTEGRITY,
    OBJECT_NOT_FOUND,
    INVALID_FIELD,
    NOT_A_PERMUTATION
}
