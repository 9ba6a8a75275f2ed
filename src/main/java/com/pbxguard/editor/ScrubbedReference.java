package com.pbxguard.editor;

/**
 * A reference removed while scrubbing a deleted or missing id. {@code objectId}
 * is null when the reference sat in the root dictionary.
 */
public record ScrubbedReference(String objectId, String field, String targetId) {

    @Override
    public String toString() {
        return (objectId != null ? objectId : "(root)") + "." + field + " -> " + targetId;
    }
}
