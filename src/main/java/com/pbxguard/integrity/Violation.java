package com.pbxguard.integrity;

import java.util.Objects;

/**
 * One integrity finding. Which of the subject fields are set depends on the type:
 * dangling references carry object, field and target; malformed ids carry the value;
 * section problems carry the isa.
 */
public class Violation {
    public static final String ROOT = "(root)";

    private final ViolationType type;
    private final boolean blocking;
    private final String objectId;
    private final String field;
    private final String targetId;
    private final String value;
    private final String isa;
    private final String message;

    private Violation(ViolationType type, boolean blocking, String objectId, String field,
                      String targetId, String value, String isa, String message) {
        this.type = type;
        this.blocking = blocking;
        this.objectId = objectId;
        this.field = field;
        this.targetId = targetId;
        this.value = value;
        this.isa = isa;
        this.message = message;
    }

    private Violation(ViolationType type, String objectId, String field,
                      String targetId, String value, String isa, String message) {
        this(type, type.isBlockingByDefault(), objectId, field, targetId, value, isa, message);
    }

    public static Violation duplicateId(String id) {
        return new Violation(ViolationType.DUPLICATE_ID, id, null, null, null, null,
            "Identifier " + id + " is defined more than once");
    }

    public static Violation malformedObjectKey(String key) {
        return new Violation(ViolationType.MALFORMED_ID, null, null, null, key, null,
            "Object key '" + key + "' is not a 24-character hexadecimal identifier");
    }

    public static Violation malformedReference(String objectId, String field, String value) {
        return new Violation(ViolationType.MALFORMED_ID, objectId, field, null, value, null,
            "Field " + describe(objectId, field) + " holds '" + value + "', which is not a 24-character hexadecimal identifier");
    }

    public static Violation missingIsa(String id) {
        return new Violation(ViolationType.MISSING_ISA, id, null, null, null, null,
            "Object " + id + " is not a dictionary with an isa");
    }

    public static Violation missingRootObject() {
        return new Violation(ViolationType.MISSING_ROOT_OBJECT, null, "rootObject", null, null, null,
            "Root dictionary has no rootObject reference");
    }

    public static Violation dangling(String fromId, String field, String toId) {
        return new Violation(ViolationType.DANGLING_REFERENCE, fromId, field, toId, null, null,
            "Field " + describe(fromId, field) + " references missing object " + toId);
    }

    public static Violation orphan(String id, String isa, boolean blocking) {
        return new Violation(ViolationType.ORPHAN_OBJECT, blocking, id, null, null, null, isa,
            "Object " + id + " (" + isa + ") is not referenced by any other object");
    }

    public static Violation unbalancedSection(String isa, String detail) {
        return new Violation(ViolationType.UNBALANCED_GROUPED_SECTION, null, null, null, null, isa,
            "Section " + isa + ": " + detail);
    }

    private static String describe(String objectId, String field) {
        return (objectId != null ? objectId : ROOT) + "." + field;
    }

    public ViolationType getType() {
        return type;
    }

    public boolean isBlocking() {
        return blocking;
    }

    public String getObjectId() {
        return objectId;
    }

    public String getField() {
        return field;
    }

    public String getTargetId() {
        return targetId;
    }

    public String getValue() {
        return value;
    }

    public String getIsa() {
        return isa;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Violation)) return false;
        Violation other = (Violation) o;
        return type == other.type
            && blocking == other.blocking
            && Objects.equals(objectId, other.objectId)
            && Objects.equals(field, other.field)
            && Objects.equals(targetId, other.targetId)
            && Objects.equals(value, other.value)
            && Objects.equals(isa, other.isa);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, blocking, objectId, field, targetId, value, isa);
    }

    @Override
    public String toString() {
        return (blocking ? "ERROR " : "WARN  ") + type + ": " + message;
    }
}
