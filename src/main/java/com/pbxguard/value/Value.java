package com.pbxguard.value;

/**
 * A node of the property-list value tree: string, identifier, dictionary or array.
 * Equality is structural. Comments on identifiers and keys are annotations and
 * never take part in equality.
 */
public abstract class Value {

    Value() {}

    public abstract Value deepCopy();

    public boolean isString() {
        return this instanceof StringValue;
    }

    public boolean isIdent() {
        return this instanceof IdentValue;
    }

    public boolean isDict() {
        return this instanceof DictValue;
    }

    public boolean isArray() {
        return this instanceof ArrayValue;
    }

    public StringValue asString() {
        return (StringValue) this;
    }

    public IdentValue asIdent() {
        return (IdentValue) this;
    }

    public DictValue asDict() {
        return (DictValue) this;
    }

    public ArrayValue asArray() {
        return (ArrayValue) this;
    }

    /**
     * Scalar text of a string or identifier, null for containers.
     */
    public String scalarText() {
        if (this instanceof StringValue) {
            return ((StringValue) this).getText();
        }
        if (this instanceof IdentValue) {
            return ((IdentValue) this).getId();
        }
        return null;
    }
}
