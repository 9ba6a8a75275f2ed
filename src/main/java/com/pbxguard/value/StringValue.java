package com.pbxguard.value;

import java.util.Objects;

public final class StringValue extends Value {
    private final String text;

    public StringValue(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    public String getText() {
        return text;
    }

    @Override
    public StringValue deepCopy() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StringValue)) return false;
        return text.equals(((StringValue) o).text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return "Str(" + text + ")";
    }
}
