package com.pbxguard.value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Ordered list value. Element order is significant (build and link order).
 */
public final class ArrayValue extends Value implements Iterable<Value> {
    private final List<Value> elements;

    public ArrayValue() {
        this.elements = new ArrayList<>();
    }

    public ArrayValue(List<? extends Value> elements) {
        this.elements = new ArrayList<>(elements);
    }

    public static ArrayValue of(Value... elements) {
        ArrayValue array = new ArrayValue();
        for (Value element : elements) {
            array.add(element);
        }
        return array;
    }

    public List<Value> getElements() {
        return Collections.unmodifiableList(elements);
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public Value get(int index) {
        return elements.get(index);
    }

    public void add(Value value) {
        elements.add(value);
    }

    public boolean remove(Value value) {
        return elements.remove(value);
    }

    public boolean removeIf(Predicate<Value> filter) {
        return elements.removeIf(filter);
    }

    public void replaceAll(List<? extends Value> replacement) {
        elements.clear();
        elements.addAll(replacement);
    }

    public boolean containsIdent(String id) {
        for (Value element : elements) {
            if (element.isIdent() && element.asIdent().refersTo(id)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Iterator<Value> iterator() {
        return getElements().iterator();
    }

    @Override
    public ArrayValue deepCopy() {
        ArrayValue copy = new ArrayValue();
        for (Value element : elements) {
            copy.elements.add(element.deepCopy());
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArrayValue)) return false;
        return elements.equals(((ArrayValue) o).elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return "Array" + elements;
    }
}
