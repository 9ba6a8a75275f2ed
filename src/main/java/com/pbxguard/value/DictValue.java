package com.pbxguard.value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Dictionary value. Entries keep document order for lossless round trips, but
 * equality ignores order. Keys are unique everywhere except in the root
 * {@code objects} table, where the parser keeps duplicates so they can be reported.
 */
public final class DictValue extends Value implements Iterable<DictValue.Entry> {
    private final List<Entry> entries;

    public DictValue() {
        this.entries = new ArrayList<>();
    }

    public List<Entry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Entry getEntry(String key) {
        for (Entry entry : entries) {
            if (entry.key.equals(key)) {
                return entry;
            }
        }
        return null;
    }

    public Value get(String key) {
        Entry entry = getEntry(key);
        return entry != null ? entry.value : null;
    }

    /**
     * Text of a scalar entry, or null when the key is absent or holds a container.
     */
    public String getString(String key) {
        Value value = get(key);
        return value != null ? value.scalarText() : null;
    }

    public boolean containsKey(String key) {
        return getEntry(key) != null;
    }

    public Set<String> keys() {
        Set<String> keys = new LinkedHashSet<>();
        for (Entry entry : entries) {
            keys.add(entry.key);
        }
        return keys;
    }

    /**
     * Replaces the value of the first entry with this key, or appends a new entry.
     */
    public DictValue put(String key, Value value) {
        Entry existing = getEntry(key);
        if (existing != null) {
            existing.value = Objects.requireNonNull(value, "value");
        } else {
            entries.add(new Entry(key, null, value, null));
        }
        return this;
    }

    public DictValue put(String key, String text) {
        return put(key, new StringValue(text));
    }

    /**
     * Appends an entry without looking for an existing key.
     */
    public Entry append(String key, String keyComment, Value value, String section) {
        Entry entry = new Entry(key, keyComment, value, section);
        entries.add(entry);
        return entry;
    }

    /**
     * Removes every entry with this key.
     */
    public boolean remove(String key) {
        return entries.removeIf(e -> e.key.equals(key));
    }

    /**
     * Replaces an entry with one under a new key, keeping its position, comment,
     * value and section.
     */
    public Entry replaceKey(Entry entry, String newKey) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i) == entry) {
                Entry renamed = new Entry(newKey, entry.keyComment, entry.value, entry.section);
                entries.set(i, renamed);
                return renamed;
            }
        }
        throw new IllegalArgumentException("Entry does not belong to this dictionary: " + entry.key);
    }

    public boolean removeEntry(Entry entry) {
        Iterator<Entry> it = entries.iterator();
        while (it.hasNext()) {
            if (it.next() == entry) {
                it.remove();
                return true;
            }
        }
        return false;
    }

    @Override
    public Iterator<Entry> iterator() {
        return getEntries().iterator();
    }

    @Override
    public DictValue deepCopy() {
        DictValue copy = new DictValue();
        for (Entry entry : entries) {
            copy.entries.add(new Entry(entry.key, entry.keyComment, entry.value.deepCopy(), entry.section));
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DictValue)) return false;
        DictValue other = (DictValue) o;
        if (entries.size() != other.entries.size()) {
            return false;
        }
        return asMultimap().equals(other.asMultimap());
    }

    @Override
    public int hashCode() {
        return asMultimap().hashCode();
    }

    private Map<String, List<Value>> asMultimap() {
        Map<String, List<Value>> map = new HashMap<>();
        for (Entry entry : entries) {
            map.computeIfAbsent(entry.key, k -> new ArrayList<>()).add(entry.value);
        }
        return map;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Dict{");
        for (Entry entry : entries) {
            sb.append(entry.key).append('=').append(entry.value).append(';');
        }
        return sb.append('}').toString();
    }

    /**
     * One key/value pair. {@code section} is the {@code Begin X section} block the
     * entry was read from, if any; it is bookkeeping, not content.
     */
    public static final class Entry {
        private final String key;
        private final String keyComment;
        private Value value;
        private String section;

        Entry(String key, String keyComment, Value value, String section) {
            this.key = Objects.requireNonNull(key, "key");
            this.keyComment = Comments.normalize(keyComment);
            this.value = Objects.requireNonNull(value, "value");
            this.section = section;
        }

        public String getKey() {
            return key;
        }

        public String getKeyComment() {
            return keyComment;
        }

        public Value getValue() {
            return value;
        }

        public void setValue(Value value) {
            this.value = Objects.requireNonNull(value, "value");
        }

        public String getSection() {
            return section;
        }

        public void setSection(String section) {
            this.section = section;
        }
    }
}
