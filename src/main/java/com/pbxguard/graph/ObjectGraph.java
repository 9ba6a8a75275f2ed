package com.pbxguard.graph;

import com.pbxguard.value.Document;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Indexed view of a document's object table. Rebuilt from scratch after every
 * committed edit; never patched in place.
 */
public class ObjectGraph {
    private final Document document;
    private final Map<String, ObjectRecord> records;
    private final List<ObjectRecord> duplicates;
    private final Map<String, Set<String>> isaIndex;
    private final List<Edge> edges;
    private final Map<String, List<Edge>> incoming;
    private final String rootObjectId;

    ObjectGraph(Document document,
                Map<String, ObjectRecord> records,
                List<ObjectRecord> duplicates,
                List<Edge> edges,
                String rootObjectId) {
        this.document = document;
        this.records = Collections.unmodifiableMap(new LinkedHashMap<>(records));
        this.duplicates = Collections.unmodifiableList(new ArrayList<>(duplicates));
        this.edges = Collections.unmodifiableList(new ArrayList<>(edges));
        this.rootObjectId = rootObjectId;

        Map<String, Set<String>> byIsa = new TreeMap<>();
        for (ObjectRecord record : records.values()) {
            String isa = record.getIsa();
            if (isa != null) {
                byIsa.computeIfAbsent(isa, k -> new TreeSet<>()).add(record.getId());
            }
        }
        this.isaIndex = Collections.unmodifiableMap(byIsa);

        Map<String, List<Edge>> in = new LinkedHashMap<>();
        for (Edge edge : edges) {
            in.computeIfAbsent(edge.targetId(), k -> new ArrayList<>()).add(edge);
        }
        this.incoming = in;
    }

    public Document getDocument() {
        return document;
    }

    public boolean contains(String id) {
        return records.containsKey(id);
    }

    public ObjectRecord get(String id) {
        return records.get(id);
    }

    public Collection<ObjectRecord> records() {
        return records.values();
    }

    public Set<String> ids() {
        return records.keySet();
    }

    public int size() {
        return records.size();
    }

    /**
     * Second and later definitions of an id already present in the table.
     */
    public List<ObjectRecord> getDuplicates() {
        return duplicates;
    }

    public Set<String> idsOfIsa(String isa) {
        return isaIndex.getOrDefault(isa, Collections.emptySet());
    }

    public List<ObjectRecord> recordsOfIsa(String isa) {
        List<ObjectRecord> result = new ArrayList<>();
        for (String id : idsOfIsa(isa)) {
            result.add(records.get(id));
        }
        return result;
    }

    public List<Edge> getEdges() {
        return edges;
    }

    public List<Edge> incomingEdges(String id) {
        return incoming.getOrDefault(id, Collections.emptyList());
    }

    public List<Edge> outgoingEdges(String id) {
        List<Edge> result = new ArrayList<>();
        for (Edge edge : edges) {
            if (id.equals(edge.fromId())) {
                result.add(edge);
            }
        }
        return result;
    }

    /**
     * Whether any other record, or the root dictionary, references this id.
     */
    public boolean hasIncomingFromOthers(String id) {
        for (Edge edge : incomingEdges(id)) {
            if (!id.equals(edge.fromId())) {
                return true;
            }
        }
        return false;
    }

    public String getRootObjectId() {
        return rootObjectId;
    }

    /**
     * Ids reachable from {@code rootObject} by following references.
     */
    public Set<String> liveIds() {
        Set<String> live = new LinkedHashSet<>();
        if (rootObjectId == null || !records.containsKey(rootObjectId)) {
            return live;
        }
        Map<String, List<String>> outgoing = new LinkedHashMap<>();
        for (Edge edge : edges) {
            if (edge.fromId() != null) {
                outgoing.computeIfAbsent(edge.fromId(), k -> new ArrayList<>()).add(edge.targetId());
            }
        }
        Deque<String> queue = new ArrayDeque<>();
        queue.add(rootObjectId);
        live.add(rootObjectId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String target : outgoing.getOrDefault(current, Collections.emptyList())) {
                if (records.containsKey(target) && live.add(target)) {
                    queue.add(target);
                }
            }
        }
        return live;
    }

    /**
     * Records whose {@code name}, {@code path} or key comment equals the given label.
     * Only the first of those three tiers that has any match is returned.
     */
    public List<ObjectRecord> findByName(String label) {
        return findByName(label, record -> true);
    }

    public List<ObjectRecord> findByName(String label, Predicate<ObjectRecord> filter) {
        List<ObjectRecord> byName = new ArrayList<>();
        List<ObjectRecord> byPath = new ArrayList<>();
        List<ObjectRecord> byComment = new ArrayList<>();
        for (ObjectRecord record : records.values()) {
            if (!filter.test(record)) {
                continue;
            }
            if (label.equals(record.getString("name"))) {
                byName.add(record);
            } else if (label.equals(record.getString("path"))) {
                byPath.add(record);
            } else if (label.equals(record.getKeyComment())) {
                byComment.add(record);
            }
        }
        if (!byName.isEmpty()) return byName;
        if (!byPath.isEmpty()) return byPath;
        return byComment;
    }
}
