package com.pbxguard.graph;

import com.pbxguard.parser.ProjectParseException;
import com.pbxguard.value.ArrayValue;
import com.pbxguard.value.DictValue;
import com.pbxguard.value.Document;
import com.pbxguard.value.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the parsed {@code objects} dictionary into an {@link ObjectGraph}.
 * Pure: the document is read, never modified.
 */
public class ObjectGraphBuilder {

    /**
     * Builds the graph, failing on the first repeated identifier.
     */
    public ObjectGraph build(Document document) throws ProjectParseException, DuplicateIdentifierException {
        ObjectGraph graph = buildLenient(document);
        if (!graph.getDuplicates().isEmpty()) {
            throw new DuplicateIdentifierException(graph.getDuplicates().get(0).getId());
        }
        return graph;
    }

    /**
     * Builds the graph keeping the first definition of each id and recording the
     * others as duplicates, so they can be reported or repaired.
     */
    public ObjectGraph buildLenient(Document document) throws ProjectParseException {
        DictValue objects = document.getObjects();
        if (objects == null) {
            throw new ProjectParseException("Root dictionary has no '" + Document.OBJECTS_KEY + "' dictionary", 1, 1, 0);
        }

        Map<String, ObjectRecord> records = new LinkedHashMap<>();
        List<ObjectRecord> duplicates = new ArrayList<>();
        List<Edge> edges = new ArrayList<>();

        for (DictValue.Entry entry : objects) {
            Value value = entry.getValue();
            DictValue fields = value.isDict() ? value.asDict() : null;
            ObjectRecord record = new ObjectRecord(entry.getKey(), entry.getKeyComment(), fields, entry.getSection());
            if (records.containsKey(entry.getKey())) {
                duplicates.add(record);
                continue;
            }
            records.put(entry.getKey(), record);
            if (fields != null) {
                collectEdges(entry.getKey(), "", fields, edges);
            }
        }

        String rootObjectId = null;
        for (DictValue.Entry entry : document.getRoot()) {
            if (Document.OBJECTS_KEY.equals(entry.getKey())) {
                continue;
            }
            collectValueEdges(null, entry.getKey(), entry.getValue(), edges);
            if (Document.ROOT_OBJECT_KEY.equals(entry.getKey()) && entry.getValue().isIdent()) {
                rootObjectId = entry.getValue().asIdent().getId();
            }
        }

        return new ObjectGraph(document, records, duplicates, edges, rootObjectId);
    }

    private void collectEdges(String fromId, String prefix, DictValue dict, List<Edge> edges) {
        for (DictValue.Entry entry : dict) {
            String path = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            collectValueEdges(fromId, path, entry.getValue(), edges);
        }
    }

    private void collectValueEdges(String fromId, String path, Value value, List<Edge> edges) {
        if (value.isIdent()) {
            edges.add(new Edge(fromId, path, value.asIdent().getId(), EdgeKind.forField(path)));
        } else if (value.isDict()) {
            collectEdges(fromId, path, value.asDict(), edges);
        } else if (value.isArray()) {
            ArrayValue array = value.asArray();
            for (Value element : array) {
                collectValueEdges(fromId, path, element, edges);
            }
        }
    }
}
