package com.pbxguard;

import com.pbxguard.graph.ObjectGraph;
import com.pbxguard.graph.ObjectRecord;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns a command-line reference (an id or a human name) into one object id.
 */
public final class ObjectResolver {

    private ObjectResolver() {}

    /**
     * @param isas when not empty, only records of these isas are considered for names
     * @return the id, or null when nothing matches
     * @throws UsageException when the name matches more than one record
     */
    public static String resolve(ObjectGraph graph, String idOrName, Set<String> isas) throws UsageException {
        if (graph.contains(idOrName)) {
            return idOrName;
        }
        List<ObjectRecord> matches = graph.findByName(idOrName, record -> isas.isEmpty() || isas.contains(record.getIsa()));
        if (matches.isEmpty()) {
            return null;
        }
        if (matches.size() > 1) {
            String candidates = matches.stream().map(ObjectRecord::toString).collect(Collectors.joining(", "));
            throw new UsageException("'" + idOrName + "' is ambiguous: " + candidates);
        }
        return matches.get(0).getId();
    }

    public static String resolve(ObjectGraph graph, String idOrName) throws UsageException {
        return resolve(graph, idOrName, Set.of());
    }
}
