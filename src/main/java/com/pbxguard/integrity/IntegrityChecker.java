package com.pbxguard.integrity;

import com.pbxguard.graph.Edge;
import com.pbxguard.graph.EdgeKind;
import com.pbxguard.graph.ObjectGraph;
import com.pbxguard.graph.ObjectRecord;
import com.pbxguard.models.LintConfig;
import com.pbxguard.value.DictValue;
import com.pbxguard.value.Document;
import com.pbxguard.value.Identifiers;
import com.pbxguard.value.Value;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Validates an {@link ObjectGraph}. Never throws: every problem comes back as a
 * {@link Violation}, in a stable order (duplicates, malformed records, root,
 * dangling references, orphans, sections).
 */
public class IntegrityChecker {

    private final LintConfig config;

    public IntegrityChecker() {
        this(LintConfig.defaults());
    }

    public IntegrityChecker(LintConfig config) {
        this.config = config != null ? config : LintConfig.defaults();
    }

    public IntegrityReport check(ObjectGraph graph) {
        List<Violation> violations = new ArrayList<>();
        checkDuplicates(graph, violations);
        checkRecords(graph, violations);
        checkRoot(graph, violations);
        checkDangling(graph, violations);
        checkOrphans(graph, violations);
        if (config.isCheckSections()) {
            checkSections(graph, violations);
        }
        return new IntegrityReport(violations);
    }

    private void checkDuplicates(ObjectGraph graph, List<Violation> violations) {
        Set<String> reported = new LinkedHashSet<>();
        for (ObjectRecord duplicate : graph.getDuplicates()) {
            if (reported.add(duplicate.getId())) {
                violations.add(Violation.duplicateId(duplicate.getId()));
            }
        }
    }

    private void checkRecords(ObjectGraph graph, List<Violation> violations) {
        for (ObjectRecord record : graph.records()) {
            if (!Identifiers.isWellFormed(record.getId())) {
                violations.add(Violation.malformedObjectKey(record.getId()));
            }
            if (record.getIsa() == null) {
                violations.add(Violation.missingIsa(record.getId()));
                continue;
            }
            for (DictValue.Entry entry : record.getFields()) {
                if (!EdgeKind.isReferenceField(entry.getKey()) || isExternal(entry.getKey())) {
                    continue;
                }
                checkReferenceShape(record.getId(), entry.getKey(), entry.getValue(), violations);
            }
        }
    }

    private void checkReferenceShape(String objectId, String field, Value value, List<Violation> violations) {
        if (value.isString()) {
            violations.add(Violation.malformedReference(objectId, field, value.asString().getText()));
        } else if (value.isArray()) {
            for (Value element : value.asArray()) {
                if (element.isString()) {
                    violations.add(Violation.malformedReference(objectId, field, element.asString().getText()));
                }
            }
        }
    }

    private void checkRoot(ObjectGraph graph, List<Violation> violations) {
        Value rootObject = graph.getDocument().getRoot().get(Document.ROOT_OBJECT_KEY);
        if (rootObject == null || !rootObject.isIdent()) {
            violations.add(Violation.missingRootObject());
        }
    }

    private void checkDangling(ObjectGraph graph, List<Violation> violations) {
        for (Edge edge : graph.getEdges()) {
            if (isExternal(edge.field()) || graph.contains(edge.targetId())) {
                continue;
            }
            violations.add(Violation.dangling(edge.fromId(), edge.field(), edge.targetId()));
        }
    }

    private void checkOrphans(ObjectGraph graph, List<Violation> violations) {
        Set<String> exempt = new HashSet<>(config.getOrphanExemptIsas());
        for (ObjectRecord record : graph.records()) {
            String isa = record.getIsa();
            if (isa == null || exempt.contains(isa)) {
                continue;
            }
            if (!graph.hasIncomingFromOthers(record.getId())) {
                violations.add(Violation.orphan(record.getId(), isa, config.isOrphansBlocking()));
            }
        }
    }

    private void checkSections(ObjectGraph graph, List<Violation> violations) {
        Map<String, List<String>> problems = new TreeMap<>();
        for (String section : graph.getDocument().getMisnestedSections()) {
            addProblem(problems, section, "Begin/End markers are missing or misnested");
        }

        boolean sectioned = false;
        for (ObjectRecord record : graph.records()) {
            if (record.getSection() != null) {
                sectioned = true;
                break;
            }
        }
        if (sectioned) {
            for (ObjectRecord record : graph.records()) {
                String isa = record.getIsa();
                String section = record.getSection();
                if (isa == null) {
                    continue;
                }
                if (section == null) {
                    addProblem(problems, isa, record.getId() + " is outside its section");
                } else if (!section.equals(isa)) {
                    addProblem(problems, section, "contains " + record.getId() + " of isa " + isa);
                    addProblem(problems, isa, record.getId() + " is outside its section");
                }
            }
        }

        for (Map.Entry<String, List<String>> entry : problems.entrySet()) {
            violations.add(Violation.unbalancedSection(entry.getKey(), String.join("; ", entry.getValue())));
        }
    }

    private void addProblem(Map<String, List<String>> problems, String section, String detail) {
        List<String> list = problems.computeIfAbsent(section, k -> new ArrayList<>());
        if (!list.contains(detail)) {
            list.add(detail);
        }
    }

    private boolean isExternal(String fieldPath) {
        int dot = fieldPath.lastIndexOf('.');
        String leaf = dot >= 0 ? fieldPath.substring(dot + 1) : fieldPath;
        return config.getExternalReferenceFields().contains(leaf);
    }
}
