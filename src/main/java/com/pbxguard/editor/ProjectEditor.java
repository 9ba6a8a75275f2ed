package com.pbxguard.editor;

import com.pbxguard.AppLogger;
import com.pbxguard.graph.ObjectGraph;
import com.pbxguard.graph.ObjectGraphBuilder;
import com.pbxguard.graph.ObjectRecord;
import com.pbxguard.integrity.IntegrityChecker;
import com.pbxguard.integrity.IntegrityReport;
import com.pbxguard.integrity.Violation;
import com.pbxguard.integrity.ViolationType;
import com.pbxguard.models.LintConfig;
import com.pbxguard.parser.ProjectParseException;
import com.pbxguard.value.ArrayValue;
import com.pbxguard.value.Comments;
import com.pbxguard.value.DictValue;
import com.pbxguard.value.Document;
import com.pbxguard.value.IdentValue;
import com.pbxguard.value.StringValue;
import com.pbxguard.value.Value;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The only way to change a loaded document. Every operation runs as a transaction:
 * the tree is snapshotted, the change applied, the graph rebuilt and re-checked,
 * and the snapshot restored if the change introduced a blocking violation that
 * was not already there. A failed operation leaves the document exactly as it was.
 */
public class ProjectEditor {

    private final Document document;
    private final ObjectGraphBuilder builder = new ObjectGraphBuilder();
    private final IntegrityChecker checker;
    private final LintConfig config;
    private final IdGenerator idGenerator;
    private ObjectGraph graph;
    private IntegrityReport report;
    private int depth;

    public ProjectEditor(Document document) throws ProjectParseException {
        this(document, LintConfig.defaults(), new IdGenerator());
    }

    public ProjectEditor(Document document, LintConfig config, IdGenerator idGenerator) throws ProjectParseException {
        this.document = document;
        this.config = config != null ? config : LintConfig.defaults();
        this.checker = new IntegrityChecker(this.config);
        this.idGenerator = idGenerator;
        this.graph = builder.buildLenient(document);
        this.report = checker.check(graph);
    }

    public Document getDocument() {
        return document;
    }

    public ObjectGraph getGraph() {
        return graph;
    }

    public IntegrityReport getReport() {
        return report;
    }

    // -------------------------------------------------------------------------
    // Objects
    // -------------------------------------------------------------------------

    public EditResult<String> addObject(String isa, DictValue fields) {
        return addObject(isa, fields, null);
    }

    /**
     * Adds a record under a freshly generated id. No inbound edge is created; an
     * unlinked record is reported as an orphan.
     */
    public EditResult<String> addObject(String isa, DictValue fields, String comment) {
        return transact("addObject " + isa, () -> {
            String id = idGenerator.next(objects().keys());
            return putRecord(id, isa, fields, comment);
        });
    }

    /**
     * Adds a record under a caller-chosen id.
     */
    public EditResult<String> insertObject(String id, String isa, DictValue fields, String comment) {
        return transact("insertObject " + id, () -> {
            if (objects().containsKey(id)) {
                return EditResult.failure(EditErrorKind.DUPLICATE_IDENTIFIER, "Identifier already in use: " + id);
            }
            return putRecord(id, isa, fields, comment);
        });
    }

    /**
     * Removes a record, then removes every reference to it from the rest of the
     * document. Returns the references that were scrubbed.
     */
    public EditResult<List<ScrubbedReference>> deleteObject(String id) {
        return transact("deleteObject " + id, () -> {
            if (!objects().containsKey(id)) {
                return EditResult.failure(EditErrorKind.OBJECT_NOT_FOUND, "No object with id " + id);
            }
            objects().remove(id);
            return EditResult.success(new ReferenceScrubber().scrub(document, Set.of(id)));
        });
    }

    /**
     * Like {@link #deleteObject} but also deletes build files left without the file
     * or product they were built from.
     */
    public EditResult<List<ScrubbedReference>> deleteObjectCascading(String id) {
        return transact("deleteObjectCascading " + id, () -> {
            if (!objects().containsKey(id)) {
                return EditResult.failure(EditErrorKind.OBJECT_NOT_FOUND, "No object with id " + id);
            }
            List<ScrubbedReference> all = new ArrayList<>();
            Deque<String> pending = new ArrayDeque<>();
            Set<String> deleted = new HashSet<>();
            pending.add(id);
            while (!pending.isEmpty()) {
                String next = pending.poll();
                if (!deleted.add(next) || !objects().containsKey(next)) {
                    continue;
                }
                objects().remove(next);
                for (ScrubbedReference ref : new ReferenceScrubber().scrub(document, Set.of(next))) {
                    all.add(ref);
                    if (ref.objectId() != null && isOrphanedBuildFile(ref)) {
                        pending.add(ref.objectId());
                    }
                }
            }
            return EditResult.success(all);
        });
    }

    private boolean isOrphanedBuildFile(ScrubbedReference ref) {
        Value record = objects().get(ref.objectId());
        if (record == null || !record.isDict()) {
            return false;
        }
        return "PBXBuildFile".equals(record.asDict().getString(ObjectRecord.ISA))
            && ("fileRef".equals(ref.field()) || "productRef".equals(ref.field()));
    }

    // -------------------------------------------------------------------------
    // Edges
    // -------------------------------------------------------------------------

    /**
     * Appends a reference to {@code targetId} to the list field of a container,
     * creating the list when absent.
     */
    public EditResult<Void> addEdge(String containerId, String field, String targetId, String comment) {
        return transact("addEdge " + containerId + "." + field, () -> {
            DictValue fields = fieldsOf(containerId);
            if (fields == null) {
                return EditResult.failure(EditErrorKind.OBJECT_NOT_FOUND, "No object with id " + containerId);
            }
            if (!graph.contains(targetId)) {
                return EditResult.failure(EditErrorKind.TARGET_NOT_FOUND, "No object with id " + targetId);
            }
            Value existing = fields.get(field);
            ArrayValue list;
            if (existing == null) {
                list = new ArrayValue();
                fields.put(field, list);
            } else if (existing.isArray()) {
                list = existing.asArray();
            } else {
                return EditResult.failure(EditErrorKind.INVALID_FIELD,
                    "Field " + containerId + "." + field + " is not a list");
            }
            if (!Comments.isWritable(comment)) {
                return EditResult.failure(EditErrorKind.INVALID_FIELD, "Comment may not contain " + Comments.TERMINATOR);
            }
            if (list.containsIdent(targetId)) {
                return EditResult.failure(EditErrorKind.DUPLICATE_EDGE,
                    containerId + "." + field + " already references " + targetId);
            }
            list.add(new IdentValue(targetId, comment != null ? comment : defaultComment(targetId)));
            return EditResult.success(null);
        });
    }

    /**
     * Removes one reference to {@code targetId} from a list field (or a single
     * reference field). Returns whether anything was removed.
     */
    public EditResult<Boolean> removeEdge(String containerId, String field, String targetId) {
        return transact("removeEdge " + containerId + "." + field, () -> {
            DictValue fields = fieldsOf(containerId);
            if (fields == null) {
                return EditResult.success(false);
            }
            Value existing = fields.get(field);
            if (existing == null) {
                return EditResult.success(false);
            }
            if (existing.isIdent()) {
                if (!existing.asIdent().refersTo(targetId)) {
                    return EditResult.success(false);
                }
                fields.remove(field);
                return EditResult.success(true);
            }
            if (!existing.isArray()) {
                return EditResult.success(false);
            }
            return EditResult.success(existing.asArray().remove(IdentValue.of(targetId)));
        });
    }

    /**
     * Permutes a list field. {@code newOrder} must contain exactly the existing
     * elements; identifier comments are taken from the existing elements.
     */
    public EditResult<Void> reorder(String containerId, String field, List<? extends Value> newOrder) {
        return transact("reorder " + containerId + "." + field, () -> {
            DictValue fields = fieldsOf(containerId);
            if (fields == null) {
                return EditResult.failure(EditErrorKind.OBJECT_NOT_FOUND, "No object with id " + containerId);
            }
            Value existing = fields.get(field);
            if (existing == null || !existing.isArray()) {
                return EditResult.failure(EditErrorKind.INVALID_FIELD,
                    "Field " + containerId + "." + field + " is not a list");
            }
            List<Value> pool = new ArrayList<>(existing.asArray().getElements());
            if (newOrder.size() != pool.size()) {
                return EditResult.failure(EditErrorKind.NOT_A_PERMUTATION,
                    "Expected " + pool.size() + " elements but got " + newOrder.size());
            }
            List<Value> reordered = new ArrayList<>();
            for (Value wanted : newOrder) {
                int at = pool.indexOf(wanted);
                if (at < 0) {
                    return EditResult.failure(EditErrorKind.NOT_A_PERMUTATION,
                        "Element " + wanted + " is not in " + containerId + "." + field);
                }
                reordered.add(pool.remove(at));
            }
            existing.asArray().replaceAll(reordered);
            return EditResult.success(null);
        });
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    public EditResult<Void> setField(String objectId, String field, Value value) {
        return transact("setField " + objectId + "." + field, () -> {
            DictValue fields = fieldsOf(objectId);
            if (fields == null) {
                return EditResult.failure(EditErrorKind.OBJECT_NOT_FOUND, "No object with id " + objectId);
            }
            if (ObjectRecord.ISA.equals(field)) {
                if (!value.isString() || value.asString().getText().isBlank()) {
                    return EditResult.failure(EditErrorKind.INVALID_FIELD, "isa must be a non-empty string");
                }
                if (!Comments.isWritable(value.asString().getText())) {
                    return EditResult.failure(EditErrorKind.INVALID_FIELD, "isa may not contain " + Comments.TERMINATOR);
                }
                DictValue.Entry entry = objects().getEntry(objectId);
                if (entry.getSection() != null) {
                    entry.setSection(value.asString().getText());
                }
            }
            fields.put(field, value.deepCopy());
            return EditResult.success(null);
        });
    }

    public EditResult<Boolean> removeField(String objectId, String field) {
        return transact("removeField " + objectId + "." + field, () -> {
            DictValue fields = fieldsOf(objectId);
            if (fields == null) {
                return EditResult.failure(EditErrorKind.OBJECT_NOT_FOUND, "No object with id " + objectId);
            }
            if (ObjectRecord.ISA.equals(field)) {
                return EditResult.failure(EditErrorKind.INVALID_FIELD, "isa cannot be removed");
            }
            return EditResult.success(fields.remove(field));
        });
    }

    // -------------------------------------------------------------------------
    // Repairs
    // -------------------------------------------------------------------------

    /**
     * Removes every reference whose target does not exist.
     */
    public EditResult<List<ScrubbedReference>> scrubDanglingReferences() {
        return transact("scrubDanglingReferences", () -> {
            Set<String> missing = new LinkedHashSet<>();
            for (Violation violation : report.ofType(ViolationType.DANGLING_REFERENCE)) {
                missing.add(violation.getTargetId());
            }
            // rootObject is left in place; a dangling root stays reported rather than vanishing
            ReferenceScrubber scrubber = new ReferenceScrubber(field ->
                config.getExternalReferenceFields().contains(field) || Document.ROOT_OBJECT_KEY.equals(field));
            return EditResult.success(scrubber.scrub(document, missing));
        });
    }

    /**
     * Resolves repeated object ids: a definition identical to the first is dropped,
     * a conflicting one is moved to a fresh id. Returns one line per repair.
     */
    public EditResult<List<String>> deduplicateIdentifiers() {
        return transact("deduplicateIdentifiers", () -> {
            List<String> repairs = new ArrayList<>();
            Map<String, Value> firstDefinitions = new HashMap<>();
            DictValue objects = objects();
            for (DictValue.Entry entry : new ArrayList<>(objects.getEntries())) {
                Value first = firstDefinitions.get(entry.getKey());
                if (first == null) {
                    firstDefinitions.put(entry.getKey(), entry.getValue());
                    continue;
                }
                if (first.equals(entry.getValue())) {
                    objects.removeEntry(entry);
                    repairs.add("Removed identical duplicate definition of " + entry.getKey());
                } else {
                    String fresh = idGenerator.next(objects.keys());
                    objects.replaceKey(entry, fresh);
                    repairs.add("Moved conflicting definition of " + entry.getKey() + " to " + fresh);
                }
            }
            return EditResult.success(repairs);
        });
    }

    // -------------------------------------------------------------------------
    // Transactions
    // -------------------------------------------------------------------------

    /**
     * Runs several operations as one transaction: if the function fails, or the
     * combined result introduces a blocking violation, everything is rolled back.
     * Operations inside the function are not checked one by one, so intermediate
     * states (a record added before its inbound edge) are allowed.
     */
    public <T> EditResult<T> batch(String description, Function<ProjectEditor, EditResult<T>> operations) {
        return transact(description, () -> operations.apply(this));
    }

    private <T> EditResult<T> transact(String description, Supplier<EditResult<T>> operation) {
        Set<Violation> before = new HashSet<>(report.blocking());
        DictValue snapshot = document.getRoot().deepCopy();
        EditResult<T> result;
        depth++;
        try {
            result = operation.get();
        } catch (RuntimeException e) {
            rollback(snapshot);
            throw e;
        } finally {
            depth--;
        }
        if (!result.isSuccess()) {
            rollback(snapshot);
            log("Rejected " + description + ": " + result.getError());
            return result;
        }
        ObjectGraph candidate = rebuild();
        IntegrityReport after = checker.check(candidate);
        if (depth > 0) {
            // inside a batch: the enclosing transaction judges the combined result
            graph = candidate;
            report = after;
            return result;
        }
        List<Violation> introduced = new ArrayList<>();
        for (Violation violation : after.blocking()) {
            if (!before.contains(violation)) {
                introduced.add(violation);
            }
        }
        if (!introduced.isEmpty()) {
            rollback(snapshot);
            log("Rejected " + description + ": would introduce " + introduced);
            return EditResult.failure(EditError.wouldViolateIntegrity(introduced));
        }
        graph = candidate;
        report = after;
        log("Committed " + description);
        return result;
    }

    private void rollback(DictValue snapshot) {
        document.replaceRoot(snapshot);
        graph = rebuild();
        report = checker.check(graph);
    }

    private ObjectGraph rebuild() {
        try {
            return builder.buildLenient(document);
        } catch (ProjectParseException e) {
            throw new IllegalStateException("objects dictionary disappeared during an edit", e);
        }
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private EditResult<String> putRecord(String id, String isa, DictValue fields, String comment) {
        if (isa == null || isa.isBlank()) {
            return EditResult.failure(EditErrorKind.INVALID_FIELD, "isa is required");
        }
        if (!Comments.isWritable(isa)) {
            return EditResult.failure(EditErrorKind.INVALID_FIELD, "isa may not contain " + Comments.TERMINATOR);
        }
        if (!Comments.isWritable(comment)) {
            return EditResult.failure(EditErrorKind.INVALID_FIELD, "Comment may not contain " + Comments.TERMINATOR);
        }
        DictValue body = new DictValue();
        body.put(ObjectRecord.ISA, new StringValue(isa));
        if (fields != null) {
            for (DictValue.Entry entry : fields) {
                if (!ObjectRecord.ISA.equals(entry.getKey())) {
                    body.put(entry.getKey(), entry.getValue().deepCopy());
                }
            }
        }
        objects().append(id, comment, body, isSectioned() ? isa : null);
        return EditResult.success(id);
    }

    private boolean isSectioned() {
        for (DictValue.Entry entry : objects()) {
            if (entry.getSection() != null) {
                return true;
            }
        }
        return false;
    }

    private DictValue objects() {
        return document.getObjects();
    }

    private DictValue fieldsOf(String id) {
        Value record = objects().get(id);
        return record != null && record.isDict() ? record.asDict() : null;
    }

    private String defaultComment(String targetId) {
        ObjectRecord target = graph.get(targetId);
        return target != null ? target.getKeyComment() : null;
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[ProjectEditor] " + message);
        }
    }
}
