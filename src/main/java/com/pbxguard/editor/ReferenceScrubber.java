package com.pbxguard.editor;

import com.pbxguard.value.ArrayValue;
import com.pbxguard.value.DictValue;
import com.pbxguard.value.Document;
import com.pbxguard.value.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Removes every identifier in a given set from the whole document: array
 * elements are dropped, dictionary entries holding the identifier are removed,
 * and inside records so are dictionary entries keyed by it.
 */
class ReferenceScrubber {

    private final Predicate<String> skipField;

    ReferenceScrubber() {
        this(field -> false);
    }

    /**
     * @param skipField receives the leaf field name; returning true leaves that field alone
     */
    ReferenceScrubber(Predicate<String> skipField) {
        this.skipField = skipField;
    }

    List<ScrubbedReference> scrub(Document document, Set<String> ids) {
        List<ScrubbedReference> scrubbed = new ArrayList<>();
        if (ids.isEmpty()) {
            return scrubbed;
        }
        DictValue root = document.getRoot();
        for (DictValue.Entry entry : new ArrayList<>(root.getEntries())) {
            if (Document.OBJECTS_KEY.equals(entry.getKey())) {
                continue;
            }
            scrubEntry(root, entry, null, "", ids, scrubbed);
        }
        DictValue objects = document.getObjects();
        if (objects != null) {
            for (DictValue.Entry record : objects) {
                if (record.getValue().isDict()) {
                    scrubDict(record.getValue().asDict(), record.getKey(), "", ids, scrubbed);
                }
            }
        }
        return scrubbed;
    }

    private void scrubDict(DictValue dict, String objectId, String prefix, Set<String> ids,
                           List<ScrubbedReference> scrubbed) {
        for (DictValue.Entry entry : new ArrayList<>(dict.getEntries())) {
            scrubEntry(dict, entry, objectId, prefix, ids, scrubbed);
        }
    }

    private void scrubEntry(DictValue owner, DictValue.Entry entry, String objectId, String prefix,
                            Set<String> ids, List<ScrubbedReference> scrubbed) {
        String path = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
        if (skipField.test(entry.getKey())) {
            return;
        }
        if (objectId != null && ids.contains(entry.getKey())) {
            // id-keyed entries such as PBXProject attributes.TargetAttributes
            owner.removeEntry(entry);
            scrubbed.add(new ScrubbedReference(objectId, path, entry.getKey()));
            return;
        }
        Value value = entry.getValue();
        if (value.isIdent() && ids.contains(value.asIdent().getId())) {
            owner.removeEntry(entry);
            scrubbed.add(new ScrubbedReference(objectId, path, value.asIdent().getId()));
        } else if (value.isDict()) {
            scrubDict(value.asDict(), objectId, path, ids, scrubbed);
        } else if (value.isArray()) {
            scrubArray(value.asArray(), objectId, path, ids, scrubbed);
        }
    }

    private void scrubArray(ArrayValue array, String objectId, String path, Set<String> ids,
                            List<ScrubbedReference> scrubbed) {
        List<Value> kept = new ArrayList<>();
        for (Value element : array) {
            if (element.isIdent() && ids.contains(element.asIdent().getId())) {
                scrubbed.add(new ScrubbedReference(objectId, path, element.asIdent().getId()));
                continue;
            }
            if (element.isDict()) {
                scrubDict(element.asDict(), objectId, path, ids, scrubbed);
            } else if (element.isArray()) {
                scrubArray(element.asArray(), objectId, path, ids, scrubbed);
            }
            kept.add(element);
        }
        if (kept.size() != array.size()) {
            array.replaceAll(kept);
        }
    }
}
