package com.pbxguard;

import com.pbxguard.editor.EditErrorKind;
import com.pbxguard.editor.EditResult;
import com.pbxguard.editor.ProjectEditor;
import com.pbxguard.editor.ScrubbedReference;
import com.pbxguard.graph.ObjectGraph;
import com.pbxguard.graph.ObjectRecord;
import com.pbxguard.parser.Parser;
import com.pbxguard.parser.ProjectParseException;
import com.pbxguard.value.ArrayValue;
import com.pbxguard.value.DictValue;
import com.pbxguard.value.IdentValue;
import com.pbxguard.value.StringValue;
import com.pbxguard.value.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Edits {@code buildSettings} of a target's build configurations and gives a
 * target private copies of configurations it shares.
 */
public class BuildSettingsService {

    private static final String BUILD_SETTINGS = "buildSettings";
    private static final String BUILD_CONFIGURATIONS = "buildConfigurations";
    private static final String CONFIGURATION_LIST = "buildConfigurationList";

    /**
     * Command-line values: a list or dictionary literal is parsed as one, anything
     * else is taken verbatim as text (so {@code $(inherited)} needs no quoting).
     */
    public static Value parseSettingValue(String raw) throws ProjectParseException {
        String trimmed = raw.trim();
        if (trimmed.startsWith("(") || trimmed.startsWith("{")) {
            return Parser.parseValue(trimmed);
        }
        return new StringValue(raw);
    }

    /**
     * Sets {@code key} in every configuration of the target, or only the one named
     * {@code configuration}. Returns the ids of the configurations that were changed.
     */
    public EditResult<List<String>> set(ProjectEditor editor, String targetName, String configuration,
                                        String key, Value value) throws UsageException {
        return apply(editor, targetName, configuration, key, value);
    }

    public EditResult<List<String>> unset(ProjectEditor editor, String targetName, String configuration,
                                          String key) throws UsageException {
        return apply(editor, targetName, configuration, key, null);
    }

    /**
     * Gives the target its own copies of its build configurations: each one is
     * duplicated under a fresh id with the {@code dropSettings} keys removed, and the
     * target's configuration list is pointed at the copies. Originals left without
     * any referrer are deleted. Returns original id to copy id.
     */
    public EditResult<Map<String, String>> cloneConfigurations(ProjectEditor editor, String targetName,
                                                               Set<String> dropSettings) throws UsageException {
        ObjectGraph graph = editor.getGraph();
        String targetId = ObjectResolver.resolve(graph, targetName, TargetMembershipService.TARGET_ISAS);
        if (targetId == null) {
            return EditResult.failure(EditErrorKind.TARGET_NOT_FOUND, "No target named " + targetName);
        }
        Value listRef = graph.get(targetId).get(CONFIGURATION_LIST);
        List<ObjectRecord> configurations = configurationsOf(graph, targetId, null);
        if (listRef == null || !listRef.isIdent() || configurations.isEmpty()) {
            return EditResult.failure(EditErrorKind.OBJECT_NOT_FOUND, "No build configurations for " + targetName);
        }
        String listId = listRef.asIdent().getId();

        return editor.batch("clone configurations of " + targetName, e -> {
            Map<String, String> clones = new LinkedHashMap<>();
            ArrayValue copies = new ArrayValue();
            for (ObjectRecord config : configurations) {
                DictValue fields = config.getFields().deepCopy();
                Value settings = fields.get(BUILD_SETTINGS);
                if (settings != null && settings.isDict()) {
                    for (String key : dropSettings) {
                        settings.asDict().remove(key);
                    }
                }
                EditResult<String> added = e.addObject(config.getIsa(), fields, config.getKeyComment());
                if (!added.isSuccess()) {
                    return added.<Map<String, String>>propagate();
                }
                clones.put(config.getId(), added.getValue());
                copies.add(new IdentValue(added.getValue(), config.getKeyComment()));
            }
            EditResult<Void> relinked = e.setField(listId, BUILD_CONFIGURATIONS, copies);
            if (!relinked.isSuccess()) {
                return relinked.<Map<String, String>>propagate();
            }
            for (String originalId : clones.keySet()) {
                if (e.getGraph().incomingEdges(originalId).isEmpty()) {
                    EditResult<List<ScrubbedReference>> deleted = e.deleteObject(originalId);
                    if (!deleted.isSuccess()) {
                        return deleted.<Map<String, String>>propagate();
                    }
                }
            }
            return EditResult.success(clones);
        });
    }

    private EditResult<List<String>> apply(ProjectEditor editor, String targetName, String configuration,
                                           String key, Value value) throws UsageException {
        ObjectGraph graph = editor.getGraph();
        String targetId = ObjectResolver.resolve(graph, targetName, TargetMembershipService.TARGET_ISAS);
        if (targetId == null) {
            return EditResult.failure(EditErrorKind.TARGET_NOT_FOUND, "No target named " + targetName);
        }
        List<ObjectRecord> configurations = configurationsOf(graph, targetId, configuration);
        if (configurations.isEmpty()) {
            return EditResult.failure(EditErrorKind.OBJECT_NOT_FOUND, "No build configuration"
                + (configuration != null ? " named " + configuration : "") + " for " + targetName);
        }

        String verb = value != null ? "set " : "unset ";
        return editor.batch(verb + key + " on " + targetName, e -> {
            List<String> changed = new ArrayList<>();
            for (ObjectRecord config : configurations) {
                Value current = config.get(BUILD_SETTINGS);
                DictValue settings = current != null && current.isDict() ? current.asDict().deepCopy() : new DictValue();
                if (value != null) {
                    if (value.equals(settings.get(key))) {
                        continue;
                    }
                    settings.put(key, value);
                } else if (!settings.remove(key)) {
                    continue;
                }
                EditResult<Void> result = e.setField(config.getId(), BUILD_SETTINGS, settings);
                if (!result.isSuccess()) {
                    return result.<List<String>>propagate();
                }
                changed.add(config.getId());
            }
            return EditResult.success(changed);
        });
    }

    private List<ObjectRecord> configurationsOf(ObjectGraph graph, String targetId, String configuration) {
        List<ObjectRecord> result = new ArrayList<>();
        ObjectRecord target = graph.get(targetId);
        Value listRef = target.get(CONFIGURATION_LIST);
        if (listRef == null || !listRef.isIdent()) {
            return result;
        }
        ObjectRecord list = graph.get(listRef.asIdent().getId());
        Value configs = list != null ? list.get(BUILD_CONFIGURATIONS) : null;
        if (configs == null || !configs.isArray()) {
            return result;
        }
        for (Value element : configs.asArray()) {
            ObjectRecord config = element.isIdent() ? graph.get(element.asIdent().getId()) : null;
            if (config == null) {
                continue;
            }
            if (configuration == null || configuration.equals(config.getString("name"))) {
                result.add(config);
            }
        }
        return result;
    }
}
