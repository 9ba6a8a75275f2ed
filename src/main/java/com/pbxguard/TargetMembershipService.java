package com.pbxguard;

import com.pbxguard.editor.EditErrorKind;
import com.pbxguard.editor.EditResult;
import com.pbxguard.editor.ProjectEditor;
import com.pbxguard.graph.ObjectGraph;
import com.pbxguard.graph.ObjectRecord;
import com.pbxguard.value.DictValue;
import com.pbxguard.value.IdentValue;
import com.pbxguard.value.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Answers "is this file built by that target?" by following edges
 * target → build phase → build file → file reference, and adds files to targets.
 */
public class TargetMembershipService {

    public static final Set<String> TARGET_ISAS = Set.of("PBXNativeTarget", "PBXAggregateTarget", "PBXLegacyTarget");
    public static final Set<String> FILE_ISAS =
        Set.of("PBXFileReference", "PBXVariantGroup", "PBXReferenceProxy", "XCVersionGroup");
    public static final Set<String> GROUP_ISAS = Set.of("PBXGroup", "PBXVariantGroup");

    /**
     * Maps a short phase name ({@code Sources}, {@code Frameworks}, ...) to its isa.
     * A full isa is accepted unchanged.
     */
    public static String phaseIsa(String phase) {
        if (phase.startsWith("PBX") && phase.endsWith("BuildPhase")) {
            return phase;
        }
        switch (phase.toLowerCase(Locale.ROOT)) {
            case "sources":
                return "PBXSourcesBuildPhase";
            case "frameworks":
                return "PBXFrameworksBuildPhase";
            case "resources":
                return "PBXResourcesBuildPhase";
            case "headers":
                return "PBXHeadersBuildPhase";
            case "copyfiles":
                return "PBXCopyFilesBuildPhase";
            case "shellscript":
                return "PBXShellScriptBuildPhase";
            default:
                return "PBX" + phase + "BuildPhase";
        }
    }

    public Membership check(ObjectGraph graph, String fileName, String targetName, String phase) throws UsageException {
        String targetId = ObjectResolver.resolve(graph, targetName, TARGET_ISAS);
        if (targetId == null) {
            return new Membership(null, List.of(), List.of());
        }
        List<String> phaseIds = phasesOf(graph, targetId, phaseIsa(phase));
        List<String> buildFileIds = new ArrayList<>();
        for (String phaseId : phaseIds) {
            for (String buildFileId : referencedIds(graph.get(phaseId), "files")) {
                ObjectRecord buildFile = graph.get(buildFileId);
                if (buildFile == null) {
                    continue;
                }
                String fileId = referencedId(buildFile.get("fileRef"));
                ObjectRecord file = fileId != null ? graph.get(fileId) : null;
                if (file != null && matchesFileName(file, fileName)) {
                    buildFileIds.add(buildFileId);
                }
            }
        }
        return new Membership(targetId, phaseIds, buildFileIds);
    }

    /**
     * Creates a build file for the file reference and appends it to the target's
     * phase, as one transaction.
     *
     * @return the id of the new build file
     */
    public EditResult<String> addToTarget(ProjectEditor editor, String fileIdOrName, String targetName, String phase)
            throws UsageException {
        ObjectGraph graph = editor.getGraph();
        String targetId = ObjectResolver.resolve(graph, targetName, TARGET_ISAS);
        if (targetId == null) {
            return EditResult.failure(EditErrorKind.TARGET_NOT_FOUND, "No target named " + targetName);
        }
        String fileId = ObjectResolver.resolve(graph, fileIdOrName, FILE_ISAS);
        if (fileId == null) {
            return EditResult.failure(EditErrorKind.TARGET_NOT_FOUND, "No file reference " + fileIdOrName);
        }
        String isa = phaseIsa(phase);
        List<String> phaseIds = phasesOf(graph, targetId, isa);
        if (phaseIds.isEmpty()) {
            return EditResult.failure(EditErrorKind.OBJECT_NOT_FOUND, targetName + " has no " + isa);
        }
        String phaseId = phaseIds.get(0);
        for (String buildFileId : referencedIds(graph.get(phaseId), "files")) {
            ObjectRecord buildFile = graph.get(buildFileId);
            if (buildFile != null && fileId.equals(referencedId(buildFile.get("fileRef")))) {
                return EditResult.failure(EditErrorKind.DUPLICATE_EDGE,
                    fileIdOrName + " is already in " + targetName + " (" + buildFileId + ")");
            }
        }

        ObjectRecord file = graph.get(fileId);
        String fileLabel = file.getKeyComment() != null ? file.getKeyComment() : file.displayName();
        String comment = fileLabel + " in " + phaseLabel(graph.get(phaseId));
        return editor.batch("addToTarget " + fileIdOrName + " -> " + targetName,
            e -> linkBuildFile(e, fileId, fileLabel, phaseId, comment));
    }

    /**
     * Creates a file reference under a group and builds it in a target's phase, as
     * one transaction: the file is either fully linked or not added at all.
     *
     * @param filePath path of the file relative to the group
     */
    public EditResult<ImportedFile> importFile(ProjectEditor editor, String filePath, String groupName,
                                               String targetName, String phase) throws UsageException {
        ObjectGraph graph = editor.getGraph();
        String groupId = ObjectResolver.resolve(graph, groupName, GROUP_ISAS);
        if (groupId == null) {
            return EditResult.failure(EditErrorKind.OBJECT_NOT_FOUND, "No group named " + groupName);
        }
        String targetId = ObjectResolver.resolve(graph, targetName, TARGET_ISAS);
        if (targetId == null) {
            return EditResult.failure(EditErrorKind.TARGET_NOT_FOUND, "No target named " + targetName);
        }
        String isa = phaseIsa(phase);
        List<String> phaseIds = phasesOf(graph, targetId, isa);
        if (phaseIds.isEmpty()) {
            return EditResult.failure(EditErrorKind.OBJECT_NOT_FOUND, targetName + " has no " + isa);
        }
        String phaseId = phaseIds.get(0);
        String fileName = fileName(filePath);
        if (fileName.isEmpty()) {
            return EditResult.failure(EditErrorKind.INVALID_FIELD, "No file name in '" + filePath + "'");
        }
        for (String childId : referencedIds(graph.get(groupId), "children")) {
            ObjectRecord child = graph.get(childId);
            if (child != null && FILE_ISAS.contains(child.getIsa()) && matchesFileName(child, fileName)) {
                return EditResult.failure(EditErrorKind.DUPLICATE_EDGE,
                    fileName + " is already in " + groupName + " (" + childId + ")");
            }
        }

        DictValue fields = new DictValue()
            .put("lastKnownFileType", fileTypeOf(fileName))
            .put("path", filePath)
            .put("sourceTree", "<group>");
        String comment = fileName + " in " + phaseLabel(graph.get(phaseId));

        return editor.batch("importFile " + filePath + " -> " + targetName, e -> {
            EditResult<String> file = e.addObject("PBXFileReference", fields, fileName);
            if (!file.isSuccess()) {
                return file.<ImportedFile>propagate();
            }
            String fileId = file.getValue();
            EditResult<Void> grouped = e.addEdge(groupId, "children", fileId, fileName);
            if (!grouped.isSuccess()) {
                return grouped.<ImportedFile>propagate();
            }
            EditResult<String> built = linkBuildFile(e, fileId, fileName, phaseId, comment);
            if (!built.isSuccess()) {
                return built.<ImportedFile>propagate();
            }
            return EditResult.success(new ImportedFile(fileId, built.getValue()));
        });
    }

    /**
     * Xcode's {@code lastKnownFileType} for a file name, by extension.
     */
    public static String fileTypeOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        String extension = dot >= 0 ? fileName.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
        switch (extension) {
            case "swift":
                return "sourcecode.swift";
            case "m":
                return "sourcecode.c.objc";
            case "mm":
                return "sourcecode.cpp.objcpp";
            case "h":
                return "sourcecode.c.h";
            case "c":
                return "sourcecode.c.c";
            case "cpp":
            case "cc":
                return "sourcecode.cpp.cpp";
            case "metal":
                return "sourcecode.metal";
            case "plist":
                return "text.plist.xml";
            case "strings":
                return "text.plist.strings";
            case "json":
                return "text.json";
            case "storyboard":
                return "file.storyboard";
            case "xib":
                return "file.xib";
            case "xcassets":
                return "folder.assetcatalog";
            case "framework":
                return "wrapper.framework";
            default:
                return "text";
        }
    }

    private EditResult<String> linkBuildFile(ProjectEditor e, String fileId, String fileLabel,
                                             String phaseId, String comment) {
        DictValue fields = new DictValue();
        fields.put("fileRef", new IdentValue(fileId, fileLabel));
        EditResult<String> added = e.addObject("PBXBuildFile", fields, comment);
        if (!added.isSuccess()) {
            return added;
        }
        EditResult<Void> linked = e.addEdge(phaseId, "files", added.getValue(), comment);
        return linked.isSuccess() ? added : linked.<String>propagate();
    }

    private static String fileName(String filePath) {
        String trimmed = filePath.endsWith("/") ? filePath.substring(0, filePath.length() - 1) : filePath;
        return trimmed.substring(trimmed.lastIndexOf('/') + 1);
    }

    private List<String> phasesOf(ObjectGraph graph, String targetId, String isa) {
        List<String> phaseIds = new ArrayList<>();
        for (String phaseId : referencedIds(graph.get(targetId), "buildPhases")) {
            ObjectRecord phase = graph.get(phaseId);
            if (phase != null && phase.isA(isa)) {
                phaseIds.add(phaseId);
            }
        }
        return phaseIds;
    }

    private static String phaseLabel(ObjectRecord phase) {
        String name = phase.getString("name");
        if (name != null) {
            return name;
        }
        String isa = phase.getIsa();
        if (isa.startsWith("PBX") && isa.endsWith("BuildPhase")) {
            return isa.substring(3, isa.length() - "BuildPhase".length());
        }
        return isa;
    }

    private static boolean matchesFileName(ObjectRecord file, String fileName) {
        String name = file.getString("name");
        String path = file.getString("path");
        return fileName.equals(name)
            || fileName.equals(path)
            || (path != null && path.endsWith("/" + fileName));
    }

    private static List<String> referencedIds(ObjectRecord record, String field) {
        List<String> ids = new ArrayList<>();
        Value value = record != null ? record.get(field) : null;
        if (value != null && value.isArray()) {
            for (Value element : value.asArray()) {
                if (element.isIdent()) {
                    ids.add(element.asIdent().getId());
                }
            }
        }
        return ids;
    }

    private static String referencedId(Value value) {
        return value != null && value.isIdent() ? value.asIdent().getId() : null;
    }

    /**
     * Ids created by {@link #importFile}.
     */
    public record ImportedFile(String fileId, String buildFileId) {
    }

    /**
     * Result of a membership check. {@code targetId} is null when no target has the name.
     */
    public record Membership(String targetId, List<String> phaseIds, List<String> buildFileIds) {

        public boolean targetFound() {
            return targetId != null;
        }

        public boolean isMember() {
            return !buildFileIds.isEmpty();
        }
    }
}
