package com.pbxguard.graph;

import java.util.Map;

/**
 * Role of a reference, derived from the field it sits in.
 */
public enum EdgeKind {
    ROOT,
    BUILD_PHASE_MEMBERSHIP,
    PHASE_CONTENT,
    BUILD_FILE_BACKING,
    GROUP_CONTAINMENT,
    DEPENDENCY,
    TARGET_LIST,
    CONFIGURATION,
    PACKAGE,
    PROXY,
    OTHER;

    private static final Map<String, EdgeKind> BY_FIELD = Map.ofEntries(
        Map.entry("rootObject", ROOT),
        Map.entry("buildPhases", BUILD_PHASE_MEMBERSHIP),
        Map.entry("files", PHASE_CONTENT),
        Map.entry("fileRef", BUILD_FILE_BACKING),
        Map.entry("productRef", BUILD_FILE_BACKING),
        Map.entry("children", GROUP_CONTAINMENT),
        Map.entry("mainGroup", GROUP_CONTAINMENT),
        Map.entry("productRefGroup", GROUP_CONTAINMENT),
        Map.entry("productReference", GROUP_CONTAINMENT),
        Map.entry("dependencies", DEPENDENCY),
        Map.entry("target", DEPENDENCY),
        Map.entry("targetProxy", DEPENDENCY),
        Map.entry("targets", TARGET_LIST),
        Map.entry("buildConfigurationList", CONFIGURATION),
        Map.entry("buildConfigurations", CONFIGURATION),
        Map.entry("packageReferences", PACKAGE),
        Map.entry("packageProductDependencies", PACKAGE),
        Map.entry("package", PACKAGE),
        Map.entry("containerPortal", PROXY),
        Map.entry("remoteGlobalIDString", PROXY)
    );

    /**
     * Kind for a field path such as {@code files} or {@code settings.ATTRIBUTES}.
     * Only the last path segment is consulted.
     */
    public static EdgeKind forField(String fieldPath) {
        return BY_FIELD.getOrDefault(leaf(fieldPath), OTHER);
    }

    /**
     * Fields that are expected to hold references, and only references.
     */
    public static boolean isReferenceField(String fieldPath) {
        return BY_FIELD.containsKey(leaf(fieldPath));
    }

    static String leaf(String fieldPath) {
        int dot = fieldPath.lastIndexOf('.');
        return dot >= 0 ? fieldPath.substring(dot + 1) : fieldPath;
    }
}
