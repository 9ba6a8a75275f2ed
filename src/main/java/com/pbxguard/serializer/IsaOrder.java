package com.pbxguard.serializer;

import java.util.Comparator;
import java.util.List;

/**
 * Order in which object sections are written. Known isas come first in the
 * order Xcode writes them; anything else follows alphabetically.
 */
public final class IsaOrder implements Comparator<String> {

    public static final IsaOrder INSTANCE = new IsaOrder();

    static final List<String> KNOWN = List.of(
        "PBXAggregateTarget",
        "PBXBuildFile",
        "PBXBuildRule",
        "PBXContainerItemProxy",
        "PBXCopyFilesBuildPhase",
        "PBXFileReference",
        "PBXFileSystemSynchronizedBuildFileExceptionSet",
        "PBXFileSystemSynchronizedRootGroup",
        "PBXFrameworksBuildPhase",
        "PBXGroup",
        "PBXHeadersBuildPhase",
        "PBXLegacyTarget",
        "PBXNativeTarget",
        "PBXProject",
        "PBXReferenceProxy",
        "PBXResourcesBuildPhase",
        "PBXShellScriptBuildPhase",
        "PBXSourcesBuildPhase",
        "PBXTargetDependency",
        "PBXVariantGroup",
        "XCBuildConfiguration",
        "XCConfigurationList",
        "XCLocalSwiftPackageReference",
        "XCRemoteSwiftPackageReference",
        "XCSwiftPackageProductDependency",
        "XCVersionGroup"
    );

    private IsaOrder() {}

    @Override
    public int compare(String a, String b) {
        int ia = KNOWN.indexOf(a);
        int ib = KNOWN.indexOf(b);
        if (ia >= 0 && ib >= 0) {
            return Integer.compare(ia, ib);
        }
        if (ia >= 0) {
            return -1;
        }
        if (ib >= 0) {
            return 1;
        }
        return a.compareTo(b);
    }
}
