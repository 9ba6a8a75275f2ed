package com.pbxguard.integrity;

public enum ViolationType {
    DUPLICATE_ID(true),
    MALFORMED_ID(true),
    MISSING_ISA(true),
    MISSING_ROOT_OBJECT(true),
    DANGLING_REFERENCE(true),
    ORPHAN_OBJECT(false),
    UNBALANCED_GROUPED_SECTION(false);

    private final boolean blockingByDefault;

    ViolationType(boolean blockingByDefault) {
        this.blockingByDefault = blockingByDefault;
    }

    public boolean isBlockingByDefault() {
        return blockingByDefault;
    }
}
