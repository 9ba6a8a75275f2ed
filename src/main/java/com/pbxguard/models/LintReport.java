package com.pbxguard.models;

import com.pbxguard.integrity.IntegrityReport;
import com.pbxguard.integrity.Violation;

import java.util.ArrayList;
import java.util.List;

/**
 * Machine-readable output of {@code lint --json}.
 */
public class LintReport {
    private String path;
    private int objectCount;
    private int blockingCount;
    private int warningCount;
    private List<Violation> violations = new ArrayList<>();

    public LintReport() {
    }

    public static LintReport of(String path, int objectCount, IntegrityReport report) {
        LintReport lint = new LintReport();
        lint.path = path;
        lint.objectCount = objectCount;
        lint.blockingCount = report.blocking().size();
        lint.warningCount = report.warnings().size();
        lint.violations = new ArrayList<>(report.getViolations());
        return lint;
    }

    public String getPath() { return path; }
    public void setPath(String path) { this.path = path; }

    public int getObjectCount() { return objectCount; }
    public void setObjectCount(int objectCount) { this.objectCount = objectCount; }

    public int getBlockingCount() { return blockingCount; }
    public void setBlockingCount(int blockingCount) { this.blockingCount = blockingCount; }

    public int getWarningCount() { return warningCount; }
    public void setWarningCount(int warningCount) { this.warningCount = warningCount; }

    public boolean isClean() {
        return blockingCount == 0;
    }

    public List<Violation> getViolations() { return violations; }
    public void setViolations(List<Violation> violations) {
        this.violations = violations != null ? violations : new ArrayList<>();
    }
}
