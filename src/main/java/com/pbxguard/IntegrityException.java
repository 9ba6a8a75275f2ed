package com.pbxguard;

import com.pbxguard.integrity.IntegrityReport;

import java.io.IOException;

/**
 * Refusal to write a document that still has blocking violations.
 */
public class IntegrityException extends IOException {
    private final IntegrityReport report;

    public IntegrityException(IntegrityReport report) {
        super("Refusing to save: " + report.blocking().size() + " blocking violation(s)");
        this.report = report;
    }

    public IntegrityReport getReport() {
        return report;
    }
}
