package com.pbxguard.integrity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public final class IntegrityReport {
    private final List<Violation> violations;

    public IntegrityReport(List<Violation> violations) {
        this.violations = violations != null
            ? Collections.unmodifiableList(new ArrayList<>(violations))
            : Collections.emptyList();
    }

    public List<Violation> getViolations() {
        return violations;
    }

    public List<Violation> blocking() {
        return violations.stream().filter(Violation::isBlocking).collect(Collectors.toList());
    }

    public List<Violation> warnings() {
        return violations.stream().filter(v -> !v.isBlocking()).collect(Collectors.toList());
    }

    public List<Violation> ofType(ViolationType type) {
        return violations.stream().filter(v -> v.getType() == type).collect(Collectors.toList());
    }

    public boolean hasBlockingViolations() {
        return violations.stream().anyMatch(Violation::isBlocking);
    }

    public boolean isClean() {
        return violations.isEmpty();
    }
}
