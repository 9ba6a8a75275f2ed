package com.pbxguard.editor;

import com.pbxguard.integrity.Violation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class EditError {
    private final EditErrorKind kind;
    private final String message;
    private final List<Violation> violations;

    private EditError(EditErrorKind kind, String message, List<Violation> violations) {
        this.kind = kind;
        this.message = message;
        this.violations = violations == null || violations.isEmpty()
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(violations));
    }

    public static EditError of(EditErrorKind kind, String message) {
        return new EditError(kind, message, null);
    }

    public static EditError wouldViolateIntegrity(List<Violation> violations) {
        return new EditError(EditErrorKind.WOULD_VIOLATE_INTEGRITY,
            "Edit rejected: it would introduce " + violations.size() + " blocking violation(s)", violations);
    }

    public EditErrorKind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    /**
     * The blocking violations the edit would have introduced (WOULD_VIOLATE_INTEGRITY only).
     */
    public List<Violation> getViolations() {
        return violations;
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
