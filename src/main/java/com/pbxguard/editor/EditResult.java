package com.pbxguard.editor;

/**
 * Outcome of a {@link ProjectEditor} operation: either a value or an {@link EditError}.
 */
public final class EditResult<T> {
    private final T value;
    private final EditError error;

    private EditResult(T value, EditError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> EditResult<T> success(T value) {
        return new EditResult<>(value, null);
    }

    public static <T> EditResult<T> failure(EditError error) {
        return new EditResult<>(null, error);
    }

    public static <T> EditResult<T> failure(EditErrorKind kind, String message) {
        return new EditResult<>(null, EditError.of(kind, message));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("Edit failed: " + error);
        }
        return value;
    }

    public EditError getError() {
        return error;
    }

    /**
     * Re-types a failure so it can be returned from an operation with a different value type.
     */
    public <U> EditResult<U> propagate() {
        if (error == null) {
            throw new IllegalStateException("Cannot propagate a successful result");
        }
        return new EditResult<>(null, error);
    }

    public EditErrorKind getErrorKind() {
        return error != null ? error.getKind() : null;
    }

    @Override
    public String toString() {
        return isSuccess() ? "Success(" + value + ")" : "Failure(" + error + ")";
    }
}
