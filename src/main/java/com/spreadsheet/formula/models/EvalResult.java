package com.spreadsheet.formula.models;

import java.util.Objects;

/**
 * Outcome of evaluating one cell or formula.
 * Once terminal exactly one of value/error is non-null; the only exception
 * is the "empty" result of a cell without content, which reads as having no value.
 * Values are either a {@link Double} or a {@link String}.
 */
public final class EvalResult {

    private static final EvalResult EMPTY = new EvalResult(null, null);

    private final Object value;
    private final String error;

    private EvalResult(Object value, String error) {
        this.value = value;
        this.error = error;
    }

    public static EvalResult of(Object value) {
        if (value == null) {
            return EMPTY;
        }
        if (value instanceof Number) {
            return new EvalResult(((Number) value).doubleValue(), null);
        }
        if (value instanceof String) {
            return new EvalResult(value, null);
        }
        throw new IllegalArgumentException("Unsupported cell value type: " + value.getClass().getName());
    }

    public static EvalResult error(String message) {
        return new EvalResult(null, Objects.requireNonNull(message, "message"));
    }

    public static EvalResult empty() {
        return EMPTY;
    }

    public Object getValue() {
        return value;
    }

    public String getError() {
        return error;
    }

    public boolean hasError() {
        return error != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EvalResult)) {
            return false;
        }
        EvalResult other = (EvalResult) o;
        return Objects.equals(value, other.value) && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        return "{value: " + value + ", error: " + error + "}";
    }
}
