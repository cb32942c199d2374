package com.spreadsheet.formula.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.spreadsheet.formula.exceptions.InvalidAxisException;

import java.util.Locale;

/**
 * Direction of a structural edit: inserting or deleting a whole ROW or COLUMN.
 */
public enum Axis {
    ROW,
    COLUMN;

    /**
     * Allows case-insensitive input.
     * For example, "row" -> ROW, "Column" -> COLUMN.
     */
    @JsonCreator
    public static Axis fromValue(String value) {
        if (value != null) {
            for (Axis axis : values()) {
                if (axis.name().equals(value.trim().toUpperCase(Locale.ROOT))) {
                    return axis;
                }
            }
        }
        throw new InvalidAxisException("Unknown axis: " + value + " (expected row or column)");
    }
}
