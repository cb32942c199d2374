package com.spreadsheet.formula.exceptions;

import java.time.Instant;

/**
 * JSON body for host-level failures, for example:
 * <pre>
 * {
 *   "code": "SHEET_NOT_FOUND",
 *   "message": "Sheet not found: 42",
 *   "timestamp": "2024-03-15T10:30:00Z"
 * }
 * </pre>
 * Formula errors are never reported this way; they come back as cell results.
 */
public class ErrorResponse {

    public static final String SHEET_NOT_FOUND = "SHEET_NOT_FOUND";
    public static final String INVALID_CELL_REFERENCE = "INVALID_CELL_REFERENCE";
    public static final String INVALID_AXIS = "INVALID_AXIS";
    public static final String SERVER_ERROR = "SERVER_ERROR";

    private final String code;
    private final String message;
    private final Instant timestamp;

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
        this.timestamp = Instant.now();
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
