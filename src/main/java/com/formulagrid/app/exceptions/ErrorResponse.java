package com.formulagrid.app.exceptions;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Error body returned by {@link GlobalExceptionHandler}.
 * "cell" names the cell involved, when there is one:
 * {
 *   "code": "CELL_NOT_FOUND",
 *   "message": "Cell C7 not found in table t1",
 *   "cell": "t1!C7"
 * }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private final String code;
    private final String message;
    private final String cell;

    public ErrorResponse(String code, String message) {
        this(code, message, null);
    }

    public ErrorResponse(String code, String message, String cell) {
        this.code = code;
        this.message = message;
        this.cell = cell;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public String getCell() {
        return cell;
    }
}
