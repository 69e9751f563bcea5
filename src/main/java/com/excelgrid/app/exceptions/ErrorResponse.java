package com.excelgrid.app.exceptions;

/**
 * Simple DTO to structure error responses with a code and message.
 * For example:
 * {
 *   "code": "INVALID_REFERENCE",
 *   "message": "Invalid cell reference: a1"
 * }
 */
public class ErrorResponse {
    private String code;
    private String message;

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
