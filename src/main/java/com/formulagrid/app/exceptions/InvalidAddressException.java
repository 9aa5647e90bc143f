package com.formulagrid.app.exceptions;

/**
 * Thrown when cell address text is malformed or points outside
 * the sheet bounds (rows 1..1048576, columns A..XFD).
 * For example, "A0", "XFE1" or "1A".
 */
public class InvalidAddressException extends RuntimeException {
    public InvalidAddressException(String message) {
        super(message);
    }
}
