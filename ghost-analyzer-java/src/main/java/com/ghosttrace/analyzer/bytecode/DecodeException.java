package com.ghosttrace.analyzer.bytecode;

/**
 * Thrown when an instruction blob cannot be parsed into a well-formed instruction stream.
 * Fatal to the one analysis call that hit it; other modules are unaffected.
 */
public class DecodeException extends RuntimeException {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
