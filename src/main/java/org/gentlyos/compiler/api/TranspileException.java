package org.gentlyos.compiler.api;

/**
 * Thrown when CODIE input cannot be turned into a Move module at all: no module definition is
 * present, the source does not parse, or a hash does not resolve. Degraded input that can still
 * be scaffolded is reported through {@link MoveModule#diagnostics()} instead.
 */
public class TranspileException extends RuntimeException {

    public TranspileException(String message) {
        super(message);
    }

    public TranspileException(String message, Throwable cause) {
        super(message, cause);
    }
}
