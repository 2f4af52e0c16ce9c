package org.gentlyos.compiler.api;

/**
 * Thrown by a {@link CodieParser} when source text is not valid CODIE.
 */
public class CodieParseException extends Exception {

    public CodieParseException(String message) {
        super(message);
    }

    public CodieParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
