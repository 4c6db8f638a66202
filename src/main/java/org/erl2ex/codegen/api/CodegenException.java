package org.erl2ex.codegen.api;

/**
 * Thrown when generated code cannot be delivered to the output sink.
 * <p>
 * It is part of the public API. Violations of the IR contract are not reported
 * through this type; they abort rendering with an {@link IllegalStateException}.
 */
public class CodegenException extends Exception {

    /**
     * Constructs a new exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CodegenException(String message, Throwable cause) {
        super(message, cause);
    }
}
