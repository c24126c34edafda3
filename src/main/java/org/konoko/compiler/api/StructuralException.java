package org.konoko.compiler.api;

/**
 * Thrown when the loop markers in the instruction sequence do not balance.
 */
public class StructuralException extends CompilationException {

    /**
     * @param message The detail message.
     */
    public StructuralException(String message) {
        super(message);
    }
}
