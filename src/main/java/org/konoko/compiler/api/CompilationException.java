package org.konoko.compiler.api;

import org.konoko.compiler.diagnostics.DiagnosticsEngine;

/**
 * Thrown when a program cannot be turned into an instruction sequence or a program tree.
 * <p>
 * Every subclass is fatal for the current run: no partial program is returned.
 */
public class CompilationException extends Exception {

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param message The detail message.
     */
    public CompilationException(String message) {
        super(message, null);
    }

    /**
     * Constructs a new compilation exception from the errors collected by a front-end phase.
     * @param phase A short name of the failing phase, used as message prefix.
     * @param diagnostics The engine holding the reported errors.
     */
    public CompilationException(String phase, DiagnosticsEngine diagnostics) {
        super(phase + " failed:\n" + diagnostics.summary(), null);
    }
}
