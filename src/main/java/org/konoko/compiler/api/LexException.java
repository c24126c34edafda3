package org.konoko.compiler.api;

import org.konoko.compiler.diagnostics.DiagnosticsEngine;

/**
 * Thrown when the natural-notation source contains text that is not an instruction symbol.
 */
public class LexException extends CompilationException {

    /**
     * @param diagnostics The engine holding the reported errors.
     */
    public LexException(DiagnosticsEngine diagnostics) {
        super("Lexing", diagnostics);
    }
}
