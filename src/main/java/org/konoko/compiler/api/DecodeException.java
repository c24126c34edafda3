package org.konoko.compiler.api;

import org.konoko.compiler.diagnostics.DiagnosticsEngine;

/**
 * Thrown when the compact-notation source contains a run that does not encode an instruction.
 */
public class DecodeException extends CompilationException {

    /**
     * @param diagnostics The engine holding the reported errors.
     */
    public DecodeException(DiagnosticsEngine diagnostics) {
        super("Decoding", diagnostics);
    }
}
