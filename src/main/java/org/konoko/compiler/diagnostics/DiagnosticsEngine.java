package org.konoko.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostics produced by the front end.
 * <p>
 * Scanners report into the engine and keep going; the caller decides after the
 * phase whether the collected errors are fatal.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message  The error message.
     * @param fileName The source in which the error occurred.
     * @param line     The line of the error.
     * @param column   The column of the error.
     */
    public void reportError(String message, String fileName, int line, int column) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, fileName, line, column));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns an unmodifiable view of all collected diagnostics.
     *
     * @return The diagnostics in reporting order.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as one line per entry.
     *
     * @return A formatted summary.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
