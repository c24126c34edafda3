package org.konoko.compiler.diagnostics;

/**
 * A single message reported while reading a program.
 *
 * @param type The severity of the diagnostic.
 * @param message The diagnostic message.
 * @param fileName The logical name of the source.
 * @param line The line of the offending text, starting at 1.
 * @param column The column of the offending text, starting at 1.
 */
public record Diagnostic(
        Type type,
        String message,
        String fileName,
        int line,
        int column
) {
    /**
     * The severity of a diagnostic.
     */
    public enum Type {
        /** Prevents the program from being built. */
        ERROR
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d:%d: %s", type, fileName, line, column, message);
    }
}
