package org.konoko.compiler.frontend;

import org.konoko.compiler.isa.Instruction;

/**
 * The two surface notations a program can be written in.
 */
public enum Notation {
    /** Multi-glyph instruction symbols separated by optional whitespace. */
    NATURAL,
    /** Marker-separated runs of a single unit glyph. */
    COMPACT;

    /**
     * Decides which notation a source is written in.
     * A single compact marker anywhere makes the whole source compact.
     *
     * @param source The source text.
     * @return The detected notation.
     */
    public static Notation detect(String source) {
        return source.indexOf(Instruction.COMPACT_MARKER) >= 0 ? COMPACT : NATURAL;
    }
}
