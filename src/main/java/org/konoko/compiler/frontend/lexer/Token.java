package org.konoko.compiler.frontend.lexer;

import org.konoko.compiler.isa.Instruction;

/**
 * A single instruction recognised in the source text.
 *
 * @param instruction The instruction the text denotes.
 * @param text The exact text of the token (a natural symbol or a compact run).
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The logical name of the source.
 */
public record Token(
        Instruction instruction,
        String text,
        int line,
        int column,
        String fileName
) {
}
