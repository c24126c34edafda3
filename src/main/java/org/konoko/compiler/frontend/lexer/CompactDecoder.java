package org.konoko.compiler.frontend.lexer;

import org.konoko.compiler.diagnostics.DiagnosticsEngine;
import org.konoko.compiler.isa.Instruction;
import org.konoko.compiler.isa.SymbolTable;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes compact-notation source text into a sequence of tokens.
 * <p>
 * The source is split on {@link Instruction#COMPACT_MARKER}. Empty pieces
 * (leading, trailing or doubled markers) are skipped. Every other piece must be
 * a run of {@link Instruction#COMPACT_UNIT} whose length selects the instruction.
 * Whitespace anywhere in the source is ignored.
 */
public class CompactDecoder {

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final String logicalFileName;
    private final List<Token> tokens = new ArrayList<>();

    private final StringBuilder run = new StringBuilder();
    private int runLine;
    private int runColumn;
    private boolean runHasForeignGlyph;

    /**
     * Creates a new decoder.
     * @param source The compact source code.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the file being read, for error reporting.
     */
    public CompactDecoder(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Decodes the whole source.
     * @return The decoded tokens, in source order.
     */
    public List<Token> decode() {
        int line = 1;
        int column = 1;
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '\n') {
                line++;
                column = 1;
                continue;
            }
            if (c == Instruction.COMPACT_MARKER) {
                flushRun();
            } else if (!Lexer.isWhitespace(c)) {
                if (run.length() == 0) {
                    runLine = line;
                    runColumn = column;
                }
                if (c != Instruction.COMPACT_UNIT && !runHasForeignGlyph) {
                    runHasForeignGlyph = true;
                    diagnostics.reportError("Unexpected glyph in compact run: '" + c + "'", logicalFileName, line, column);
                }
                run.append(c);
            }
            column++;
        }
        flushRun();
        return tokens;
    }

    private void flushRun() {
        if (run.length() == 0) {
            return;
        }
        String text = run.toString();
        if (!runHasForeignGlyph) {
            SymbolTable.byRunLength(text.length()).ifPresentOrElse(
                    instruction -> tokens.add(new Token(instruction, text, runLine, runColumn, logicalFileName)),
                    () -> diagnostics.reportError(
                            String.format("Run length %d is outside %d..%d", text.length(),
                                    SymbolTable.MIN_RUN_LENGTH, SymbolTable.MAX_RUN_LENGTH),
                            logicalFileName, runLine, runColumn));
        }
        run.setLength(0);
        runHasForeignGlyph = false;
    }
}
