package org.konoko.compiler.frontend.lexer;

import org.konoko.compiler.diagnostics.DiagnosticsEngine;
import org.konoko.compiler.isa.Instruction;
import org.konoko.compiler.isa.SymbolTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts natural-notation source text into a sequence of tokens.
 * <p>
 * At each position the longest recognised symbol wins. Whitespace separates
 * nothing and is skipped. Text that starts no symbol is reported to the
 * {@link DiagnosticsEngine} once per run of unknown characters, and scanning
 * continues so that every problem in the source is listed.
 */
public class Lexer {

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the file being read, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return The recognised tokens, in source order.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        return tokens;
    }

    private void scanToken() {
        char c = peek();
        if (c == '\n') {
            current++;
            line++;
            column = 1;
            return;
        }
        if (isWhitespace(c)) {
            advance(1);
            return;
        }

        for (String symbol : SymbolTable.symbols()) {
            if (source.startsWith(symbol, current)) {
                int tokenColumn = column;
                advance(symbol.length());
                Optional<Instruction> instruction = SymbolTable.lookupSymbol(symbol);
                // symbols() only lists spellings that resolve
                tokens.add(new Token(instruction.orElseThrow(), symbol, line, tokenColumn, logicalFileName));
                return;
            }
        }

        unknown();
    }

    private void unknown() {
        int errorColumn = column;
        advance(1);
        while (!isAtEnd() && !isWhitespace(peek()) && peek() != '\n' && !SymbolTable.startsSymbol(peek())) {
            advance(1);
        }
        String text = source.substring(start, current);
        diagnostics.reportError("Unknown symbol: '" + text + "'", logicalFileName, line, errorColumn);
    }

    private void advance(int count) {
        current += count;
        column += count;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n' || c == '\u3000' || c == '\uFEFF';
    }
}
