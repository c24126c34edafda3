package org.konoko.compiler.frontend;

import org.konoko.compiler.api.DecodeException;
import org.konoko.compiler.api.LexException;
import org.konoko.compiler.diagnostics.DiagnosticsEngine;
import org.konoko.compiler.frontend.lexer.CompactDecoder;
import org.konoko.compiler.frontend.lexer.Lexer;
import org.konoko.compiler.frontend.lexer.Token;
import org.konoko.compiler.isa.Instruction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Normalizes source text in either notation into a token stream.
 */
public final class Tokenizer {

    private static final Logger LOG = LoggerFactory.getLogger(Tokenizer.class);

    private Tokenizer() {}

    /**
     * Tokenizes a source, choosing the notation with {@link Notation#detect(String)}.
     *
     * @param source The source text.
     * @param fileName The logical file name used in diagnostics.
     * @return The tokens in source order.
     * @throws LexException if natural-notation text contains unknown symbols.
     * @throws DecodeException if a compact run does not encode an instruction.
     */
    public static List<Token> tokenize(String source, String fileName) throws LexException, DecodeException {
        Notation notation = Notation.detect(source);
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<Token> tokens;
        if (notation == Notation.COMPACT) {
            tokens = new CompactDecoder(source, diagnostics, fileName).decode();
            if (diagnostics.hasErrors()) {
                throw new DecodeException(diagnostics);
            }
        } else {
            tokens = new Lexer(source, diagnostics, fileName).scanTokens();
            if (diagnostics.hasErrors()) {
                throw new LexException(diagnostics);
            }
        }
        LOG.debug("Read {} instructions from {} ({} notation)", tokens.size(), fileName, notation);
        return tokens;
    }

    /**
     * Projects tokens onto their instructions.
     *
     * @param tokens The tokens produced by {@link #tokenize(String, String)}.
     * @return The instruction sequence.
     */
    public static List<Instruction> instructions(List<Token> tokens) {
        return tokens.stream().map(Token::instruction).collect(Collectors.toList());
    }
}
