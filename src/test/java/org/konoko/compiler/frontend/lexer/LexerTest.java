package org.konoko.compiler.frontend.lexer;

import org.konoko.compiler.diagnostics.Diagnostic;
import org.konoko.compiler.diagnostics.DiagnosticsEngine;
import org.konoko.compiler.isa.Instruction;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the natural-notation {@link Lexer}.
 */
@Tag("unit")
class LexerTest {

    @Test
    void testLexerTokenization() {
        // Arrange
        String source = String.join("\n",
                "猫の子猫の子 熊の子",
                "  狸の子鳩の子",
                "虎の子"
        );
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Lexer lexer = new Lexer(source, diagnostics, "loop.konoko");

        // Act
        List<Token> tokens = lexer.scanTokens();

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens).extracting(Token::instruction).containsExactly(
                Instruction.INCREMENT, Instruction.INCREMENT, Instruction.LOOP_START,
                Instruction.DECREMENT, Instruction.OUTPUT, Instruction.LOOP_END);
        assertThat(tokens.get(2)).extracting(Token::text, Token::line, Token::column)
                .containsExactly("熊の子", 1, 8);
        assertThat(tokens.get(3)).extracting(Token::line, Token::column).containsExactly(2, 3);
        assertThat(tokens.get(5)).extracting(Token::line, Token::fileName).containsExactly(3, "loop.konoko");
    }

    @Test
    void kittenAndLionCubAreBothIncrements() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        List<Token> tokens = new Lexer("猫の子獅子の子", diagnostics).scanTokens();

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(tokens).extracting(Token::instruction).containsExactly(Instruction.INCREMENT, Instruction.INCREMENT);
        assertThat(tokens).extracting(Token::text).containsExactly("猫の子", "獅子の子");
    }

    @Test
    void emptyAndBlankSourcesHaveNoTokens() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        assertThat(new Lexer("", diagnostics).scanTokens()).isEmpty();
        assertThat(new Lexer(" \t\r\n　", diagnostics).scanTokens()).isEmpty();
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    void unknownTextIsReportedOncePerRunWithPosition() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        List<Token> tokens = new Lexer("猫の子abc犬の子\n  x", diagnostics, "bad.konoko").scanTokens();

        assertThat(tokens).extracting(Token::instruction).containsExactly(Instruction.INCREMENT, Instruction.MOVE_RIGHT);
        assertThat(diagnostics.getDiagnostics()).hasSize(2);
        Diagnostic first = diagnostics.getDiagnostics().get(0);
        assertThat(first.type()).isEqualTo(Diagnostic.Type.ERROR);
        assertThat(first.message()).contains("'abc'");
        assertThat(first).extracting(Diagnostic::line, Diagnostic::column).containsExactly(1, 4);
        assertThat(diagnostics.getDiagnostics().get(1)).extracting(Diagnostic::line, Diagnostic::column).containsExactly(2, 3);
    }

    @Test
    void incompleteSymbolIsAnError() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        new Lexer("猫の", diagnostics).scanTokens();

        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.summary()).contains("'猫の'");
    }
}
