package org.konoko.compiler.api;

import org.konoko.compiler.frontend.parser.ProgramTree;
import org.konoko.compiler.isa.Instruction;

import java.util.List;

/**
 * The public entry point for reading programs in either notation.
 */
public interface ICompiler {

    /**
     * Reads a source into its instruction sequence.
     *
     * @param source The source text, in natural or compact notation.
     * @param programName The name of the program, used in diagnostics.
     * @return The instruction sequence.
     * @throws CompilationException if the source cannot be read.
     */
    List<Instruction> tokenize(String source, String programName) throws CompilationException;

    /**
     * Reads a source and builds its program tree.
     *
     * @param source The source text, in natural or compact notation.
     * @param programName The name of the program, used in diagnostics.
     * @return The frozen program tree.
     * @throws CompilationException if the source cannot be read or its loops do not balance.
     */
    ProgramTree parse(String source, String programName) throws CompilationException;

    /**
     * Re-encodes a source in compact notation.
     *
     * @param source The source text, in either notation.
     * @param programName The name of the program, used in diagnostics.
     * @return The compact text.
     * @throws CompilationException if the source cannot be read.
     */
    String compileToCompact(String source, String programName) throws CompilationException;

    /**
     * Re-renders a source in natural notation.
     *
     * @param source The source text, in either notation.
     * @param programName The name of the program, used in diagnostics.
     * @return The natural text.
     * @throws CompilationException if the source cannot be read.
     */
    String decompileToNatural(String source, String programName) throws CompilationException;
}
