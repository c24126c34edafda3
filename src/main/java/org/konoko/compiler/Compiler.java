package org.konoko.compiler;

import org.konoko.compiler.api.CompilationException;
import org.konoko.compiler.api.ICompiler;
import org.konoko.compiler.backend.Encoder;
import org.konoko.compiler.frontend.Tokenizer;
import org.konoko.compiler.frontend.parser.ProgramTree;
import org.konoko.compiler.frontend.parser.TreeBuilder;
import org.konoko.compiler.isa.Instruction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The default compiler. Stateless; one instance can be shared.
 */
public class Compiler implements ICompiler {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);

    @Override
    public List<Instruction> tokenize(String source, String programName) throws CompilationException {
        return Tokenizer.instructions(Tokenizer.tokenize(source, programName));
    }

    @Override
    public ProgramTree parse(String source, String programName) throws CompilationException {
        List<Instruction> instructions = tokenize(source, programName);
        return TreeBuilder.build(instructions);
    }

    /**
     * {@inheritDoc}
     * <p>
     * Loop balance is not checked; an unbalanced program encodes just as it reads.
     */
    @Override
    public String compileToCompact(String source, String programName) throws CompilationException {
        List<Instruction> instructions = tokenize(source, programName);
        String compact = Encoder.toCompact(instructions);
        LOG.debug("Encoded {} instructions of {} into {} compact glyphs", instructions.size(), programName, compact.length());
        return compact;
    }

    @Override
    public String decompileToNatural(String source, String programName) throws CompilationException {
        return Encoder.toNatural(tokenize(source, programName));
    }
}
