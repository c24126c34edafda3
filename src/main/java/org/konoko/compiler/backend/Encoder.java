package org.konoko.compiler.backend;

import org.konoko.compiler.isa.Instruction;

import java.util.List;

/**
 * Renders an instruction sequence back into source text.
 */
public final class Encoder {

    private static final String INDENT = "  ";

    private Encoder() {}

    /**
     * Encodes instructions in compact notation: a marker followed by
     * {@link Instruction#runLength()} unit glyphs per instruction.
     *
     * @param instructions The instruction sequence.
     * @return The compact text; empty for an empty sequence.
     */
    public static String toCompact(List<Instruction> instructions) {
        StringBuilder sb = new StringBuilder();
        for (Instruction instruction : instructions) {
            sb.append(Instruction.COMPACT_MARKER);
            for (int i = 0; i < instruction.runLength(); i++) {
                sb.append(Instruction.COMPACT_UNIT);
            }
        }
        return sb.toString();
    }

    /**
     * Renders instructions in natural notation using the canonical symbols.
     * Loop bodies go on their own lines, indented by nesting depth.
     * Unbalanced loop markers are rendered as they come; the depth never drops below zero.
     *
     * @param instructions The instruction sequence.
     * @return The natural text, ending with a newline unless empty.
     */
    public static String toNatural(List<Instruction> instructions) {
        StringBuilder sb = new StringBuilder();
        StringBuilder line = new StringBuilder();
        int depth = 0;
        for (Instruction instruction : instructions) {
            if (instruction.isLoopMarker()) {
                flushLine(sb, line, depth);
                if (instruction == Instruction.LOOP_END) {
                    depth = Math.max(0, depth - 1);
                }
                sb.append(INDENT.repeat(depth)).append(instruction.naturalSymbol()).append('\n');
                if (instruction == Instruction.LOOP_START) {
                    depth++;
                }
            } else {
                line.append(instruction.naturalSymbol());
            }
        }
        flushLine(sb, line, depth);
        return sb.toString();
    }

    private static void flushLine(StringBuilder sb, StringBuilder line, int depth) {
        if (line.length() > 0) {
            sb.append(INDENT.repeat(depth)).append(line).append('\n');
            line.setLength(0);
        }
    }
}
