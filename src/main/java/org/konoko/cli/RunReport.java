package org.konoko.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.konoko.compiler.frontend.parser.ProgramTree;
import org.konoko.runtime.model.MachineState;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

/**
 * The diagnostic summary printed after a verbose run.
 *
 * @param program The source file name.
 * @param nodes Number of tree nodes, including root and end.
 * @param loops Number of loop nodes.
 * @param depth Deepest nesting level.
 * @param steps Executed steps.
 * @param dataPointer Final data pointer.
 * @param tape Final tape contents.
 * @param output Every value written by output instructions.
 */
public record RunReport(
        String program,
        int nodes,
        int loops,
        int depth,
        long steps,
        int dataPointer,
        List<Long> tape,
        List<Long> output
) {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    public RunReport {
        tape = List.copyOf(tape);
        output = List.copyOf(output);
    }

    /**
     * Captures the report for a run, finished or faulted.
     *
     * @param program The source file name.
     * @param tree The program that ran.
     * @param state The final machine state.
     * @return The report.
     */
    public static RunReport of(String program, ProgramTree tree, MachineState state) {
        return new RunReport(program, tree.nodeCount(), tree.loopCount(), tree.maxDepth(),
                state.getSteps(), state.getDataPointer(),
                LongStream.of(state.getTape()).boxed().collect(Collectors.toList()), state.getOutputLog());
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    /**
     * @return A human-readable rendering, one fact per line.
     */
    public String toText() {
        return String.join("\n",
                "program: " + program,
                String.format("tree:    %d nodes, %d loops, depth %d", nodes, loops, depth),
                "steps:   " + steps,
                "output:  " + output.stream().map(String::valueOf).collect(Collectors.joining(", ", "[", "]")),
                "pointer: " + dataPointer,
                "tape:    " + tape);
    }
}
