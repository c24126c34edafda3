package org.konoko.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.konoko.cli.config.ConfigLoader;
import org.konoko.cli.config.LoggingConfigurator;
import org.konoko.compiler.Compiler;
import org.konoko.compiler.api.CompilationException;
import org.konoko.compiler.api.ICompiler;
import org.konoko.compiler.frontend.parser.ProgramTree;
import org.konoko.runtime.MachineException;
import org.konoko.runtime.MachineOptions;
import org.konoko.runtime.VirtualMachine;
import org.konoko.runtime.io.IInputProvider;
import org.konoko.runtime.io.LineInputProvider;
import org.konoko.runtime.io.WriterOutputSink;
import org.konoko.runtime.model.MachineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "konoko",
    mixinStandardHelpOptions = true,
    version = "Konoko 1.0",
    description = "Runs a Konoko program, or converts it between natural and compact notation."
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CommandLineInterface.class);

    /** A source could not be read as a program. */
    public static final int EXIT_COMPILATION_ERROR = 1;
    /** The program faulted while running. */
    public static final int EXIT_RUNTIME_ERROR = 3;
    /** A file or the configuration could not be read or written. */
    public static final int EXIT_IO_ERROR = 4;

    private static final String DEFAULT_OUTPUT_KEY = "konoko.cli.default-output";

    @Parameters(index = "0", paramLabel = "SOURCE", description = "The program file, in natural or compact notation.")
    private Path source;

    @Option(names = {"-c", "--compile"}, description = "Write the program in compact notation to the output path instead of running it.")
    private boolean compile;

    @Option(names = {"-d", "--decompile"}, description = "Write the program in natural notation to the output path instead of running it.")
    private boolean decompile;

    @Option(names = {"-o", "--output"}, paramLabel = "PATH", description = "Output path for --compile/--decompile (default: konoko.cli.default-output, out.konoko).")
    private Path output;

    @Option(names = {"-t", "--tape-size"}, paramLabel = "CELLS", description = "Number of tape cells (default: konoko.machine.tape-size, 16).")
    private Integer tapeSize;

    @Option(names = {"-v", "--verbose"}, description = "Print the output log and the final tape after the run.")
    private boolean verbose;

    @Option(names = "--json", description = "Print the verbose report as JSON (requires --verbose).")
    private boolean json;

    @Option(names = "--config", paramLabel = "FILE", description = "Configuration file (default: ./konoko.conf if present).")
    private File configFile;

    @Spec
    private CommandSpec spec;

    private final ICompiler compiler;
    private final IInputProvider input;

    public CommandLineInterface() {
        this(new Compiler(), null);
    }

    /**
     * @param compiler The compiler to use.
     * @param input The input provider for running programs, or {@code null} for standard input.
     */
    CommandLineInterface(ICompiler compiler, IInputProvider input) {
        this.compiler = compiler;
        this.input = input;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("konoko");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        if (compile && decompile) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--compile and --decompile cannot be combined");
        }
        if (json && !verbose) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--json requires --verbose");
        }

        final Config config;
        final MachineOptions configuredOptions;
        try {
            config = ConfigLoader.load(configFile);
            configuredOptions = MachineOptions.fromConfig(config);
        } catch (ConfigException | IllegalArgumentException e) {
            return fail(EXIT_IO_ERROR, "Invalid configuration: " + e.getMessage(), e);
        }
        LoggingConfigurator.configure(config);
        if (verbose) {
            LoggingConfigurator.enableVerbose();
        }

        final String programName = source.getFileName().toString();
        try {
            final String text = Files.readString(source, StandardCharsets.UTF_8);
            if (compile || decompile) {
                return convert(config, text, programName);
            }
            return run(configuredOptions, text, programName);
        } catch (CompilationException e) {
            return fail(EXIT_COMPILATION_ERROR, e.getMessage(), e);
        } catch (MachineException e) {
            return fail(EXIT_RUNTIME_ERROR, "Program fault: " + e.getMessage(), e);
        } catch (IOException e) {
            return fail(EXIT_IO_ERROR, "I/O error: " + e.getMessage(), e);
        }
    }

    private int convert(Config config, String text, String programName) throws CompilationException, IOException {
        final String converted = compile
                ? compiler.compileToCompact(text, programName)
                : compiler.decompileToNatural(text, programName);
        final Path target = output != null ? output : Path.of(config.getString(DEFAULT_OUTPUT_KEY));
        Files.writeString(target, converted, StandardCharsets.UTF_8);
        LOGGER.info("Wrote {} notation of {} to {}", compile ? "compact" : "natural", programName, target);
        return 0;
    }

    private int run(MachineOptions configuredOptions, String text, String programName) throws CompilationException, IOException {
        MachineOptions options = configuredOptions;
        if (tapeSize != null) {
            if (tapeSize <= 0) {
                throw new CommandLine.ParameterException(spec.commandLine(), "--tape-size must be positive, was " + tapeSize);
            }
            options = options.withTapeSize(tapeSize);
        }

        final ProgramTree tree = compiler.parse(text, programName);
        final PrintWriter out = spec.commandLine().getOut();
        final VirtualMachine vm = new VirtualMachine(tree, options,
                input != null ? input : LineInputProvider.fromStdin(), new WriterOutputSink(out));
        final MachineState state;
        try {
            state = vm.run();
        } catch (MachineException e) {
            if (verbose) {
                printReport(out, programName, tree, vm.getState());
            }
            throw e;
        }

        if (verbose) {
            printReport(out, programName, tree, state);
        }
        return 0;
    }

    private void printReport(PrintWriter out, String programName, ProgramTree tree, MachineState state) {
        final RunReport report = RunReport.of(programName, tree, state);
        out.println();
        if (json) {
            out.println(report.toJson());
        } else {
            out.print(tree.dump());
            out.println(report.toText());
        }
        out.flush();
    }

    private int fail(int exitCode, String message, Exception e) {
        LOGGER.debug("Command failed", e);
        spec.commandLine().getErr().println(message);
        return exitCode;
    }
}
