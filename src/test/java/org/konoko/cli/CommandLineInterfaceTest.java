package org.konoko.cli;

import com.typesafe.config.ConfigFactory;
import org.konoko.compiler.Compiler;
import org.konoko.runtime.io.IInputProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Drives the command line end to end against files in a temporary directory.
 */
@Tag("integration")
class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("konoko.cli.default-output");
        ConfigFactory.invalidateCaches();
    }

    private int execute(IInputProvider input, String... args) {
        CommandLine cmd = new CommandLine(new CommandLineInterface(new Compiler(), input));
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    private int execute(String... args) {
        return execute(() -> {
            throw new IllegalStateException("program should not read input");
        }, args);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    public void testCliInitialization() {
        CommandLineInterface cli = new CommandLineInterface();
        CommandLine cmd = new CommandLine(cli);
        assertEquals("konoko", cmd.getCommandName());
    }

    @Test
    void runsProgramAndWritesCharacters() throws IOException {
        Path program = write("echo.konoko", "兎の子鳩の子猫の子鳩の子");

        int exitCode = execute(() -> 72, program.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualTo("HI");
    }

    @Test
    void runsCompactProgram() throws IOException {
        Path program = write("echo.compact", "。ニニニニニニニニ。ニニニニニニニ");

        int exitCode = execute(() -> 0x732B, program.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualTo("猫");
    }

    @Test
    void compileWritesCompactNotation() throws IOException {
        Path program = write("inc.konoko", "猫の子獅子の子\n");
        Path target = tempDir.resolve("inc.compact");

        int exitCode = execute("--compile", "-o", target.toString(), program.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(target, StandardCharsets.UTF_8)).isEqualTo("。ニニニ。ニニニ");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void compileUsesConfiguredDefaultOutput() throws IOException {
        Path program = write("inc.konoko", "猫の子");
        Path target = tempDir.resolve("default.compact");
        System.setProperty("konoko.cli.default-output", target.toString());
        ConfigFactory.invalidateCaches();

        int exitCode = execute("-c", program.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(target, StandardCharsets.UTF_8)).isEqualTo("。ニニニ");
    }

    @Test
    void decompileWritesNaturalNotation() throws IOException {
        Path program = write("loop.compact", "。ニニニ。ニニニニニ。ニニニニ。ニニニニニニ");
        Path target = tempDir.resolve("loop.konoko");

        int exitCode = execute("-d", "-o", target.toString(), program.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(target, StandardCharsets.UTF_8)).isEqualTo("猫の子\n熊の子\n  狸の子\n虎の子\n");
    }

    @Test
    void verboseRunPrintsTreeOutputLogAndTape() throws IOException {
        Path program = write("count.konoko", "猫の子猫の子熊の子狸の子鳩の子虎の子");

        int exitCode = execute("-v", "-t", "3", program.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("ROOT\n  INCREMENT\n  INCREMENT\n  LOOP\n    DECREMENT\n    OUTPUT\n  END\n")
                .contains("output:  [1, 0]")
                .contains("pointer: 0")
                .contains("tape:    [0, 0, 0]");
    }

    @Test
    void verboseJsonReport() throws IOException {
        Path program = write("one.konoko", "犬の子猫の子");

        int exitCode = execute("-v", "--json", program.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("\"program\": \"one.konoko\"")
                .contains("\"dataPointer\": 1")
                .contains("\"steps\": 3");
    }

    @Test
    void configFileSetsTapeSize() throws IOException {
        Path config = write("small.conf", "konoko.machine.tape-size = 2");
        Path program = write("wrap.konoko", "犬の子犬の子猫の子");

        int exitCode = execute("-v", "--config", config.toString(), program.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("tape:    [1, 0]");
    }

    @Test
    void lexErrorExitsWithCompilationError() throws IOException {
        Path program = write("bad.konoko", "猫の子 ?");

        int exitCode = execute(program.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_COMPILATION_ERROR);
        assertThat(err.toString()).contains("bad.konoko:1:5").contains("Unknown symbol");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void unbalancedLoopExitsWithCompilationError() throws IOException {
        Path program = write("open.konoko", "熊の子猫の子");

        int exitCode = execute(program.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_COMPILATION_ERROR);
        assertThat(err.toString()).contains("Unclosed loop");
    }

    @Test
    void tapeFaultExitsWithRuntimeErrorAfterEarlierOutput() throws IOException {
        Path program = write("left.konoko", "猫の子鳩の子狐の子猫の子");

        int exitCode = execute(program.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_RUNTIME_ERROR);
        assertThat(out.toString()).isEqualTo("\u0001");
        assertThat(err.toString()).contains("Program fault").contains("-1");
    }

    @Test
    void verboseRunStillReportsStateWhenTheProgramFaults() throws IOException {
        Path program = write("left.konoko", "猫の子鳩の子狐の子猫の子");

        int exitCode = execute("-v", "-t", "2", program.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_RUNTIME_ERROR);
        assertThat(out.toString())
                .contains("output:  [1]")
                .contains("pointer: -1")
                .contains("tape:    [1, 0]");
        assertThat(err.toString()).contains("Program fault");
    }

    @Test
    void verboseJsonReportOnFault() throws IOException {
        Path program = write("left.konoko", "狐の子鳩の子");

        int exitCode = execute("-v", "--json", program.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_RUNTIME_ERROR);
        assertThat(out.toString()).contains("\"dataPointer\": -1");
    }

    @Test
    void cellsHoldValuesBeyondTheIntRange() throws IOException {
        Path program = write("big.konoko", "兎の子猫の子");

        int exitCode = execute(() -> Integer.MAX_VALUE, "-v", "-t", "1", program.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("tape:    [2147483648]");
    }

    @Test
    void cellOverflowExitsWithRuntimeError() throws IOException {
        Path program = write("overflow.konoko", "兎の子猫の子");

        int exitCode = execute(() -> Long.MAX_VALUE, program.toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_RUNTIME_ERROR);
        assertThat(err.toString()).contains("overflowed");
    }

    @Test
    void jsonWithoutVerboseIsAUsageError() throws IOException {
        Path program = write("inc.konoko", "猫の子");

        int exitCode = execute("--json", program.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("--json requires --verbose");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void missingSourceExitsWithIoError() {
        int exitCode = execute(tempDir.resolve("missing.konoko").toString());

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_IO_ERROR);
        assertThat(err.toString()).contains("I/O error");
    }

    @Test
    void compileAndDecompileCannotBeCombined() throws IOException {
        Path program = write("inc.konoko", "猫の子");

        int exitCode = execute("-c", "-d", program.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("cannot be combined");
    }

    @Test
    void nonPositiveTapeSizeIsAUsageError() throws IOException {
        Path program = write("inc.konoko", "猫の子");

        int exitCode = execute("-t", "0", program.toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("--tape-size must be positive");
    }
}
