package org.czar.cli.commands;

import org.czar.cli.CommandLineInterface;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the check command summary lines and exit status.
 */
@Tag("unit")
public class CheckCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void testReportsOkWithWarningCount() throws IOException {
        // Arrange
        Path input = tempDir.resolve("warn.cz");
        Files.writeString(input, "i32 v = cast<i32>(x);\n");
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));

        // Act
        int exitCode = cmdLine.execute("check", input.toString());

        // Assert
        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains("warn.cz: OK (1 warning(s))");
        assertThat(err.toString()).contains("[CZAR] WARNING at warn.cz:1:");
        assertThat(Files.exists(tempDir.resolve("warn.c"))).isFalse();
    }

    @Test
    void testReportsFailureWithErrorCount() throws IOException {
        Path input = tempDir.resolve("bad.cz");
        Files.writeString(input, "void f(mut i32 x) {\n    const i32 y = 0;\n}\n");
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter out = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(new StringWriter()));

        int exitCode = cmdLine.execute("check", input.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).contains("bad.cz: FAILED (2 error(s))");
    }

    @Test
    void testHelpOutput() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter out = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(new StringWriter()));

        cmdLine.execute("check", "--help");

        assertThat(out.toString()).contains("check").contains("FILE");
    }
}
