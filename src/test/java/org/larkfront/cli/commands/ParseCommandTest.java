package org.larkfront.cli.commands;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.larkfront.cli.CommandLineInterface;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class ParseCommandTest {

    private static final String SOURCE = "load(\"@rules_cc//cc:defs.bzl\", foo = \"cc_library\")";

    @TempDir
    Path tempDir;

    private CommandLine cmd;
    private StringWriter out;
    private StringWriter err;
    private Path file;

    @BeforeEach
    void setUp() throws IOException {
        cmd = new CommandLine(new CommandLineInterface());
        out = new StringWriter();
        err = new StringWriter();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        file = tempDir.resolve("BUILD");
        Files.writeString(file, SOURCE);
    }

    @Test
    void printsProgramAsText() {
        int exitCode = cmd.execute("parse", file.toString());

        assertEquals(0, exitCode, err.toString());
        String expected = String.join(System.lineSeparator(),
                "Input:",
                SOURCE,
                "",
                "Program:",
                SOURCE,
                "");
        assertEquals(expected, out.toString());
    }

    @Test
    void printsProgramAsJson() {
        int exitCode = cmd.execute("parse", "--format", "JSON", file.toString());

        assertEquals(0, exitCode, err.toString());
        String output = out.toString();
        String json = output.substring(output.indexOf("Program:") + "Program:".length()).trim();
        JsonObject load = JsonParser.parseString(json).getAsJsonObject()
                .getAsJsonArray("statements").get(0).getAsJsonObject();
        assertEquals("@rules_cc//cc:defs.bzl", load.get("module").getAsString());
        assertEquals("foo", load.getAsJsonArray("symbols").get(0).getAsJsonObject().get("local").getAsString());
    }

    @Test
    void syntaxErrorIsReportedOnStderr() throws IOException {
        Files.writeString(file, "load(\"m\")");

        int exitCode = cmd.execute("parse", file.toString());

        assertEquals(1, exitCode);
        assertTrue(err.toString().contains("EMPTY_SYMBOL_LIST"), err.toString());
        assertTrue(err.toString().contains(file.toString() + "@8"), err.toString());
        assertFalse(out.toString().contains("Program:"));
    }

    @Test
    void unknownFormatIsRejected() {
        int exitCode = cmd.execute("parse", "--format", "XML", file.toString());

        assertEquals(2, exitCode);
        assertEquals("", out.toString());
    }
}
