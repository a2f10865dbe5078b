package com.dendrol;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class DendrolCliTest {
    private static final String PATTERN = "[ipv4-addr:value = '1.2.3.4']";

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    public void setUp() {
        out = new StringWriter();
        err = new StringWriter();
    }

    @Test
    public void testParse() {
        assertEquals(0, run("parse", PATTERN));
        assertEquals(Dendrol.encode(Dendrol.parsePattern(PATTERN)), out.toString());
    }

    @Test
    public void testParseFromFile() throws IOException {
        Path file = tempDir.resolve("pattern.txt");
        Files.writeString(file, PATTERN + "\n", StandardCharsets.UTF_8);

        assertEquals(0, run("parse", "-f", file.toString()));
        assertEquals(Dendrol.encode(Dendrol.parsePattern(PATTERN)), out.toString());
    }

    @Test
    public void testParseErrorExitsWithOne() {
        assertEquals(1, run("parse", "[ipv4-addr:value = ]"));
        assertTrue(err.toString().startsWith("Error: 1:19: "), err.toString());
        assertEquals("", out.toString());
    }

    @Test
    public void testDecodeNormalizes() throws IOException {
        Path file = tempDir.resolve("tree.yaml");
        Files.writeString(file, """
            pattern:
              observation:
                expressions:
                  - comparison:
                      value: 1.2.3.4
                      operator: '='
                      path: value
                      object: ipv4-addr
            """, StandardCharsets.UTF_8);

        assertEquals(0, run("decode", file.toString()));
        assertEquals(Dendrol.encode(Dendrol.parsePattern(PATTERN)), out.toString());
    }

    @Test
    public void testDecodeErrorReportsLine() throws IOException {
        Path file = tempDir.resolve("bad.yaml");
        Files.writeString(file, "pattern:\n  comparison:\n", StandardCharsets.UTF_8);

        assertEquals(1, run("decode", file.toString()));
        assertTrue(err.toString().startsWith("Error: line 2: "), err.toString());
    }

    @Test
    public void testIndicator() throws IOException {
        Path file = tempDir.resolve("indicator.json");
        Files.writeString(file, """
            {"type": "indicator", "id": "indicator--1", "pattern": "[ipv4-addr:value = '1.2.3.4']"}
            """, StandardCharsets.UTF_8);

        assertEquals(0, run("indicator", file.toString()));
        assertEquals("# indicator--1\n" + Dendrol.encode(Dendrol.parsePattern(PATTERN)),
            out.toString().replace(System.lineSeparator(), "\n"));
    }

    @Test
    public void testMissingFileExitsWithOne() {
        assertEquals(1, run("decode", tempDir.resolve("missing.yaml").toString()));
        assertTrue(err.toString().startsWith("Error: "));
    }

    @Test
    public void testMaxDepth() {
        String nested = "[a:b = 1 AND (a:c = 2 OR a:d = 3)]";
        assertEquals(1, run("--max-depth", "2", "parse", nested));
        assertTrue(err.toString().contains("maximum depth of 2"), err.toString());

        setUp();
        assertEquals(0, run("--max-depth", "3", "parse", nested));
    }

    @Test
    public void testUsageErrorsExitWithTwo() {
        assertEquals(2, run());
        assertEquals(2, run("parse"));
        assertEquals(2, run("parse", PATTERN, "-f", "pattern.txt"));
        assertEquals(2, run("--max-depth", "0", "parse", PATTERN));
        assertEquals(2, run("frobnicate"));
    }

    private int run(String... args) {
        CommandLine commandLine = new CommandLine(new DendrolCli());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }
}
