package astgen;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class GenerateCommandTest {

    @TempDir
    Path tempDir;

    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        var cmd = Main.commandLine();
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @Test
    public void testGeneratesAllLanguages() {
        assertEquals(0, run("generate", "--no-format", "-o", tempDir.toString()));

        assertTrue(Files.isRegularFile(tempDir.resolve("golox/expression.go")));
        assertTrue(Files.isRegularFile(tempDir.resolve("golox/statement.go")));
        assertTrue(Files.isRegularFile(tempDir.resolve("jlox/lox/Expression.java")));
        assertTrue(Files.isRegularFile(tempDir.resolve("jlox/lox/Statement.java")));
    }

    @Test
    public void testSelectedLanguage() throws Exception {
        assertEquals(0, run("generate", "--no-format", "--languages", "java", "--java-package", "org.lox",
                "-o", tempDir.toString()));

        assertFalse(Files.exists(tempDir.resolve("golox")));
        String source = Files.readString(tempDir.resolve("jlox/org/lox/Statement.java"));
        assertTrue(source.contains("package org.lox;"));
        // the command line always enables generic dispatch for Java
        assertTrue(source.contains("<R> R accept(Visitor<R> visitor);"));
    }

    @Test
    public void testParallelJobs() throws Exception {
        assertEquals(0, run("generate", "--no-format", "-j", "4", "-l", "go,java", "--go-package", "ast",
                "-o", tempDir.toString()));

        assertTrue(Files.readString(tempDir.resolve("golox/statement.go")).contains("package ast\n"));
        assertTrue(Files.isRegularFile(tempDir.resolve("jlox/lox/Expression.java")));
    }

    @Test
    public void testUnknownLanguage() {
        assertEquals(2, run("generate", "--languages", "cobol", "-o", tempDir.toString()));
        assertTrue(err.toString().contains("Unknown language 'cobol'"));
    }

    @Test
    public void testInvalidJobs() {
        assertEquals(2, run("generate", "--jobs", "0", "-o", tempDir.toString()));
    }

    @Test
    public void testMissingSubcommand() {
        assertEquals(2, run());
    }

    @Test
    public void testWriteFailureExitCode() throws Exception {
        Files.writeString(tempDir.resolve("golox"), "not a directory");
        assertEquals(1, run("generate", "--no-format", "-o", tempDir.toString()));
        // the other backend is unaffected
        assertTrue(Files.isRegularFile(tempDir.resolve("jlox/lox/Expression.java")));
    }
}
