package astgen.asts;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;

import static org.junit.jupiter.api.Assertions.*;

public class FileGeneratorTest {

    @TempDir
    Path tempDir;

    @Test
    public void testCreatesMissingDirectories() throws Exception {
        FileGenerator fileGenerator = new FileGenerator();
        Path file = tempDir.resolve("jlox/lox/Expression.java");

        fileGenerator.createFile(file, new StringBuilder("interface Expression {}\n"));

        assertEquals("interface Expression {}\n", Files.readString(file, StandardCharsets.UTF_8));
        assertEquals(1, fileGenerator.getWrittenFiles().size());
    }

    @Test
    public void testWriteFailure() throws Exception {
        Path blocker = Files.writeString(tempDir.resolve("golox"), "not a directory");
        FileGenerator fileGenerator = new FileGenerator();

        var e = assertThrows(SinkWriteException.class,
                () -> fileGenerator.createFile(blocker.resolve("expression.go"), "package main\n"));
        assertTrue(e.getMessage().contains("expression.go"));
        assertTrue(fileGenerator.getWrittenFiles().isEmpty());
        assertEquals("not a directory", Files.readString(blocker));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    public void testNewFileIsReadableByEveryone() throws Exception {
        Path file = tempDir.resolve("golox/expression.go");

        new FileGenerator().createFile(file, "package main\n");

        assertEquals("rw-r--r--", PosixFilePermissions.toString(Files.getPosixFilePermissions(file)));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    public void testOverwriteKeepsMode() throws Exception {
        Path file = Files.writeString(tempDir.resolve("statement.go"), "hand edited");
        Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-rw-r--"));

        new FileGenerator().createFile(file, "package main\n");

        assertEquals("package main\n", Files.readString(file));
        assertEquals("rw-rw-r--", PosixFilePermissions.toString(Files.getPosixFilePermissions(file)));
    }
}
