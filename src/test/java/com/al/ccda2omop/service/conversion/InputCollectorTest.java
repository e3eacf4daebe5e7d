package com.al.ccda2omop.service.conversion;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InputCollectorTest {

    private final InputCollector collector = new InputCollector();

    @Test
    public void testCollect_DirectoryXmlFilesInNameOrder(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("b.xml"), "<x/>");
        Files.writeString(dir.resolve("a.XML"), "<x/>");
        Files.writeString(dir.resolve("notes.txt"), "skip");
        Files.createDirectory(dir.resolve("nested.xml"));

        List<Path> files = collector.collect(dir);

        assertEquals(List.of(dir.resolve("a.XML"), dir.resolve("b.xml")), files);
    }

    @Test
    public void testCollect_SingleFile(@TempDir Path dir) throws IOException {
        Path file = Files.writeString(dir.resolve("doc.txt"), "<x/>");

        assertEquals(List.of(file), collector.collect(file));
    }

    @Test
    public void testCollect_EmptyDirectory(@TempDir Path dir) throws IOException {
        assertTrue(collector.collect(dir).isEmpty());
    }

    @Test
    public void testCollect_MissingPath(@TempDir Path dir) {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> collector.collect(dir.resolve("missing")));

        assertTrue(e.getMessage().startsWith("Input path does not exist: "));
    }
}
