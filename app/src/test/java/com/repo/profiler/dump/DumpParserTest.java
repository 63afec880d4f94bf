package com.repo.profiler.dump;

import com.repo.profiler.core.RepositoryRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DumpParserTest {

    private static final String BANNER = DumpParser.BANNER;

    private final DumpParser parser = new DumpParser();

    static String repository(String name, String body) {
        return BANNER + "\n" + DumpParser.REPOSITORY_MARKER + " " + name + "\n" + BANNER + "\n" + body;
    }

    static String file(String path, String content) {
        return BANNER + "\n" + DumpParser.FILE_MARKER + " " + path + "\n" + BANNER + "\n" + content + "\n";
    }

    @Test
    void testParsesRepositoriesInOrder() {
        String dump = "GitHub Repositories Dump\nUser: octo\n" + BANNER + "\n\n"
                + repository("first", file("a.py", "print('a')"))
                + repository("second", file("b.js", "console.log('b')"));

        List<RepositoryRecord> records = parser.parse(dump);

        assertEquals(2, records.size());
        assertEquals("first", records.get(0).name());
        assertEquals("second", records.get(1).name());
        assertTrue(records.get(0).content().contains("a.py"));
        assertFalse(records.get(0).content().contains("b.js"), "Content stops at the next repository");
        assertTrue(records.get(1).content().contains("console.log"));
    }

    @Test
    void testHeaderIsDiscarded() {
        List<RepositoryRecord> records = parser.parse("User: octo\nREPOSITORY: not-a-section\n"
                + repository("real", "body"));

        assertEquals(1, records.size());
        assertEquals("real", records.get(0).name());
    }

    @Test
    void testNameIsTrimmed() {
        List<RepositoryRecord> records = parser.parse(repository("  spaced-name  ", "x"));
        assertEquals("spaced-name", records.get(0).name());
    }

    @Test
    void testEmptyAndUnmarkedInput() {
        assertTrue(parser.parse("").isEmpty());
        assertTrue(parser.parse((String) null).isEmpty());
        assertTrue(parser.parse("just some text without any sections").isEmpty());
    }

    @Test
    void testWindowsLineEndings() {
        String dump = repository("crlf", "line one\nline two").replace("\n", "\r\n");

        List<RepositoryRecord> records = parser.parse(dump);

        assertEquals(1, records.size());
        assertEquals("crlf", records.get(0).name());
        // Content keeps the newline that follows the closing banner
        assertEquals("\nline one\nline two", records.get(0).content());
    }

    @Test
    void testShortBannerIsNotABoundary() {
        String shortBanner = "=".repeat(79);
        String dump = repository("only", shortBanner + "\nREPOSITORY: fake\n" + shortBanner + "\n");

        List<RepositoryRecord> records = parser.parse(dump);

        assertEquals(1, records.size());
        assertTrue(records.get(0).content().contains("REPOSITORY: fake"));
    }

    @Test
    void testParseFile(@TempDir Path tempDir) throws IOException {
        Path dumpFile = tempDir.resolve("dump.txt");
        Files.writeString(dumpFile, repository("from-file", file("x.sh", "echo hi")));

        List<RepositoryRecord> records = parser.parse(dumpFile);

        assertEquals("from-file", records.get(0).name());
    }
}
