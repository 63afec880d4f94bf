package com.repo.profiler.dump;

import com.repo.profiler.core.RepositoryRecord;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a repository dump into one record per repository section.
 *
 * A section starts with a banner of 80 '=' characters, a {@code REPOSITORY: name}
 * line and a second banner. Everything before the first banner is header text
 * and is discarded. Parsing is best-effort and never fails.
 */
public class DumpParser {

    public static final String BANNER = "=".repeat(80);
    public static final String REPOSITORY_MARKER = "REPOSITORY:";
    /** Labels a file banner; file sections stay inside the repository content */
    public static final String FILE_MARKER = "FILE:";

    private static final Pattern REPOSITORY_BOUNDARY = Pattern.compile(
            "={80}\\n" + REPOSITORY_MARKER + "\\s*(.+?)\\n={80}");

    /**
     * Parse dump text into repository records, in order of appearance.
     */
    public List<RepositoryRecord> parse(String dump) {
        if (dump == null || dump.isEmpty()) {
            return List.of();
        }
        String text = dump.replace("\r\n", "\n");

        // Alternating segments: header, name, content, name, content, ...
        List<String> segments = new ArrayList<>();
        Matcher matcher = REPOSITORY_BOUNDARY.matcher(text);
        int last = 0;
        while (matcher.find()) {
            segments.add(text.substring(last, matcher.start()));
            segments.add(matcher.group(1));
            last = matcher.end();
        }
        segments.add(text.substring(last));

        List<RepositoryRecord> records = new ArrayList<>();
        for (int i = 1; i + 1 < segments.size(); i += 2) {
            records.add(new RepositoryRecord(segments.get(i).strip(), segments.get(i + 1)));
        }
        return Collections.unmodifiableList(records);
    }

    /**
     * Read a dump file and parse it. Undecodable bytes are replaced rather than
     * rejected.
     */
    public List<RepositoryRecord> parse(Path dumpFile) throws IOException {
        byte[] bytes = Files.readAllBytes(dumpFile);
        return parse(new String(bytes, StandardCharsets.UTF_8));
    }
}
