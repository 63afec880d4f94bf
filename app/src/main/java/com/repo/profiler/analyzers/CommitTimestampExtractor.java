package com.repo.profiler.analyzers;

import com.repo.profiler.core.CommitStamp;
import com.repo.profiler.core.ProfilerConfig;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts ISO-8601 date-times as commit timestamps.
 * Values are read as UTC; impossible dates such as month 13 are skipped.
 */
public class CommitTimestampExtractor implements SignalDetector<List<CommitStamp>> {

    private static final Pattern DATE_TIME_PATTERN = Pattern.compile(
            "(\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2})");

    @Override
    public List<CommitStamp> detect(String content, ProfilerConfig config) {
        List<CommitStamp> commits = new ArrayList<>();
        Matcher matcher = DATE_TIME_PATTERN.matcher(content);
        int scanned = 0;

        // The cap counts raw matches, including the ones that fail to parse
        while (scanned < config.getMaxCommits() && matcher.find()) {
            scanned++;
            toStamp(matcher.group(1)).ifPresent(commits::add);
        }
        return commits;
    }

    private Optional<CommitStamp> toStamp(String date) {
        try {
            long epochSeconds = LocalDateTime.parse(date).toEpochSecond(ZoneOffset.UTC);
            return Optional.of(new CommitStamp(date, epochSeconds));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
