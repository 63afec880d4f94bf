package com.repo.profiler.analyzers;

import com.repo.profiler.core.ProfilerConfig;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts one kind of signal from the raw text of a repository.
 * Implementations are stateless and never throw on malformed content.
 *
 * @param <T> the signal type
 */
public interface SignalDetector<T> {

    /**
     * Detect the signal in repository content.
     *
     * @param content raw repository text
     * @param config  profiler configuration (caps)
     * @return the detected signal, never null
     */
    T detect(String content, ProfilerConfig config);

    /**
     * Count non-overlapping matches of a pattern.
     */
    static int countMatches(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
