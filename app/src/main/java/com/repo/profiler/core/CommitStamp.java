package com.repo.profiler.core;

/**
 * A commit timestamp found in repository content.
 */
public record CommitStamp(
        /** Date-time text exactly as it appeared, e.g. 2024-03-01T12:00:00 */
        String date,

        /** Unix epoch seconds */
        long timestamp) {
}
