package com.repo.profiler.filter;

import com.repo.profiler.core.RepositoryAnalysis;

import java.util.List;

/**
 * Per-repository analyses plus the merged commit history of one developer,
 * before any normalization.
 */
public record FilteredProfile(
        /** Analyses in dump order */
        List<RepositoryAnalysis> repositories,

        /** Number of commits across all repositories */
        int totalCommits,

        /** Every commit date, sorted ascending */
        List<String> commitDates) {

    public FilteredProfile {
        repositories = repositories == null ? List.of() : List.copyOf(repositories);
        commitDates = commitDates == null ? List.of() : List.copyOf(commitDates);
    }

    public static FilteredProfile empty() {
        return new FilteredProfile(List.of(), 0, List.of());
    }
}
