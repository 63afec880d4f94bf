package com.repo.profiler.filter;

import com.repo.profiler.core.CommitStamp;
import com.repo.profiler.core.RepositoryAnalysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Aggregates per-repository analyses into a single filtered profile.
 */
public class FilteredProfileBuilder {

    public FilteredProfile build(List<RepositoryAnalysis> analyses) {
        List<String> commitDates = new ArrayList<>();
        int totalCommits = 0;

        for (RepositoryAnalysis analysis : analyses) {
            for (CommitStamp commit : analysis.commits()) {
                totalCommits++;
                if (commit.date() != null && !commit.date().isEmpty()) {
                    commitDates.add(commit.date());
                }
            }
        }
        // ISO-8601 text sorts chronologically
        Collections.sort(commitDates);

        return new FilteredProfile(analyses, totalCommits, commitDates);
    }
}
