package com.repo.profiler.core;

/**
 * One repository section cut out of a dump.
 */
public record RepositoryRecord(
        /** Repository name from the section header */
        String name,

        /** Raw text of every file entry in the section */
        String content) {

    public RepositoryRecord {
        name = name == null ? "" : name;
        content = content == null ? "" : content;
    }
}
