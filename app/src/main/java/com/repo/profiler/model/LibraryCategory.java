package com.repo.profiler.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Set;

/**
 * Purpose of a library, used to summarize what a developer builds with.
 * Categories are checked in declaration order; the first match wins.
 */
public enum LibraryCategory {
    AI_ML("ai_ml", Set.of("openai", "anthropic", "transformers", "pytorch", "tensorflow",
            "sklearn", "keras", "langchain")),
    DATA_PROCESSING("data_processing", Set.of("pandas", "numpy", "scipy", "polars", "dask")),
    WEB_FRAMEWORK("web_framework", Set.of("flask", "django", "fastapi", "express", "react", "vue", "angular")),
    DEVOPS("devops", Set.of("docker", "kubernetes", "terraform", "ansible")),
    TESTING("testing", Set.of("pytest", "unittest", "jest", "mocha", "cypress")),
    CLI_TOOL("cli_tool", Set.of("argparse", "click", "typer", "rich", "colorama", "prompt-toolkit")),
    ASYNC("async", Set.of("asyncio", "aiohttp", "celery", "threading")),
    ADVANCED_PYTHON("advanced_python", Set.of("collections", "itertools", "functools", "heapq", "deque",
            "counter", "lru_cache", "cache")),
    OTHER("other", Set.of());

    private final String label;
    private final Set<String> members;

    LibraryCategory(String label, Set<String> members) {
        this.label = label;
        this.members = members;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static LibraryCategory classify(String libraryName) {
        String lib = libraryName == null ? "" : libraryName.toLowerCase(Locale.ROOT);
        for (LibraryCategory category : values()) {
            if (category.members.contains(lib)) {
                return category;
            }
        }
        return OTHER;
    }
}
