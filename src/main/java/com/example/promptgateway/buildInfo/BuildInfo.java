package com.example.promptgateway.buildInfo;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Descriptive identifier of the running build, e.g. {@code 1a2b3c4 (modified) (main@owner/repo)}.
 */
@Getter
@AllArgsConstructor
public final class BuildInfo {
    public static final BuildInfo UNKNOWN = new BuildInfo("unknown", Source.FALLBACK);

    public enum Source {
        PLATFORM,
        GIT,
        FALLBACK
    }

    private final String value;
    private final Source source;

    @Override
    public String toString() {
        return value;
    }
}
