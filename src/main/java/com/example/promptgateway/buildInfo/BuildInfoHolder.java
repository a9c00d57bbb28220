package com.example.promptgateway.buildInfo;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide handle to the build identifier. Published once during startup.
 */
@Component
public class BuildInfoHolder {
    private final AtomicReference<BuildInfo> buildInfo = new AtomicReference<>();

    public void publish(BuildInfo info) {
        if (!buildInfo.compareAndSet(null, info)) {
            throw new IllegalStateException("Build info has already been published: " + buildInfo.get());
        }
    }

    public boolean isPublished() {
        return buildInfo.get() != null;
    }

    /**
     * @return the published identifier, or {@link BuildInfo#UNKNOWN} while startup has not reached it yet
     */
    public BuildInfo get() {
        BuildInfo info = buildInfo.get();
        return info == null ? BuildInfo.UNKNOWN : info;
    }
}
