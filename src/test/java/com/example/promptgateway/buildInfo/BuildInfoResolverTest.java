package com.example.promptgateway.buildInfo;

import com.example.promptgateway.config.BuildInfoConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BuildInfoResolverTest {
    private MockEnvironment environment;
    private BuildInfoConfig config;
    private Map<List<String>, String> outputs;
    private List<List<String>> executed;
    private BuildInfoResolver resolver;

    @BeforeEach
    void setUp() {
        environment = new MockEnvironment();
        config = new BuildInfoConfig();
        outputs = new ConcurrentHashMap<>();
        executed = new CopyOnWriteArrayList<>();
        CommandRunner runner = (command, timeout) -> {
            executed.add(command);
            String out = outputs.get(command);
            if (out == null) {
                throw new CommandFailedException(command, "exit code 128", "", "fatal: not a git repository");
            }
            return out;
        };
        resolver = new BuildInfoResolver(environment, runner, config);
    }

    private void cleanRepository() {
        outputs.put(BuildInfoResolver.GIT_SHA, "abc1234\n");
        outputs.put(BuildInfoResolver.GIT_BRANCH, "main\n");
        outputs.put(BuildInfoResolver.GIT_REMOTE, "https://github.com/owner/proj.git\n");
        outputs.put(BuildInfoResolver.GIT_STATUS, "");
    }

    @Test
    void platformSignalWinsWithoutRunningGit() {
        environment.setProperty("RENDER", "true");
        environment.setProperty("RENDER_GIT_COMMIT", "abcdef1234567890");
        environment.setProperty("RENDER_GIT_BRANCH", "main");
        environment.setProperty("RENDER_GIT_REPO_SLUG", "owner/proj");

        BuildInfo info = resolver.resolve();

        assertThat(info.getValue()).isEqualTo("abcdef1 (main@owner/proj)");
        assertThat(info.getSource()).isEqualTo(BuildInfo.Source.PLATFORM);
        assertThat(executed).isEmpty();
    }

    @Test
    void platformSignalWithMissingVariablesUsesPlaceholders() {
        environment.setProperty("RENDER", "true");

        assertThat(resolver.resolve().getValue()).isEqualTo("unknown SHA (unknown branch@unknown repo)");
    }

    @Test
    void platformSignalWithEmptyVariablesUsesPlaceholders() {
        environment.setProperty("RENDER", "true");
        environment.setProperty("RENDER_GIT_COMMIT", "");
        environment.setProperty("RENDER_GIT_BRANCH", "");
        environment.setProperty("RENDER_GIT_REPO_SLUG", "");

        assertThat(resolver.resolve().getValue()).isEqualTo("unknown SHA (unknown branch@unknown repo)");
    }

    @Test
    void cleanWorkingTree() {
        cleanRepository();

        BuildInfo info = resolver.resolve();

        assertThat(info.getValue()).isEqualTo("abc1234 (main@owner/proj)");
        assertThat(info.getSource()).isEqualTo(BuildInfo.Source.GIT);
    }

    @Test
    void modifiedWorkingTreeIsMarked() {
        cleanRepository();
        outputs.put(BuildInfoResolver.GIT_STATUS, " M src/main/java/Foo.java\n?? notes.txt\n");

        assertThat(resolver.resolve().getValue()).isEqualTo("abc1234 (modified) (main@owner/proj)");
    }

    @Test
    void deploymentDescriptorChangeIsNotAModification() {
        cleanRepository();
        outputs.put(BuildInfoResolver.GIT_STATUS, " M Dockerfile\n\n");

        assertThat(resolver.resolve().getValue()).isEqualTo("abc1234 (main@owner/proj)");
    }

    @Test
    void anyProbeFailureGivesUnknown() {
        cleanRepository();
        outputs.remove(BuildInfoResolver.GIT_STATUS);

        BuildInfo info = resolver.resolve();

        assertThat(info.getValue()).isEqualTo("unknown");
        assertThat(info.getSource()).isEqualTo(BuildInfo.Source.FALLBACK);
    }

    @Test
    void runtimeFailureGivesUnknown() {
        BuildInfoResolver failing = new BuildInfoResolver(environment, (command, timeout) -> {
            throw new IllegalStateException("git not installed");
        }, config);

        assertThat(failing.resolve()).isSameAs(BuildInfo.UNKNOWN);
    }

    @Test
    void registersSafeDirectoryBeforeProbingOnSpaces() {
        environment.setProperty("SPACE_ID", "someone/space");
        cleanRepository();
        List<String> trust = List.of("git", "config", "--global", "--add", "safe.directory", "/app");
        outputs.put(trust, "");

        assertThat(resolver.resolve().getValue()).isEqualTo("abc1234 (main@owner/proj)");
        assertThat(executed.get(0)).isEqualTo(trust);
        assertThat(executed).hasSize(5);
    }

    @Test
    void noTrustRegistrationOutsideSpaces() {
        cleanRepository();

        resolver.resolve();

        assertThat(executed).hasSize(4).noneMatch(command -> command.contains("safe.directory"));
    }

    @Test
    void parsesRemoteUrls() {
        assertThat(BuildInfoResolver.repoSlug("git@github.com:owner/my-repo.git")).isEqualTo("owner/my-repo");
        assertThat(BuildInfoResolver.repoSlug("https://gitgud.io/khanon/oai-reverse-proxy.git"))
                .isEqualTo("khanon/oai-reverse-proxy");
        assertThat(BuildInfoResolver.repoSlug("https://gitlab.com/a/b")).isEqualTo("a/b");
        assertThat(BuildInfoResolver.repoSlug("not a remote")).isEmpty();
    }

    @Test
    void relevantChangesIgnoresBlankAndDescriptorLines() {
        assertThat(resolver.relevantChanges(" M Dockerfile\n\n M README.md\n   \n")).containsExactly(" M README.md");
    }

    @Test
    void holderAcceptsOnePublication() {
        BuildInfoHolder holder = new BuildInfoHolder();
        assertThat(holder.get()).isSameAs(BuildInfo.UNKNOWN);
        assertThat(holder.isPublished()).isFalse();

        holder.publish(new BuildInfo("abc1234 (main@owner/proj)", BuildInfo.Source.GIT));

        assertThat(holder.get().getValue()).isEqualTo("abc1234 (main@owner/proj)");
        assertThatThrownBy(() -> holder.publish(BuildInfo.UNKNOWN)).isInstanceOf(IllegalStateException.class);
        assertThat(holder.get().getValue()).isEqualTo("abc1234 (main@owner/proj)");
    }
}
