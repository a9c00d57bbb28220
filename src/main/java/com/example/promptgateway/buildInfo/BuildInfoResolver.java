package com.example.promptgateway.buildInfo;

import com.example.promptgateway.config.BuildInfoConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Works out which revision is running. Never throws: any probing failure degrades to {@link BuildInfo#UNKNOWN}.
 *
 * <p>Render strips the .git directory from its images but exposes the commit in the environment, so that signal
 * wins when present. Otherwise the local repository is probed with git.
 */
@Component
public class BuildInfoResolver {
    private static final Logger logger = LoggerFactory.getLogger(BuildInfoResolver.class);

    static final String RENDER = "RENDER";
    static final String RENDER_GIT_COMMIT = "RENDER_GIT_COMMIT";
    static final String RENDER_GIT_BRANCH = "RENDER_GIT_BRANCH";
    static final String RENDER_GIT_REPO_SLUG = "RENDER_GIT_REPO_SLUG";
    // Huggingface Spaces 的目录权限会让 git 报 dubious ownership
    static final String SPACE_ID = "SPACE_ID";

    static final List<String> GIT_SHA = List.of("git", "rev-parse", "--short", "HEAD");
    static final List<String> GIT_BRANCH = List.of("git", "rev-parse", "--abbrev-ref", "HEAD");
    static final List<String> GIT_REMOTE = List.of("git", "config", "--get", "remote.origin.url");
    static final List<String> GIT_STATUS = List.of("git", "status", "--porcelain");

    private static final Pattern REMOTE_PATTERN = Pattern.compile(".*[/:]([\\w-]+)/([\\w\\-.]+?)(?:\\.git)?$");

    private final Environment environment;
    private final CommandRunner commandRunner;
    private final BuildInfoConfig buildInfoConfig;

    @Autowired
    public BuildInfoResolver(Environment environment, CommandRunner commandRunner, BuildInfoConfig buildInfoConfig) {
        this.environment = environment;
        this.commandRunner = commandRunner;
        this.buildInfoConfig = buildInfoConfig;
    }

    public BuildInfo resolve() {
        if (environment.containsProperty(RENDER)) {
            return fromRenderEnvironment();
        }
        try {
            return fromGit();
        } catch (CommandFailedException e) {
            logger.error("获取 commit SHA 失败 command={} stdout={} stderr={}",
                    e.getCommand(), e.getStdout(), e.getStderr(), e);
        } catch (RuntimeException e) {
            logger.error("获取 commit SHA 失败", e);
        }
        return BuildInfo.UNKNOWN;
    }

    private BuildInfo fromRenderEnvironment() {
        String commit = environment.getProperty(RENDER_GIT_COMMIT, "");
        String sha = commit.isEmpty() ? "unknown SHA" : commit.substring(0, Math.min(7, commit.length()));
        String branch = propertyOrDefault(RENDER_GIT_BRANCH, "unknown branch");
        String repo = propertyOrDefault(RENDER_GIT_REPO_SLUG, "unknown repo");
        BuildInfo info = new BuildInfo(sha + " (" + branch + "@" + repo + ")", BuildInfo.Source.PLATFORM);
        logger.info("从 Render 环境变量获取构建信息 build={}", info);
        return info;
    }

    // 变量存在但为空时同样使用默认值
    private String propertyOrDefault(String name, String defaultValue) {
        String value = environment.getProperty(name);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    private BuildInfo fromGit() throws CommandFailedException {
        if (environment.containsProperty(SPACE_ID)) {
            commandRunner.run(List.of("git", "config", "--global", "--add", "safe.directory",
                    buildInfoConfig.getSafeDirectory()), buildInfoConfig.getProbeTimeout());
        }

        ExecutorService probes = Executors.newFixedThreadPool(4);
        try {
            CompletableFuture<String> sha = probe(GIT_SHA, probes);
            CompletableFuture<String> branch = probe(GIT_BRANCH, probes);
            CompletableFuture<String> remote = probe(GIT_REMOTE, probes);
            CompletableFuture<String> status = probe(GIT_STATUS, probes);
            CompletableFuture.allOf(sha, branch, remote, status).join();

            List<String> changes = relevantChanges(status.join());
            boolean modified = !changes.isEmpty();
            String build = sha.join() + (modified ? " (modified)" : "")
                    + " (" + branch.join() + "@" + repoSlug(remote.join()) + ")";
            logger.info("从 Git 获取构建信息 build={} changes={} status={}", build, modified, changes);
            return new BuildInfo(build, BuildInfo.Source.GIT);
        } catch (CompletionException e) {
            if (e.getCause() instanceof CommandFailedException) {
                throw (CommandFailedException) e.getCause();
            }
            throw e;
        } finally {
            probes.shutdownNow();
        }
    }

    private CompletableFuture<String> probe(List<String> command, ExecutorService executor) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return commandRunner.run(command, buildInfoConfig.getProbeTimeout()).trim();
            } catch (CommandFailedException e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    /**
     * Porcelain status lines that count as local modifications. Blank lines and changes to the deployment
     * descriptor are ignored since that file is how the app gets deployed.
     */
    List<String> relevantChanges(String porcelainStatus) {
        String descriptor = buildInfoConfig.getDeploymentDescriptor();
        return Arrays.stream(porcelainStatus.split("\n"))
                .map(String::stripTrailing)
                .filter(line -> !line.isBlank())
                .filter(line -> !line.endsWith(descriptor))
                .collect(Collectors.toList());
    }

    /**
     * @return {@code owner/repo} parsed from an ssh or https remote url, or an empty string
     */
    static String repoSlug(String remoteUrl) {
        Matcher matcher = REMOTE_PATTERN.matcher(remoteUrl);
        if (!matcher.matches()) {
            return "";
        }
        return matcher.group(1) + "/" + matcher.group(2);
    }
}
