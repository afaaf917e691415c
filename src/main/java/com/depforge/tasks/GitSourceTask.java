package com.depforge.tasks;

import com.depforge.core.config.DepforgeProperties;
import com.depforge.core.config.DepforgeProperties.Source;
import com.depforge.core.config.DepforgeProperties.Submodule;
import com.depforge.core.process.BailOutException;
import com.depforge.core.process.BailOutException.Reason;
import com.depforge.core.task.BuildTask;
import com.depforge.core.task.CleanFlag;
import com.depforge.git.GitRepository;
import com.depforge.git.GitRuntime;
import com.depforge.git.GitTool;
import com.depforge.git.SubmoduleAdder;
import com.depforge.git.SubmoduleRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

/**
 * Keeps one configured repository checked out and up to date.
 *
 * <p>Fetching clones or pulls the repository with the global git defaults, then hands
 * the configured submodules to the {@link SubmoduleAdder}. Prebuilt sources are not
 * fetched.
 */
public class GitSourceTask extends BuildTask {

    private static final Logger log = LoggerFactory.getLogger(GitSourceTask.class);

    private final GitRuntime runtime;
    private final SubmoduleAdder submoduleAdder;
    private final Source source;

    public GitSourceTask(GitRuntime runtime, SubmoduleAdder submoduleAdder, Source source) {
        super(source.getName());
        this.runtime = runtime;
        this.submoduleAdder = submoduleAdder;
        this.source = source;
    }

    @Override
    public boolean prebuilt() {
        return source.isPrebuilt();
    }

    public Path sourcePath() {
        if (source.getPath() == null || source.getPath().isBlank()) {
            throw new BailOutException(Reason.GENERIC, "source " + name() + " has no path");
        }
        return Path.of(source.getPath());
    }

    public String url() {
        return gitUrl(source.getUrl(), source.getOrg(), source.getRepo());
    }

    @Override
    protected void doClean(Set<CleanFlag> flags) {
        if (flags.contains(CleanFlag.RECLONE)) {
            GitRepository.deleteDirectory(runtime, sourcePath());
        }

        if (flags.contains(CleanFlag.REBUILD) && !source.getBuildPath().isBlank()) {
            Path buildPath = Path.of(source.getBuildPath());
            try {
                FileSystemUtils.deleteRecursively(buildPath);
            } catch (IOException e) {
                throw new BailOutException(Reason.GENERIC, "failed to delete " + buildPath, e);
            }
        }
    }

    @Override
    protected void doFetch() {
        if (prebuilt()) {
            log.info("{} is prebuilt, nothing to fetch", name());
            return;
        }

        var git = runtime.properties().getGit();

        runTool(new GitTool(runtime, GitTool.Op.CLONE_OR_PULL)
                .url(url())
                .branch(source.getBranch())
                .root(sourcePath())
                .shallow(git.isShallow())
                .ignoreTsOnClone(git.isIgnoreTs())
                .revertTsOnPull(git.isRevertTs())
                .credentials(git.getUsername(), git.getEmail())
                .remote(git.getRemoteOrg(), git.getRemoteKey(),
                        git.isRemoteNoPushUpstream(), git.isRemotePushDefaultOrigin()));

        for (Submodule sub : source.getSubmodules()) {
            String subUrl = gitUrl(sub.getUrl(), sub.getOrg(), sub.getRepo());
            log.debug("Queueing submodule {} for {}", sub.getName(), name());
            submoduleAdder.queue(new SubmoduleRequest(subUrl, sourcePath(), sub.getBranch(), sub.getName()));
        }
    }

    private String gitUrl(String url, String org, String repo) {
        if (url != null && !url.isBlank()) {
            return url;
        }
        if (org == null || org.isBlank() || repo == null || repo.isBlank()) {
            throw new BailOutException(Reason.GENERIC,
                    "%s needs either a url or an org and repo".formatted(name()));
        }
        DepforgeProperties.Git git = runtime.properties().getGit();
        return git.getUrlPrefix() + org + "/" + repo + ".git";
    }
}
