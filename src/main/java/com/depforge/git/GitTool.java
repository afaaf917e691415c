package com.depforge.git;

import com.depforge.core.process.BailOutException;
import com.depforge.core.process.BailOutException.Reason;
import com.depforge.core.task.Tool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Clones or pulls a repository for a task.
 *
 * <p>Configure with the fluent setters, then {@link #run()} once. Cloning is skipped
 * when {@code root/.git} already exists, so repeated runs do not clone twice.
 */
public class GitTool extends Tool {

    private static final Logger log = LoggerFactory.getLogger(GitTool.class);

    public enum Op {
        CLONE,
        PULL,
        /** Pulls if the repository exists, clones otherwise. */
        CLONE_OR_PULL
    }

    private final GitRuntime runtime;
    private final Op op;

    private String url = "";
    private Path root;
    private String branch = "";
    private boolean ignoreTs;
    private boolean revertTs;
    private String username = "";
    private String email = "";
    private boolean shallow;
    private String remoteOrg = "";
    private String remoteKey = "";
    private boolean noPushUpstream;
    private boolean pushDefaultOrigin;

    public GitTool(GitRuntime runtime, Op op) {
        super("git", runtime.processes());
        this.runtime = runtime;
        this.op = Objects.requireNonNull(op, "op");
    }

    public GitTool url(String url) {
        this.url = url;
        return this;
    }

    public GitTool root(Path dir) {
        this.root = dir;
        return this;
    }

    public GitTool branch(String name) {
        this.branch = name;
        return this;
    }

    /**
     * Marks all translation files as assume-unchanged after cloning.
     */
    public GitTool ignoreTsOnClone(boolean b) {
        this.ignoreTs = b;
        return this;
    }

    /**
     * Reverts all translation files before pulling.
     */
    public GitTool revertTsOnPull(boolean b) {
        this.revertTs = b;
        return this;
    }

    /**
     * Sets {@code user.name} and {@code user.email} after cloning.
     */
    public GitTool credentials(String username, String email) {
        this.username = username;
        this.email = email;
        return this;
    }

    public GitTool shallow(boolean b) {
        this.shallow = b;
        return this;
    }

    /**
     * Rewires remotes after cloning, see
     * {@link GitRepository#setOriginAndUpstreamRemotes(String, String, boolean, boolean)}.
     */
    public GitTool remote(String org, String key, boolean noPushUpstream, boolean pushDefaultOrigin) {
        this.remoteOrg = org;
        this.remoteKey = key;
        this.noPushUpstream = noPushUpstream;
        this.pushDefaultOrigin = pushDefaultOrigin;
        return this;
    }

    public Op op() {
        return op;
    }

    @Override
    protected void doRun() {
        if (url == null || url.isBlank() || root == null || root.toString().isEmpty()) {
            throw new BailOutException(Reason.GENERIC,
                    "git missing parameters: url '%s', root '%s'".formatted(url, root));
        }

        switch (op) {
            case CLONE -> doClone();
            case PULL -> doPull();
            case CLONE_OR_PULL -> {
                if (!doClone()) {
                    doPull();
                }
            }
            default -> throw new BailOutException(Reason.GENERIC, "git unknown op " + op);
        }
    }

    /**
     * @return false if the repository was already there
     */
    private boolean doClone() {
        Path dotGit = root.resolve(".git");
        if (Files.exists(dotGit)) {
            log.trace("not cloning, {} exists", dotGit);
            return false;
        }

        var repo = new GitRepository(runtime, root, this);

        log.info("Cloning {} ({}) into {}", url, branch, root);
        repo.clone(url, branch, shallow);

        if (!isBlank(username) || !isBlank(email)) {
            repo.setCredentials(username, email);
        }

        if (!isBlank(remoteOrg)) {
            repo.setOriginAndUpstreamRemotes(remoteOrg, remoteKey, noPushUpstream, pushDefaultOrigin);
        }

        if (ignoreTs) {
            repo.ignoreTs(true);
        }

        return true;
    }

    private void doPull() {
        var repo = new GitRepository(runtime, root, this);

        if (revertTs) {
            repo.revertTs();
        }

        log.info("Pulling {} ({}) in {}", url, branch, root);
        repo.pull(url, branch);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
