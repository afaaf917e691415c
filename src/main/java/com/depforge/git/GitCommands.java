package com.depforge.git;

import com.depforge.core.process.Invocation;
import org.slf4j.event.Level;

import java.nio.file.Path;

/**
 * Builds the invocation for every git subcommand Depforge runs. Nothing here starts a
 * process; {@link GitRepository} runs what these methods return.
 *
 * <p>Every invocation disables the credential manager UI and terminal prompts so that
 * git never waits for interactive input.
 */
public final class GitCommands {

    static final String NOT_A_REPOSITORY = "not a git repo";

    private final Path binary;

    public GitCommands(Path binary) {
        this.binary = binary;
    }

    public Path binary() {
        return binary;
    }

    private Invocation.Builder git() {
        return Invocation.builder(binary)
                .env("GCM_INTERACTIVE", "never")
                .env("GIT_TERMINAL_PROMPT", "0");
    }

    public Invocation init(Path root) {
        return git().arg("init").cwd(root).build();
    }

    public Invocation setConfig(Path root, String key, String value) {
        return git()
                .stderrLevel(Level.TRACE)
                .arg("config", key, value)
                .cwd(root)
                .build();
    }

    public Invocation apply(Path root, String diff) {
        return git()
                .stdin(diff)
                .arg("apply", "--whitespace", "nowarn", "-")
                .cwd(root)
                .build();
    }

    public Invocation fetch(Path root, String remote, String branch) {
        return git().arg("fetch", "-q", remote, branch).cwd(root).build();
    }

    public Invocation checkout(Path root, String what) {
        return git()
                .arg("-c", "advice.detachedHead=false")
                .arg("checkout", "-q", what)
                .cwd(root)
                .build();
    }

    /**
     * Discards local modifications of a single file.
     */
    public Invocation revert(Path root, Path file) {
        return git()
                .stderrLevel(Level.TRACE)
                .arg("checkout", forwardSlashes(file))
                .cwd(root)
                .build();
    }

    public Invocation currentBranch(Path root) {
        return git()
                .captureStdout()
                .arg("branch", "--show-current")
                .cwd(root)
                .build();
    }

    public Invocation addSubmodule(Path root, String branch, String submodule, String url) {
        return git()
                .stderrLevel(Level.TRACE)
                .arg("-c", "core.autocrlf=false")
                .arg("submodule", "--quiet", "add")
                .arg("-b", branch)
                .arg("--force")
                .arg("--name", submodule)
                .arg(url, submodule)
                .cwd(root)
                .build();
    }

    /**
     * Clones into {@code root}, which is passed as the destination rather than used as
     * the working directory since it may not exist yet.
     */
    public Invocation clone(Path root, String url, String branch, boolean shallow) {
        var b = git()
                .stderrLevel(Level.TRACE)
                .arg("clone", "--recurse-submodules");

        if (shallow) {
            b.arg("--depth", "1");
        }

        return b.arg("--branch", branch)
                .quietArg("--quiet")
                .quietArg("-c", "advice.detachedHead=false")
                .arg(url, root.toString())
                .build();
    }

    public Invocation pull(Path root, String url, String branch) {
        return git()
                .stderrLevel(Level.TRACE)
                .arg("pull", "--recurse-submodules")
                .quietArg("--quiet")
                .arg(url, branch)
                .cwd(root)
                .build();
    }

    public Invocation hasRemote(Path root, String name) {
        return git()
                .allowFailure()
                .stderrLevel(Level.DEBUG)
                .arg("config", "remote." + name + ".url")
                .cwd(root)
                .build();
    }

    public Invocation renameRemote(Path root, String from, String to) {
        return git().arg("remote", "rename", from, to).cwd(root).build();
    }

    public Invocation addRemote(Path root, String name, String url) {
        return git().arg("remote", "add", name, url).cwd(root).build();
    }

    public Invocation setRemotePush(Path root, String remote, String url) {
        return git().arg("remote", "set-url", "--push", remote, url).cwd(root).build();
    }

    public Invocation setAssumeUnchanged(Path root, Path file, boolean on) {
        return git()
                .arg("update-index", on ? "--assume-unchanged" : "--no-assume-unchanged")
                .arg(forwardSlashes(file))
                .cwd(root)
                .build();
    }

    /**
     * Exits with 0 when {@code file} is known to git.
     */
    public Invocation isTracked(Path root, Path file) {
        return git()
                .stdoutLevel(Level.DEBUG)
                .stderrLevel(Level.DEBUG)
                .allowFailure()
                .arg("ls-files", "--error-unmatch", forwardSlashes(file))
                .cwd(root)
                .build();
    }

    /**
     * Exits with 0 when {@code root} is inside a work tree. The "not a git repository"
     * message is expected while probing and is logged at trace.
     */
    public Invocation isRepo(Path root) {
        return git()
                .arg("rev-parse", "--is-inside-work-tree")
                .stderrFilter((line, level) -> line.contains(NOT_A_REPOSITORY) ? Level.TRACE : level)
                .allowFailure()
                .cwd(root)
                .build();
    }

    /**
     * Exits with 0 when {@code branch} exists at {@code url}. Does not need a local
     * repository.
     */
    public Invocation remoteBranchExists(String url, String branch) {
        return git()
                .allowFailure()
                .arg("ls-remote", "--exit-code", "--heads", url, branch)
                .build();
    }

    public Invocation hasUncommittedChanges(Path root) {
        return git()
                .allowFailure()
                .captureStdout()
                .arg("status", "-s", "--porcelain")
                .cwd(root)
                .build();
    }

    /**
     * Exits with 0 when the repository has at least one stash entry.
     */
    public Invocation hasStashedChanges(Path root) {
        return git()
                .allowFailure()
                .stderrLevel(Level.TRACE)
                .arg("stash", "show")
                .cwd(root)
                .build();
    }

    public Invocation remoteUrl(Path root) {
        return git()
                .captureStdout()
                .arg("remote", "get-url", "origin")
                .cwd(root)
                .build();
    }

    static String forwardSlashes(Path file) {
        return file.toString().replace('\\', '/');
    }
}
