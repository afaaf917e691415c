package com.depforge.git;

import com.depforge.core.process.BailOutException;
import com.depforge.core.process.BailOutException.Reason;
import com.depforge.core.process.Invocation;
import com.depforge.core.process.ProcessResult;
import com.depforge.core.task.Tool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Runs git commands against one working tree.
 *
 * <p>When a {@link Tool} is given, processes are run through it so their output is
 * attributed to the tool and its task; otherwise they run directly. Instances hold no
 * OS resources and are cheap to create per operation.
 */
public class GitRepository {

    private static final Logger log = LoggerFactory.getLogger(GitRepository.class);

    static final String ORIGIN = "origin";
    static final String UPSTREAM = "upstream";
    static final String NO_PUSH_URL = "nopushurl";
    static final String IGNORE_UNCOMMITTED_HINT =
            "see --ignore-uncommitted-changes (depforge.global.ignore-uncommitted)";

    private final GitRuntime runtime;
    private final GitCommands commands;
    private final Path root;
    private final Tool runner;

    public GitRepository(GitRuntime runtime, Path root) {
        this(runtime, root, null);
    }

    public GitRepository(GitRuntime runtime, Path root, Tool runner) {
        this.runtime = runtime;
        this.commands = runtime.commands();
        this.root = root;
        this.runner = runner;
    }

    public Path root() {
        return root;
    }

    public void clone(String url, String branch, boolean shallow) {
        run(commands.clone(root, url, branch, shallow));
    }

    public void pull(String url, String branch) {
        run(commands.pull(root, url, branch));
    }

    /**
     * Sets {@code user.name} and {@code user.email}; blank values are left alone.
     */
    public void setCredentials(String username, String email) {
        log.debug("Setting up credentials in {}", root);

        if (username != null && !username.isBlank()) {
            setConfig("user.name", username);
        }
        if (email != null && !email.isBlank()) {
            setConfig("user.email", email);
        }
    }

    /**
     * Turns a fresh clone of the shared repository into a fork checkout: the cloned
     * remote becomes "upstream" and a new "origin" points at {@code org}'s copy.
     *
     * <p>No-op when an "upstream" remote already exists.
     *
     * @param org               owner of the fork
     * @param key               key file for the new origin, may be empty
     * @param noPushUpstream    sets the upstream push url to an invalid value
     * @param pushDefaultOrigin makes origin the default push remote
     */
    public void setOriginAndUpstreamRemotes(String org, String key,
                                            boolean noPushUpstream, boolean pushDefaultOrigin) {
        if (hasRemote(UPSTREAM)) {
            log.trace("upstream remote already exists in {}", root);
            return;
        }

        // must be read before the rename, origin is gone afterwards
        String gitFile = gitFile();

        renameRemote(ORIGIN, UPSTREAM);

        if (noPushUpstream) {
            setRemotePush(UPSTREAM, NO_PUSH_URL);
        }

        addRemote(ORIGIN, org, key, pushDefaultOrigin, null, gitFile);
    }

    /**
     * Adds a remote named {@code name} for {@code org}'s copy of the repository;
     * no-op if the remote already exists.
     *
     * @param urlPattern format string taking the org then the git file; the configured
     *                   pattern is used when null
     * @param gitFile    repository file name such as {@code modorganizer.git}; taken
     *                   from the origin remote when null
     */
    public void addRemote(String name, String org, String key, boolean pushDefault,
                          String urlPattern, String gitFile) {
        if (hasRemote(name)) {
            log.trace("remote {} already exists in {}", name, root);
            return;
        }

        String file = gitFile != null ? gitFile : gitFile();
        String pattern = urlPattern != null ? urlPattern : runtime.properties().getUrlPattern();

        run(commands.addRemote(root, name, makeUrl(pattern, org, file)));

        if (pushDefault) {
            setConfig("remote.pushdefault", name);
        }
        if (key != null && !key.isEmpty()) {
            setConfig("remote." + name + ".puttykeyfile", key);
        }
    }

    public void renameRemote(String from, String to) {
        run(commands.renameRemote(root, from, to));
    }

    public void setRemotePush(String remote, String url) {
        run(commands.setRemotePush(root, remote, url));
    }

    public void setConfig(String key, String value) {
        run(commands.setConfig(root, key, value));
    }

    public void setAssumeUnchanged(Path relativeFile, boolean on) {
        run(commands.setAssumeUnchanged(root, relativeFile, on));
    }

    /**
     * Sets or clears the assume-unchanged flag on every tracked translation file, so
     * regenerated translations never show up as local modifications.
     */
    public void ignoreTs(boolean on) {
        forEachTs(relative -> {
            if (isTracked(relative)) {
                log.trace("  . {}", relative);
                setAssumeUnchanged(relative, on);
            } else {
                log.trace("  . {} (skipping, not tracked)", relative);
            }
        });
    }

    /**
     * Discards local changes to every tracked translation file. Run before pulling so
     * regenerated translations cannot conflict.
     */
    public void revertTs() {
        forEachTs(relative -> {
            if (isTracked(relative)) {
                run(commands.revert(root, relative));
            } else {
                log.debug("won't try to revert ts file '{}', not tracked", relative);
            }
        });
    }

    public boolean isTracked(Path relativeFile) {
        return run(commands.isTracked(root, relativeFile)).succeeded();
    }

    public boolean hasRemote(String name) {
        return run(commands.hasRemote(root, name)).succeeded();
    }

    /**
     * Returns the repository file used by the origin remote, such as
     * {@code modorganizer.git}.
     *
     * @throws BailOutException if the remote url has no path segment
     */
    public String gitFile() {
        String out = run(commands.remoteUrl(root)).stdout();

        int lastSlash = out.lastIndexOf('/');
        if (lastSlash < 0) {
            log.error("bad get-url output '{}'", out);
            throw new BailOutException(Reason.GENERIC,
                    "bad get-url output '%s' for %s".formatted(out, root));
        }

        String file = out.substring(lastSlash + 1).trim();
        if (file.isEmpty()) {
            log.error("bad get-url output '{}'", out);
            throw new BailOutException(Reason.GENERIC,
                    "bad get-url output '%s' for %s".formatted(out, root));
        }

        return file;
    }

    public void initRepo() {
        run(commands.init(root));
    }

    /**
     * Applies a diff, for example one downloaded from a pull request.
     */
    public void apply(String diff) {
        run(commands.apply(root, diff));
    }

    public void fetch(String remote, String branch) {
        run(commands.fetch(root, remote, branch));
    }

    public void checkout(String what) {
        run(commands.checkout(root, what));
    }

    public void addSubmodule(String branch, String submodule, String url) {
        run(commands.addSubmodule(root, branch, submodule, url));
    }

    public String currentBranch() {
        return run(commands.currentBranch(root)).stdout().trim();
    }

    public boolean isGitRepo() {
        return run(commands.isRepo(root)).succeeded();
    }

    public boolean hasUncommittedChanges() {
        return !run(commands.hasUncommittedChanges(root)).stdout().isEmpty();
    }

    public boolean hasStashedChanges() {
        return run(commands.hasStashedChanges(root)).succeeded();
    }

    /**
     * Deletes a directory that was created by cloning.
     *
     * <p>If the directory is a git repository with uncommitted or stashed changes, the
     * directory is left alone and the caller bails out, unless
     * {@code depforge.global.ignore-uncommitted} is set. Directories that are not
     * repositories, such as ones unpacked from prebuilt archives, are deleted without
     * checks. A missing directory is not an error.
     *
     * @throws BailOutException if the repository has local work or deletion fails
     */
    public static void deleteDirectory(GitRuntime runtime, Path dir) {
        if (!Files.isDirectory(dir)) {
            log.trace("{} does not exist, nothing to delete", dir);
            return;
        }

        var repo = new GitRepository(runtime, dir);

        if (repo.isGitRepo()) {
            if (!runtime.properties().isIgnoreUncommitted()) {
                if (repo.hasUncommittedChanges()) {
                    throw bailRedownload("will not delete %s, has uncommitted changes; %s"
                            .formatted(dir, IGNORE_UNCOMMITTED_HINT));
                }

                if (repo.hasStashedChanges()) {
                    throw bailRedownload("will not delete %s, has stashed changes; %s"
                            .formatted(dir, IGNORE_UNCOMMITTED_HINT));
                }
            }

            log.trace("deleting directory controlled by git {}", dir);
        }

        try {
            if (!FileSystemUtils.deleteRecursively(dir)) {
                log.trace("{} was already gone", dir);
            }
        } catch (IOException e) {
            throw new BailOutException(Reason.REDOWNLOAD, "failed to delete " + dir, e);
        }
    }

    /**
     * Checks whether {@code branch} exists at {@code url} without touching any local
     * working tree.
     */
    public static boolean remoteBranchExists(GitRuntime runtime, String url, String branch) {
        return runtime.processes().run(runtime.commands().remoteBranchExists(url, branch)).succeeded();
    }

    static String makeUrl(String pattern, String org, String gitFile) {
        return String.format(pattern, org, gitFile);
    }

    private static BailOutException bailRedownload(String message) {
        log.error(message);
        return new BailOutException(Reason.REDOWNLOAD, message);
    }

    private void forEachTs(Consumer<Path> action) {
        String extension = runtime.properties().getTsExtension();
        List<Path> files;

        try (Stream<Path> walk = Files.walk(root)) {
            files = walk
                    .filter(Files::isRegularFile)
                    .map(root::relativize)
                    .filter(p -> !p.startsWith(".git"))
                    .filter(p -> p.getFileName().toString().endsWith(extension))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new BailOutException(Reason.GENERIC, "failed to list translation files in " + root, e);
        }

        files.forEach(action);
    }

    private ProcessResult run(Invocation invocation) {
        if (runner != null) {
            return runner.execute(invocation);
        }
        return runtime.processes().run(invocation);
    }
}
