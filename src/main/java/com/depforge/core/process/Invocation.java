package com.depforge.core.process;

import org.slf4j.event.Level;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fully-specified description of one external process run.
 *
 * <p>Instances are immutable and built with {@link #builder(Path)}. Environment entries
 * are overrides applied to the child process only; the current process environment is
 * never modified.
 *
 * <p>Arguments added with {@link Builder#quietArg(String...)} are only part of the
 * command line when verbose logging is off, so that tools stay quiet at the default
 * level but show their progress output when debugging.
 */
public final class Invocation {

    /**
     * Reclassifies a single output line, for example to downgrade a known-benign
     * error message.
     */
    @FunctionalInterface
    public interface LineFilter {
        /**
         * @param line  the output line, without its line terminator
         * @param level the level the line would be logged at
         * @return the level to log the line at
         */
        Level apply(String line, Level level);
    }

    record Argument(String value, boolean quietOnly) {}

    private final Path binary;
    private final List<Argument> arguments;
    private final Path workingDirectory;
    private final Map<String, String> environment;
    private final String stdin;
    private final Level stdoutLevel;
    private final Level stderrLevel;
    private final LineFilter stderrFilter;
    private final boolean captureStdout;
    private final boolean allowFailure;

    private Invocation(Builder b) {
        this.binary = b.binary;
        this.arguments = List.copyOf(b.arguments);
        this.workingDirectory = b.workingDirectory;
        this.environment = Collections.unmodifiableMap(new LinkedHashMap<>(b.environment));
        this.stdin = b.stdin;
        this.stdoutLevel = b.stdoutLevel;
        this.stderrLevel = b.stderrLevel;
        this.stderrFilter = b.stderrFilter;
        this.captureStdout = b.captureStdout;
        this.allowFailure = b.allowFailure;
    }

    public static Builder builder(Path binary) {
        return new Builder(binary);
    }

    public Path binary() { return binary; }
    public Path workingDirectory() { return workingDirectory; }
    public Map<String, String> environment() { return environment; }
    public String stdin() { return stdin; }
    public Level stdoutLevel() { return stdoutLevel; }
    public Level stderrLevel() { return stderrLevel; }
    public LineFilter stderrFilter() { return stderrFilter; }
    public boolean captureStdout() { return captureStdout; }
    public boolean allowFailure() { return allowFailure; }

    /**
     * Returns the arguments, without the binary.
     *
     * @param verbose whether verbose logging is on; quiet-only arguments are dropped when true
     */
    public List<String> arguments(boolean verbose) {
        var list = new ArrayList<String>(arguments.size());
        for (var a : arguments) {
            if (a.quietOnly() && verbose) continue;
            list.add(a.value());
        }
        return list;
    }

    /**
     * Returns the binary followed by the arguments, as given to the operating system.
     */
    public List<String> commandLine(boolean verbose) {
        var list = new ArrayList<String>(arguments.size() + 1);
        list.add(binary.toString());
        list.addAll(arguments(verbose));
        return list;
    }

    /**
     * Returns the first argument that is not an option, skipping {@code -c key=value}
     * pairs; for git this is the subcommand name.
     */
    public String subcommand() {
        var args = arguments(true);
        for (int i = 0; i < args.size(); i++) {
            String a = args.get(i);
            if ("-c".equals(a)) {
                i++;
                continue;
            }
            if (!a.startsWith("-")) {
                return a;
            }
        }
        return "";
    }

    /**
     * Command line rendered for logs and error messages.
     */
    public String describe() {
        return String.join(" ", commandLine(false));
    }

    @Override
    public String toString() {
        return describe();
    }

    public static final class Builder {
        private final Path binary;
        private final List<Argument> arguments = new ArrayList<>();
        private Path workingDirectory;
        private final Map<String, String> environment = new LinkedHashMap<>();
        private String stdin;
        private Level stdoutLevel = Level.DEBUG;
        private Level stderrLevel = Level.WARN;
        private LineFilter stderrFilter;
        private boolean captureStdout;
        private boolean allowFailure;

        private Builder(Path binary) {
            this.binary = Objects.requireNonNull(binary, "binary");
        }

        public Builder arg(String... values) {
            for (String v : values) {
                arguments.add(new Argument(v, false));
            }
            return this;
        }

        public Builder quietArg(String... values) {
            for (String v : values) {
                arguments.add(new Argument(v, true));
            }
            return this;
        }

        public Builder cwd(Path dir) {
            this.workingDirectory = dir;
            return this;
        }

        public Builder env(String name, String value) {
            environment.put(name, value);
            return this;
        }

        public Builder stdin(String payload) {
            this.stdin = payload;
            return this;
        }

        public Builder stdoutLevel(Level level) {
            this.stdoutLevel = level;
            return this;
        }

        public Builder stderrLevel(Level level) {
            this.stderrLevel = level;
            return this;
        }

        public Builder stderrFilter(LineFilter filter) {
            this.stderrFilter = filter;
            return this;
        }

        public Builder captureStdout() {
            this.captureStdout = true;
            return this;
        }

        public Builder allowFailure() {
            this.allowFailure = true;
            return this;
        }

        public Invocation build() {
            return new Invocation(this);
        }
    }
}
