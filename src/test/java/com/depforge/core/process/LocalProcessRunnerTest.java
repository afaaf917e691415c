package com.depforge.core.process;

import com.depforge.core.metrics.GitMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.event.Level;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the current JVM's {@code java} launcher as a child process, so the tests do not
 * depend on git being installed.
 */
class LocalProcessRunnerTest {

    private static final Path JAVA = Path.of(System.getProperty("java.home"), "bin", "java");

    @TempDir
    Path tempDir;

    private final LocalProcessRunner runner = new LocalProcessRunner();

    @Test
    @DisplayName("captures stdout of a successful process")
    void capturesStdout() {
        var result = runner.run(Invocation.builder(JAVA)
                .arg("--version")
                .captureStdout()
                .cwd(tempDir)
                .build());

        assertTrue(result.succeeded());
        assertEquals(0, result.exitCode());
        assertFalse(result.stdout().isBlank());
        assertFalse(result.stdout().endsWith("\n"));
    }

    @Test
    @DisplayName("stdout is empty unless captured")
    void noCaptureByDefault() {
        var result = runner.run(Invocation.builder(JAVA).arg("--version").build());

        assertTrue(result.succeeded());
        assertEquals("", result.stdout());
    }

    @Test
    @DisplayName("returns the exit code when failure is allowed")
    void allowedFailure() {
        var result = runner.run(Invocation.builder(JAVA)
                .arg("--no-such-option")
                .allowFailure()
                .build());

        assertFalse(result.succeeded());
        assertNotEquals(0, result.exitCode());
    }

    @Test
    @DisplayName("throws when failure is not allowed")
    void disallowedFailure() {
        var e = assertThrows(ProcessFailedException.class, () ->
                runner.run(Invocation.builder(JAVA).arg("--no-such-option").build()));

        assertNotEquals(0, e.exitCode());
        assertTrue(e.command().contains("--no-such-option"));
        assertEquals(BailOutException.Reason.GENERIC, e.reason());
    }

    @Test
    @DisplayName("keeps the exit code when the child exits without reading its input")
    void childIgnoresStdin() {
        String payload = "x".repeat(4 * 1024 * 1024);

        var result = runner.run(Invocation.builder(JAVA)
                .arg("--no-such-option")
                .stdin(payload)
                .allowFailure()
                .build());

        assertNotEquals(0, result.exitCode());
        assertNotEquals(-1, result.exitCode());
    }

    @Test
    @DisplayName("reports the real exit code when a child that ignores its input fails")
    void childIgnoresStdinAndFails() {
        String payload = "x".repeat(4 * 1024 * 1024);

        var e = assertThrows(ProcessFailedException.class, () ->
                runner.run(Invocation.builder(JAVA)
                        .arg("--no-such-option")
                        .stdin(payload)
                        .build()));

        assertNotEquals(0, e.exitCode());
        assertNotEquals(-1, e.exitCode());
    }

    @Test
    @DisplayName("throws when the binary cannot be started")
    void missingBinary() {
        var e = assertThrows(ProcessFailedException.class, () ->
                runner.run(Invocation.builder(tempDir.resolve("no-such-binary")).build()));

        assertEquals(-1, e.exitCode());
    }

    @Test
    @DisplayName("passes every stderr line through the filter")
    void stderrFilter() {
        var seen = Collections.synchronizedList(new ArrayList<String>());

        runner.run(Invocation.builder(JAVA)
                .arg("-version")
                .stderrFilter((line, level) -> {
                    seen.add(line);
                    return Level.TRACE;
                })
                .build());

        assertFalse(seen.isEmpty());
    }

    @Test
    @DisplayName("records a metric per run")
    void metrics() {
        var registry = new SimpleMeterRegistry();
        var metered = new LocalProcessRunner(new GitMetrics(registry));

        metered.run(Invocation.builder(JAVA).arg("--version").build());
        metered.run(Invocation.builder(JAVA).arg("--no-such-option").allowFailure().build());

        assertEquals(1.0, registry.find("depforge.git.invocations")
                .tag("result", "success").counter().count());
        assertEquals(1.0, registry.find("depforge.git.invocations")
                .tag("result", "failure").counter().count());
    }

    @Test
    @DisplayName("passes environment overrides to the child")
    void environment() {
        var result = runner.run(Invocation.builder(JAVA)
                .arg("-XshowSettings:properties", "-version")
                .env("DEPFORGE_TEST", "1")
                .build());

        assertTrue(result.succeeded());
        assertNull(System.getenv("DEPFORGE_TEST"));
    }

    @Test
    void commandLineDropsQuietArgumentsWhenVerbose() {
        var inv = Invocation.builder(Path.of("git"))
                .arg("pull")
                .quietArg("--quiet")
                .arg("origin")
                .build();

        assertEquals(List.of("git", "pull", "--quiet", "origin"), inv.commandLine(false));
        assertEquals(List.of("git", "pull", "origin"), inv.commandLine(true));
        assertEquals("pull", inv.subcommand());
        assertEquals("git pull --quiet origin", inv.describe());
    }
}
