package com.depforge.dispatch;

import com.depforge.core.config.DepforgeProperties;
import com.depforge.core.config.DepforgeProperties.Source;
import com.depforge.git.FakeGit;
import com.depforge.git.SubmoduleAdder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SourceFetchRunnerTest {

    @TempDir
    Path tempDir;

    private FakeGit git;
    private DepforgeProperties properties;
    private SubmoduleAdder adder;

    @BeforeEach
    void setUp() {
        git = new FakeGit();
        properties = new DepforgeProperties();
        adder = mock(SubmoduleAdder.class);
    }

    private Source source(String name, String path) {
        var s = new Source();
        s.setName(name);
        s.setOrg("ModOrganizer2");
        s.setRepo(name);
        s.setPath(path);
        return s;
    }

    private SourceFetchRunner runner() {
        return new SourceFetchRunner(git.runtime(properties), adder, properties);
    }

    @Test
    @DisplayName("no sources is a successful no-op")
    void noSources() {
        var runner = runner();
        runner.run();

        assertEquals(0, runner.getExitCode());
        assertTrue(git.invocations().isEmpty());
    }

    @Test
    @DisplayName("fetches every source and waits for the submodule worker")
    void fetchesAll() {
        properties.getSources().add(source("uibase", tempDir.resolve("uibase").toString()));
        properties.getSources().add(source("usvfs", tempDir.resolve("usvfs").toString()));

        var runner = runner();
        runner.run();

        assertEquals(0, runner.getExitCode());
        assertEquals(2, git.count("clone"));
        verify(adder).awaitIdle();
    }

    @Test
    @DisplayName("a failing source sets exit code 1 and the others still run")
    void failureIsolated() {
        properties.getSources().add(source("broken", ""));
        properties.getSources().add(source("usvfs", tempDir.resolve("usvfs").toString()));

        var runner = runner();
        runner.run();

        assertEquals(1, runner.getExitCode());
        assertEquals(List.of("broken"), runner.failed());
        assertEquals(1, git.count("clone"));
    }
}
