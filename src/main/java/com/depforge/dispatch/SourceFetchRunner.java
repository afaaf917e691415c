package com.depforge.dispatch;

import com.depforge.core.config.DepforgeProperties;
import com.depforge.core.process.BailOutException;
import com.depforge.git.GitRuntime;
import com.depforge.git.SubmoduleAdder;
import com.depforge.tasks.GitSourceTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Cleans and fetches every configured source once the application has started.
 *
 * <p>A task that bails out is reported and skipped; the others still run and the
 * exit code is set to 1.
 */
@Component
public class SourceFetchRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(SourceFetchRunner.class);

    private final GitRuntime runtime;
    private final SubmoduleAdder submoduleAdder;
    private final DepforgeProperties properties;
    private final List<String> failed = new ArrayList<>();

    public SourceFetchRunner(GitRuntime runtime, SubmoduleAdder submoduleAdder, DepforgeProperties properties) {
        this.runtime = runtime;
        this.submoduleAdder = submoduleAdder;
        this.properties = properties;
    }

    @Override
    public void run(String... args) {
        var sources = properties.getSources();
        if (sources.isEmpty()) {
            log.info("No sources configured");
            return;
        }

        for (var source : sources) {
            var task = new GitSourceTask(runtime, submoduleAdder, source);
            try {
                task.clean(properties.getClean());
                task.fetch();
            } catch (BailOutException e) {
                log.error("{} failed ({}): {}", task.name(), e.reason(), e.getMessage());
                failed.add(task.name());
            }
        }

        submoduleAdder.awaitIdle();

        if (!failed.isEmpty()) {
            log.error("{} of {} sources failed: {}", failed.size(), sources.size(), failed);
        }
    }

    public List<String> failed() {
        return List.copyOf(failed);
    }

    @Override
    public int getExitCode() {
        return failed.isEmpty() ? 0 : 1;
    }
}
