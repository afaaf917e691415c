package com.depforge.core.task;

import com.depforge.core.logging.MdcContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Base class for a unit of build work: cleaning old state, then fetching sources.
 *
 * <p>Whether a task uses prebuilt binaries is an explicit configuration input returned
 * by {@link #prebuilt()}; it is never inferred from the filesystem.
 */
public abstract class BuildTask {

    private static final Logger log = LoggerFactory.getLogger(BuildTask.class);

    private final String name;

    protected BuildTask(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    public abstract boolean prebuilt();

    public final void clean(Set<CleanFlag> flags) {
        if (flags == null || flags.isEmpty()) {
            return;
        }
        try (var scope = MdcContext.withTask(name)) {
            log.debug("Cleaning {} ({})", name, flags);
            doClean(flags);
        }
    }

    public final void fetch() {
        try (var scope = MdcContext.withTask(name)) {
            log.info("Fetching {}", name);
            doFetch();
        }
    }

    protected void runTool(Tool tool) {
        log.debug("Running tool {}", tool.name());
        tool.run();
    }

    protected abstract void doClean(Set<CleanFlag> flags);

    protected abstract void doFetch();
}
