package com.depforge.core.task;

import com.depforge.core.logging.MdcContext;
import com.depforge.core.process.Invocation;
import com.depforge.core.process.ProcessResult;
import com.depforge.core.process.ProcessRunner;

/**
 * A named operation run on behalf of a task, such as cloning a repository.
 *
 * <p>Processes started through {@link #execute(Invocation)} are logged under the tool's
 * name, in addition to the task name set by the enclosing {@link BuildTask}.
 */
public abstract class Tool {

    private final String name;
    private final ProcessRunner processes;

    protected Tool(String name, ProcessRunner processes) {
        this.name = name;
        this.processes = processes;
    }

    public String name() {
        return name;
    }

    public final void run() {
        try (var scope = MdcContext.withTool(name)) {
            doRun();
        }
    }

    public ProcessResult execute(Invocation invocation) {
        try (var scope = MdcContext.withTool(name)) {
            return processes.run(invocation);
        }
    }

    protected abstract void doRun();
}
