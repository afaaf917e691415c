package com.depforge.git;

import com.depforge.core.process.BailOutException;
import com.depforge.core.process.BailOutException.Reason;
import com.depforge.core.task.Tool;

/**
 * Adds one submodule. Normally not run directly but handed to {@link SubmoduleAdder}.
 */
public class GitSubmoduleTool extends Tool {

    private final GitRuntime runtime;
    private final SubmoduleRequest request;

    public GitSubmoduleTool(GitRuntime runtime, SubmoduleRequest request) {
        super("git submodule", runtime.processes());
        this.runtime = runtime;
        this.request = request;
    }

    public SubmoduleRequest request() {
        return request;
    }

    @Override
    protected void doRun() {
        if (request.root() == null || isBlank(request.url()) || isBlank(request.submodule())) {
            throw new BailOutException(Reason.GENERIC,
                    "git submodule missing parameters: " + request);
        }

        new GitRepository(runtime, request.root(), this)
                .addSubmodule(request.branch(), request.submodule(), request.url());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
