package com.depforge.core.process;

/**
 * Outcome of a finished process.
 *
 * @param exitCode process exit code
 * @param stdout   captured standard output, empty unless the invocation asked for it
 */
public record ProcessResult(int exitCode, String stdout) {

    public boolean succeeded() {
        return exitCode == 0;
    }
}
