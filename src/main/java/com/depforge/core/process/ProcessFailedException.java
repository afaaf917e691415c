package com.depforge.core.process;

/**
 * Thrown when a process exits with a nonzero code that the invocation did not allow,
 * or when it could not be started or waited on.
 */
public class ProcessFailedException extends BailOutException {

    private final int exitCode;
    private final String command;

    public ProcessFailedException(String command, int exitCode) {
        super(Reason.GENERIC, "'%s' failed with exit code %d".formatted(command, exitCode));
        this.exitCode = exitCode;
        this.command = command;
    }

    public ProcessFailedException(String command, Throwable cause) {
        super(Reason.GENERIC, "'%s' could not be run: %s".formatted(command, cause.getMessage()), cause);
        this.exitCode = -1;
        this.command = command;
    }

    public int exitCode() {
        return exitCode;
    }

    public String command() {
        return command;
    }
}
