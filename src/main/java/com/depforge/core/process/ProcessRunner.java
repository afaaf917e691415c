package com.depforge.core.process;

/**
 * Runs an {@link Invocation} to completion, blocking the calling thread.
 *
 * <p>A nonzero exit is reported by throwing {@link ProcessFailedException} unless the
 * invocation allows failure, in which case the exit code is returned to the caller.
 */
public interface ProcessRunner {

    ProcessResult run(Invocation invocation);
}
