package com.depforge.git;

import com.depforge.core.config.DepforgeProperties;
import com.depforge.core.process.ProcessRunner;

/**
 * What every git operation needs: the command builders, something to run them with,
 * and the configuration.
 */
public record GitRuntime(GitCommands commands, ProcessRunner processes, DepforgeProperties properties) {
}
