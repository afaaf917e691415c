package com.depforge.git;

import com.depforge.core.config.DepforgeProperties;
import com.depforge.core.metrics.GitMetrics;
import com.depforge.core.process.LocalProcessRunner;
import com.depforge.core.process.ProcessRunner;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class GitConfig {

    @Bean
    public GitCommands gitCommands(DepforgeProperties properties) {
        return new GitCommands(Path.of(properties.getGitBinary()));
    }

    @Bean
    public ProcessRunner processRunner(@Autowired(required = false) GitMetrics metrics) {
        return new LocalProcessRunner(metrics);
    }

    @Bean
    public GitRuntime gitRuntime(GitCommands commands, ProcessRunner processes, DepforgeProperties properties) {
        return new GitRuntime(commands, processes, properties);
    }
}
