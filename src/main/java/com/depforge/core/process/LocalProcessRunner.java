package com.depforge.core.process;

import com.depforge.core.metrics.GitMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.slf4j.event.Level;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs invocations as local child processes via {@link ProcessBuilder}.
 *
 * <p>Standard input is written and standard error drained on helper threads while
 * standard output is read on the calling thread, so no pipe can fill up and block the
 * child. Every line is logged
 * at its stream's level; stderr lines go through the invocation's filter first. When a
 * process fails and failure is not allowed, the collected stderr is logged as an error
 * before {@link ProcessFailedException} is thrown.
 */
public class LocalProcessRunner implements ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(LocalProcessRunner.class);

    private final GitMetrics metrics;

    public LocalProcessRunner() {
        this(null);
    }

    public LocalProcessRunner(GitMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public ProcessResult run(Invocation invocation) {
        List<String> command = invocation.commandLine(log.isDebugEnabled());
        String described = String.join(" ", command);
        log.debug("Running: {}", described);

        var builder = new ProcessBuilder(command);
        if (invocation.workingDirectory() != null) {
            builder.directory(invocation.workingDirectory().toFile());
        }
        builder.environment().putAll(invocation.environment());

        long startMs = System.currentTimeMillis();
        int exitCode;
        String stdout;
        List<String> stderrLines = new ArrayList<>();

        Process process = null;
        boolean finished = false;

        try {
            process = builder.start();
            Process child = process;

            Map<String, String> mdc = MDC.getCopyOfContextMap();
            Thread stderrPump = new Thread(() -> {
                if (mdc != null) MDC.setContextMap(mdc);
                drainStderr(child.getErrorStream(), invocation, stderrLines);
            }, "process-stderr");
            stderrPump.setDaemon(true);
            stderrPump.start();

            Thread stdinWriter = new Thread(() -> {
                if (mdc != null) MDC.setContextMap(mdc);
                writeStdin(child.getOutputStream(), invocation.stdin());
            }, "process-stdin");
            stdinWriter.setDaemon(true);
            stdinWriter.start();

            stdout = drainStdout(process.getInputStream(), invocation);

            exitCode = process.waitFor();
            stderrPump.join();
            stdinWriter.join();
            finished = true;
        } catch (IOException e) {
            recordMetric(invocation, false, startMs);
            log.error("Could not run {}", described, e);
            throw new ProcessFailedException(described, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordMetric(invocation, false, startMs);
            throw new ProcessFailedException(described, e);
        } finally {
            if (process != null && !finished) {
                process.destroyForcibly();
            }
        }

        recordMetric(invocation, exitCode == 0, startMs);

        if (exitCode != 0) {
            if (invocation.allowFailure()) {
                log.debug("{} exited with code {} (allowed)", described, exitCode);
            } else {
                log.error("{} exited with code {}", described, exitCode);
                synchronized (stderrLines) {
                    for (String line : stderrLines) {
                        log.error("  {}", line);
                    }
                }
                throw new ProcessFailedException(described, exitCode);
            }
        }

        return new ProcessResult(exitCode, stdout);
    }

    private String drainStdout(InputStream in, Invocation invocation) throws IOException {
        var captured = new StringBuilder();
        try (var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (invocation.captureStdout()) {
                    if (captured.length() > 0) captured.append('\n');
                    captured.append(line);
                }
                log.atLevel(invocation.stdoutLevel()).log("{}", line);
            }
        }
        return captured.toString();
    }

    private void drainStderr(InputStream in, Invocation invocation, List<String> sink) {
        try (var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                Level level = invocation.stderrLevel();
                if (invocation.stderrFilter() != null) {
                    level = invocation.stderrFilter().apply(line, level);
                }
                synchronized (sink) {
                    sink.add(line);
                }
                log.atLevel(level).log("{}", line);
            }
        } catch (IOException e) {
            log.debug("stderr closed early: {}", e.getMessage());
        }
    }

    /**
     * Writes the payload and closes stdin. A child that exits without reading all of
     * its input closes the pipe; its exit code reports that failure, so the write
     * error is only logged.
     */
    private void writeStdin(OutputStream out, String payload) {
        try (out) {
            if (payload != null) {
                out.write(payload.getBytes(StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            log.debug("stdin closed early: {}", e.getMessage());
        }
    }

    private void recordMetric(Invocation invocation, boolean success, long startMs) {
        if (metrics != null) {
            metrics.recordInvocation(invocation.subcommand(), success, System.currentTimeMillis() - startMs);
        }
    }
}
