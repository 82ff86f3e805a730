package com.runtimehub.runtime_engine.engine;

import com.runtimehub.runtime_engine.config.RuntimeHubProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs Python code in a subprocess.
 *
 * <p>The code is written to a temp file (inside the run workspace when there is one) and run
 * with the configured interpreter. stdout and stderr are captured. The process is killed when
 * it exceeds the node execution ceiling or when the run is cancelled.
 */
@Slf4j
@Service
public class ScriptRunner {

    private final String interpreter;
    private final Duration timeout;

    public ScriptRunner(RuntimeHubProperties properties) {
        this.interpreter = properties.getPython().getInterpreter();
        this.timeout = properties.getWorkflow().getMaxNodeExecutionTime();
    }

    public ScriptResult runPython(String code, List<String> args, Path workDir, CancellationToken cancellation)
            throws InterruptedException {
        Path scriptFile = null;
        Process process = null;
        try {
            scriptFile = workDir != null
                    ? Files.createTempFile(workDir, "script_", ".py")
                    : Files.createTempFile("script_", ".py");
            Files.writeString(scriptFile, code, StandardCharsets.UTF_8);

            List<String> command = new ArrayList<>();
            command.add(interpreter);
            command.add(scriptFile.toString());
            command.addAll(args);

            ProcessBuilder builder = new ProcessBuilder(command);
            if (workDir != null) {
                builder.directory(workDir.toFile());
            }
            process = builder.start();

            Process started = process;
            CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(started.getInputStream()));
            CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(started.getErrorStream()));
            Runnable deregister = cancellation.onCancel(started::destroyForcibly);

            boolean finished;
            try {
                finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } finally {
                deregister.run();
            }

            if (!finished) {
                process.destroyForcibly();
                return ScriptResult.error("Python execution timed out after " + timeout.toSeconds() + "s");
            }
            if (cancellation.isCancelled()) {
                return ScriptResult.error("Python execution cancelled");
            }

            int exitCode = process.exitValue();
            return new ScriptResult(exitCode == 0, exitCode, stdout.join().trim(), stderr.join().trim(), null);

        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        } catch (IOException e) {
            log.error("Python execution failed: {}", e.getMessage());
            return ScriptResult.error("Failed to run python: " + e.getMessage());
        } finally {
            deleteQuietly(scriptFile);
        }
    }

    private static String drain(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.debug("Could not delete {}: {}", path, e.getMessage());
        }
    }

    public record ScriptResult(boolean success, Integer exitCode, String output, String stderr, String error) {
        static ScriptResult error(String message) {
            return new ScriptResult(false, null, "", "", message);
        }
    }
}
