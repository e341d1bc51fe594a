package com.gateflow.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs each worker as a local command. The request is written as JSON to the process's
 * stdin; the response is read as JSON from its stdout. A non-zero exit code or a timeout is
 * an invocation failure.
 * <p>
 * Commands are configured per worker name and split on whitespace (no shell is involved).
 */
public class CommandWorkerInvoker implements WorkerInvoker {

    private static final Logger log = LoggerFactory.getLogger(CommandWorkerInvoker.class);

    private final Map<String, String> commands;
    private final Path workingDirectory;
    private final ObjectMapper objectMapper;
    private final ExecutorService pipeExecutor = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "worker-pipe");
        thread.setDaemon(true);
        return thread;
    });

    public CommandWorkerInvoker(Map<String, String> commands, Path workingDirectory, ObjectMapper objectMapper) {
        this.commands = Map.copyOf(commands);
        this.workingDirectory = workingDirectory;
        this.objectMapper = objectMapper;
    }

    @Override
    public WorkerResponse invoke(WorkerRequest request, Duration timeout) {
        String worker = request.worker();
        String commandLine = commands.get(worker);
        if (commandLine == null || commandLine.isBlank()) {
            throw new WorkerInvocationException(worker, "no command configured for " + worker);
        }
        List<String> command = List.of(commandLine.trim().split("\\s+"));
        String input = WorkerPayloads.encode(objectMapper, request);

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(workingDirectory.toFile())
                    .redirectErrorStream(false)
                    .start();
        } catch (IOException e) {
            throw new WorkerInvocationException(worker, worker + " could not be started: " + e.getMessage(), e);
        }

        // Drain both pipes concurrently so a chatty worker cannot block on a full buffer
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()), pipeExecutor);
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readAll(process.getErrorStream()), pipeExecutor);

        // A worker that never reads stdin must not hold the caller past the timeout
        CompletableFuture.runAsync(() -> writeAll(process.getOutputStream(), input, worker), pipeExecutor);

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new WorkerInvocationException(worker, worker + " timed out after " + timeout.toSeconds() + "s");
            }
            String errors = stderr.get(5, TimeUnit.SECONDS);
            if (!errors.isBlank()) {
                log.debug("{} stderr: {}", worker, errors.strip());
            }
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new WorkerInvocationException(worker, worker + " exited with code " + exitCode
                        + (errors.isBlank() ? "" : ": " + lastLine(errors)));
            }
            return WorkerPayloads.decode(objectMapper, worker, stdout.get(5, TimeUnit.SECONDS));
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new WorkerInvocationException(worker, worker + " call interrupted", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new WorkerInvocationException(worker, worker + " output could not be read", e);
        }
    }

    private static void writeAll(OutputStream out, String input, String worker) {
        try (out) {
            out.write(input.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.debug("{} closed stdin early: {}", worker, e.getMessage());
        }
    }

    private static String readAll(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read worker output", e);
        }
    }

    private static String lastLine(String text) {
        String[] lines = text.strip().split("\\R");
        return lines[lines.length - 1];
    }
}
