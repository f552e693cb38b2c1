package com.vidnyan.linthub.adapter.out.process;

import com.vidnyan.linthub.application.port.out.ProcessRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;

/**
 * Production {@link ProcessRunner} built on {@link ProcessBuilder}.
 * stdout is captured; stderr is copied live to the error stream and not kept.
 */
@Slf4j
@Component
public class SubprocessRunner implements ProcessRunner {

    private final PrintStream errorStream;

    public SubprocessRunner() {
        this(System.err);
    }

    SubprocessRunner(PrintStream errorStream) {
        this.errorStream = errorStream;
    }

    @Override
    public ProcessResult run(List<String> command, Duration timeout) {
        String commandLine = String.join(" ", command);
        Process process;
        try {
            process = new ProcessBuilder(command).start();
            process.getOutputStream().close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to start " + commandLine, e);
        }

        FutureTask<String> stdout = capture(process.getInputStream());
        FutureTask<Void> stderr = forward(process.getErrorStream(), errorStream);

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                process.waitFor();
                stdout.cancel(true);
                stderr.cancel(true);
                log.debug("Command '{}' killed after {}", commandLine, timeout);
                return ProcessResult.timedOut();
            }
            int exitCode = process.exitValue();
            log.debug("Command '{}' exited {}", commandLine, exitCode);
            stderr.get();
            return new ProcessResult(exitCode, stdout.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new IllegalStateException("Interrupted while waiting for " + commandLine, e);
        } catch (ExecutionException e) {
            throw new UncheckedIOException("Failed to read output of " + commandLine,
                    e.getCause() instanceof IOException io ? io : new IOException(e.getCause()));
        }
    }

    /**
     * Read a stream to its end on a separate thread and keep its content.
     */
    private static FutureTask<String> capture(InputStream in) {
        FutureTask<String> task = new FutureTask<>(() -> {
            try (in) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        });
        start(task, "process-stdout");
        return task;
    }

    /**
     * Copy a stream chunk by chunk to {@code out} on a separate thread.
     */
    private static FutureTask<Void> forward(InputStream in, PrintStream out) {
        FutureTask<Void> task = new FutureTask<>(() -> {
            byte[] chunk = new byte[8192];
            try (in) {
                int read;
                while ((read = in.read(chunk)) != -1) {
                    out.write(chunk, 0, read);
                    out.flush();
                }
            }
            return null;
        });
        start(task, "process-stderr");
        return task;
    }

    private static void start(Runnable task, String name) {
        Thread thread = new Thread(task, name);
        thread.setDaemon(true);
        thread.start();
    }
}
