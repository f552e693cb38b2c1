package com.vidnyan.linthub.application.port.out;

import java.time.Duration;
import java.util.List;

/**
 * Port for running an external tool as a subprocess.
 * Implementations must kill the process once the timeout elapses.
 */
@FunctionalInterface
public interface ProcessRunner {

    /**
     * Run a command and wait for it to exit or time out.
     *
     * @param command executable followed by its arguments
     * @param timeout how long the process may run before it is killed
     * @return exit status with the captured stdout; stderr is streamed to the caller, not captured
     */
    ProcessResult run(List<String> command, Duration timeout);

    /**
     * Outcome of a finished or killed process.
     * A process killed on timeout reports {@link #TIMEOUT_EXIT_CODE}, never its real status.
     */
    record ProcessResult(int exitCode, String stdout) {

        /** Reserved status of a process killed on timeout; real exit codes are never negative. */
        public static final int TIMEOUT_EXIT_CODE = -1;

        public static ProcessResult timedOut() {
            return new ProcessResult(TIMEOUT_EXIT_CODE, "");
        }

        public boolean isKilledByTimeout() {
            return exitCode == TIMEOUT_EXIT_CODE;
        }
    }
}
