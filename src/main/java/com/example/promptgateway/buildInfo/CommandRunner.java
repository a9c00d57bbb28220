package com.example.promptgateway.buildInfo;

import java.time.Duration;
import java.util.List;

public interface CommandRunner {
    /**
     * Runs a command and returns its standard output.
     *
     * @throws CommandFailedException when the command cannot start, exits non-zero or exceeds the timeout
     */
    String run(List<String> command, Duration timeout) throws CommandFailedException;
}
