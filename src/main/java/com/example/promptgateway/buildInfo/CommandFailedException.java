package com.example.promptgateway.buildInfo;

import lombok.Getter;

import java.util.List;

@Getter
public class CommandFailedException extends Exception {
    private final List<String> command;
    private final String stdout;
    private final String stderr;

    public CommandFailedException(List<String> command, String message, String stdout, String stderr, Throwable cause) {
        super(String.join(" ", command) + ": " + message, cause);
        this.command = List.copyOf(command);
        this.stdout = stdout;
        this.stderr = stderr;
    }

    public CommandFailedException(List<String> command, String message, String stdout, String stderr) {
        this(command, message, stdout, stderr, null);
    }
}
