package com.normalform.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;

/**
 * Runs {@link NormalFormCommand} once at application startup and keeps its exit code
 * for {@link org.springframework.boot.SpringApplication#exit}.
 */
public class NormalFormRunner implements CommandLineRunner, ExitCodeGenerator {

    private final NormalFormCommand command;
    private int exitCode = NormalFormCommand.EXIT_OK;

    public NormalFormRunner(NormalFormCommand command) {
        this.command = command;
    }

    @Override
    public void run(String... args) {
        exitCode = command.run(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
