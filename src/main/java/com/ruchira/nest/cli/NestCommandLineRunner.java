package com.ruchira.nest.cli;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

import static com.ruchira.nest.constant.Constants.CLI_PROFILE;
import static com.ruchira.nest.constant.Constants.EXIT_SUCCESS;
import static com.ruchira.nest.constant.Constants.HELP_OPTION;
import static com.ruchira.nest.constant.Constants.PRETTY_OPTION;
import static com.ruchira.nest.constant.Constants.RECURSIVE_OPTION;

/**
 * Runs {@link NestCommand} against the process streams when the application starts
 * under the cli profile.
 */
@Component
@Profile(CLI_PROFILE)
@RequiredArgsConstructor
@Slf4j
public class NestCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Set<String> KNOWN_OPTIONS = Set.of(PRETTY_OPTION, RECURSIVE_OPTION, HELP_OPTION);

    private final NestCommand nestCommand;

    private int exitCode = EXIT_SUCCESS;

    @Override
    public void run(ApplicationArguments args) {
        CliOptions options = toOptions(args);
        log.debug("Running with {}", options);

        // System.console() is null unless both stdin and stdout are terminals, so piping stdout
        // (nest a > out.json) reads all of stdin rather than one line.
        exitCode = nestCommand.execute(options, System.in, System.console() != null, System.out, System.err);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static CliOptions toOptions(ApplicationArguments args) {
        List<String> unknownOptions = args.getOptionNames().stream()
                .filter(name -> !KNOWN_OPTIONS.contains(name))
                .filter(name -> !name.startsWith("spring."))
                .sorted()
                .toList();

        return CliOptions.builder()
                .nestingLevels(args.getNonOptionArgs())
                .pretty(args.containsOption(PRETTY_OPTION))
                .recursive(args.containsOption(RECURSIVE_OPTION))
                .help(args.containsOption(HELP_OPTION))
                .unknownOptions(unknownOptions)
                .build();
    }
}
