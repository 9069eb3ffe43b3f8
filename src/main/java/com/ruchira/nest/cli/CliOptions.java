package com.ruchira.nest.cli;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Parsed command line: {@code nest [--pretty] [--recursive] nesting_level_1 [... nesting_level_n]}
 */
@Value
@Builder
public class CliOptions {

    List<String> nestingLevels;
    boolean pretty;
    boolean recursive;
    boolean help;
    List<String> unknownOptions;
}
