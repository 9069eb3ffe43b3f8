package com.ruchira.nest.cli;

import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NestCommandLineRunnerTest {

    @Test
    void shouldSplitFlagsFromNestingLevels() {
        CliOptions options = NestCommandLineRunner.toOptions(
                new DefaultApplicationArguments("--pretty", "currency", "country", "--recursive"));

        assertEquals(List.of("currency", "country"), options.getNestingLevels());
        assertTrue(options.isPretty());
        assertTrue(options.isRecursive());
        assertFalse(options.isHelp());
        assertEquals(List.of(), options.getUnknownOptions());
    }

    @Test
    void shouldDefaultToIterativeCompactOutput() {
        CliOptions options = NestCommandLineRunner.toOptions(new DefaultApplicationArguments("a"));

        assertFalse(options.isPretty());
        assertFalse(options.isRecursive());
        assertEquals(List.of("a"), options.getNestingLevels());
    }

    @Test
    void shouldCollectUnknownOptionsButIgnoreSpringProperties() {
        CliOptions options = NestCommandLineRunner.toOptions(
                new DefaultApplicationArguments("--verbose", "--spring.main.banner-mode=off", "--deep", "a"));

        assertEquals(List.of("deep", "verbose"), options.getUnknownOptions());
    }
}
