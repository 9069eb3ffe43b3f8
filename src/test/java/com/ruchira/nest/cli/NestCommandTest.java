package com.ruchira.nest.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ruchira.nest.config.JacksonConfig;
import com.ruchira.nest.parser.JsonParser;
import com.ruchira.nest.service.NestingTransformationService;
import com.ruchira.nest.strategy.IterativeNestingStrategy;
import com.ruchira.nest.strategy.NestingStrategyFactory;
import com.ruchira.nest.strategy.RecursiveNestingStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NestCommandTest {

    private static final String CURRENCY_INPUT = """
            [
              {"country": "US", "city": "Boston", "currency": "USD", "amount": 100},
              {"country": "FR", "city": "Paris", "currency": "EUR", "amount": 20},
              {"country": "FR", "city": "Lyon", "currency": "EUR", "amount": 11.4}
            ]
            """;

    private NestCommand nestCommand;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        NestingStrategyFactory factory =
                new NestingStrategyFactory(List.of(new IterativeNestingStrategy(), new RecursiveNestingStrategy()));
        nestCommand = new NestCommand(
                new JsonParser(JacksonConfig.configure(new ObjectMapper())),
                new NestingTransformationService(factory));
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    @Test
    @DisplayName("Piped input is nested and printed as compact JSON")
    void shouldPrintNestedRecords() {
        int status = run(options(List.of("currency", "country", "city")), CURRENCY_INPUT, false);

        assertEquals(0, status);
        assertEquals("{\"USD\":{\"US\":{\"Boston\":[{\"amount\":100}]}},"
                + "\"EUR\":{\"FR\":{\"Paris\":[{\"amount\":20}],\"Lyon\":[{\"amount\":11.4}]}}}",
                stdout().trim());
        assertEquals("", stderr());
    }

    @Test
    void shouldPrintSameOutputWithRecursiveRealization() {
        run(options(List.of("currency", "country")), CURRENCY_INPUT, false);
        String iterative = stdout();
        out.reset();

        int status = run(CliOptions.builder().nestingLevels(List.of("currency", "country")).recursive(true)
                .unknownOptions(List.of()).build(), CURRENCY_INPUT, false);

        assertEquals(0, status);
        assertEquals(iterative, stdout());
    }

    @Test
    void shouldPrettyPrintWithSortedKeys() {
        int status = run(CliOptions.builder().nestingLevels(List.of("currency")).pretty(true)
                .unknownOptions(List.of()).build(), CURRENCY_INPUT, false);

        assertEquals(0, status);
        String printed = stdout();
        assertTrue(printed.contains("\n  \"EUR\""), printed);
        assertTrue(printed.indexOf("\"EUR\"") < printed.indexOf("\"USD\""));
    }

    @Test
    void shouldReadOneLineWhenInteractive() {
        int status = run(options(List.of("a")), "[{\"a\": 1, \"b\": 2}]\nthis line is never read", true);

        assertEquals(0, status);
        assertEquals("{\"1\":[{\"b\":2}]}", stdout().trim());
    }

    @Test
    void shouldReadWholeStreamWhenNotInteractive() {
        int status = run(options(List.of("a")), "[{\"a\": 1,\n \"b\": 2}]\n", false);

        assertEquals(0, status);
        assertEquals("{\"1\":[{\"b\":2}]}", stdout().trim());
    }

    @Test
    void shouldFailOnTrailingInput() {
        int status = run(options(List.of("a")), "[{\"a\": 1}]\n[{\"a\": 2}]", false);

        assertEquals(1, status);
        assertTrue(stderr().trim().endsWith(": incorrect format of flat dictionaries"), stderr());
        assertEquals("", stdout());
    }

    @Test
    void shouldReportMissingFieldAndFail() {
        int status = run(options(List.of("a", "B")), "[{\"a\": 1, \"b\": 2}]", false);

        assertEquals(1, status);
        assertEquals("nest: B: no such nesting level", stderr().trim());
        assertEquals("", stdout());
    }

    @Test
    void shouldReportEmptyNestingLevelsAndFail() {
        int status = run(options(List.of()), "[]", false);

        assertEquals(1, status);
        assertEquals("nest: []: empty nesting levels", stderr().trim());
    }

    @Test
    void shouldReportMalformedInputAndFail() {
        int status = run(options(List.of("a")), "[{\"a\": 1", false);

        assertEquals(1, status);
        String message = stderr().trim();
        assertTrue(message.startsWith("nest: "), message);
        assertTrue(message.endsWith(": incorrect format of flat dictionaries"), message);
        assertEquals(1, message.lines().count());
    }

    @Test
    void shouldRejectUnknownOptions() {
        int status = run(CliOptions.builder().nestingLevels(List.of("a")).unknownOptions(List.of("verbose"))
                .build(), "[]", false);

        assertEquals(2, status);
        assertTrue(stderr().startsWith("nest: unrecognized arguments: --verbose"));
    }

    @Test
    void shouldPrintUsageOnHelp() {
        int status = run(CliOptions.builder().nestingLevels(List.of()).help(true).unknownOptions(List.of()).build(),
                "", false);

        assertEquals(0, status);
        assertTrue(stdout().startsWith("usage: nest"));
    }

    private static CliOptions options(List<String> nestingLevels) {
        return CliOptions.builder().nestingLevels(nestingLevels).unknownOptions(List.of()).build();
    }

    private int run(CliOptions options, String input, boolean interactive) {
        return nestCommand.execute(options,
                new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
                interactive,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }
}
