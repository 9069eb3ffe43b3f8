package com.ruchira.nest.cli;

import com.ruchira.nest.exception.RecordFormatException;
import com.ruchira.nest.exception.TransformationException;
import com.ruchira.nest.parser.JsonParser;
import com.ruchira.nest.service.NestingTransformationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections.CollectionUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.ruchira.nest.constant.Constants.CLI_TOOL_NAME;
import static com.ruchira.nest.constant.Constants.EXIT_FAILURE;
import static com.ruchira.nest.constant.Constants.EXIT_SUCCESS;
import static com.ruchira.nest.constant.Constants.EXIT_USAGE;

/**
 * Parse input json array and print a nested dictionary of dictionaries of arrays,
 * with keys given as command line arguments.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NestCommand {

    static final String USAGE = """
            usage: nest [--help] [--pretty] [--recursive] nesting_level_1 [... nesting_level_n]

            Parse input json array and return a nested dictionary of dictionaries of arrays,
            with keys specified in command line arguments.

              --pretty      pretty print of nested entity, with sorted keys
              --recursive   use recursive realization of transformation
              --help        show this message and exit

            1. input from console
                #> nest currency
                >>> [{"currency": "GBP", "amount": 100}, {"currency": "EUR", "amount": 90}]
                {"GBP":[{"amount":100}],"EUR":[{"amount":90}]}

            2. input from pipeline
                #> cat input.json | nest currency country
                {"GBP":{"UK":[{"amount":100}]},"EUR":{"ES":[{"amount":90}]}}
            """;

    private final JsonParser jsonParser;
    private final NestingTransformationService nestingTransformationService;

    /**
     * Read flat records, nest them and print the result.
     *
     * @param options     parsed command line
     * @param in          where the JSON array is read from
     * @param interactive read a single line instead of the whole stream
     * @param out         receives the serialized result
     * @param err         receives error messages
     * @return process exit status
     */
    public int execute(CliOptions options, InputStream in, boolean interactive, PrintStream out, PrintStream err) {
        if (options.isHelp()) {
            out.print(USAGE);
            return EXIT_SUCCESS;
        }
        if (CollectionUtils.isNotEmpty(options.getUnknownOptions())) {
            err.printf("%s: unrecognized arguments: %s%n", CLI_TOOL_NAME,
                    options.getUnknownOptions().stream().map(name -> "--" + name).collect(Collectors.joining(" ")));
            err.print(USAGE);
            return EXIT_USAGE;
        }

        try {
            String rawFlatRecords = read(in, interactive);
            List<Map<String, Object>> flatRecords = jsonParser.parseFlatRecords(rawFlatRecords);

            Map<Object, Object> transformed = nestingTransformationService.transform(
                    options.getNestingLevels(), flatRecords, options.isRecursive());

            out.println(jsonParser.render(transformed, options.isPretty()));
            return EXIT_SUCCESS;
        } catch (RecordFormatException ex) {
            return fail(err, ex.getDetail(), ex.getReason());
        } catch (TransformationException ex) {
            return fail(err, ex.getDetail(), ex.getReason());
        }
    }

    /**
     * Prints {@code nest: <detail>: <reason>} as a single line.
     */
    private int fail(PrintStream err, String detail, String reason) {
        err.printf("%s: %s: %s%n", CLI_TOOL_NAME, StringUtils.normalizeSpace(detail), reason);
        return EXIT_FAILURE;
    }

    private String read(InputStream in, boolean interactive) {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        try {
            if (interactive) {
                String line = reader.readLine();
                return line == null ? "" : line;
            }
            return reader.lines().collect(Collectors.joining("\n"));
        } catch (IOException e) {
            log.error("Failed to read flat records: {}", e.getMessage(), e);
            throw new UncheckedIOException(e);
        }
    }
}
