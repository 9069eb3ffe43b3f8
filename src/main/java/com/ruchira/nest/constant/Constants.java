package com.ruchira.nest.constant;


public final class Constants {

    private Constants() {
    }

    // Transformation error reasons
    public static final String EMPTY_NESTING_LEVELS = "empty nesting levels";
    public static final String EMPTY_NESTING_LEVELS_DETAIL = "[]";
    public static final String NO_SUCH_NESTING_LEVEL = "no such nesting level";
    public static final String INCORRECT_FLAT_RECORDS_FORMAT = "incorrect format of flat dictionaries";

    // HTTP
    public static final String TRANSFORMATION_PATH = "/transformation";
    public static final String BASIC_AUTH_SCHEME = "Basic";
    public static final String INCORRECT_CREDENTIALS_MESSAGE = "Incorrect username or password";
    public static final String UNEXPECTED_ERROR_MESSAGE = "An unexpected error occurred";

    // Request body fields
    public static final String FLAT_DICTS_FIELD = "flat_dicts";
    public static final String NESTING_LEVELS_FIELD = "nesting_levels";
    public static final String USE_RECURSIVE_REALIZATION_FIELD = "use_recursive_realization";

    // CLI
    public static final String CLI_PROFILE = "cli";
    public static final String CLI_TOOL_NAME = "nest";
    public static final String PRETTY_OPTION = "pretty";
    public static final String RECURSIVE_OPTION = "recursive";
    public static final String HELP_OPTION = "help";
    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;
}
