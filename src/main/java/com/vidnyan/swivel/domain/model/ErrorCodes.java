package com.vidnyan.swivel.domain.model;

import java.util.regex.Pattern;

/**
 * Error code catalogue. Codes follow {@code {Letter}{LevelDigit}{Sequence}} where the letter is
 * E (error), W (warning), D (structural) or S (sandbox). Downstream tooling parses these codes,
 * so existing values must never change.
 */
public final class ErrorCodes {

    public static final Pattern FORMAT = Pattern.compile("^[EWDS]([1-4])\\d{2}$");

    // L1
    public static final String SYNTAX_ERROR = "E101";
    public static final String ENCODING_ERROR = "E102";
    public static final String EMPTY_SOURCE = "E103";

    // L2
    public static final String FORBIDDEN_IMPORT = "E201";
    public static final String BLOCKING_CALL = "E202";
    public static final String MISSING_IMPORT = "W203";
    public static final String MISSING_FRAMEWORK_IMPORT = "W204";
    public static final String UNUSED_IMPORT = "W205";

    // L3
    public static final String NO_COMPONENT_TREE = "D300";
    public static final String INVALID_COMPONENT = "D301";
    public static final String MISSING_IDENTIFIER = "D302";
    public static final String DUPLICATE_IDENTIFIER = "D303";
    public static final String INVALID_LAYOUT = "D304";

    // L4
    public static final String NO_ENTRY_POINT = "S400";
    public static final String SANDBOX_TIMEOUT = "S401";
    public static final String SANDBOX_RUNTIME = "S402";
    public static final String HEADLESS_DISPLAY = "S403";

    private ErrorCodes() {
    }

    /**
     * Code used when a tier could not run because of an infrastructure fault.
     */
    public static String infrastructure(ValidationLevel level) {
        return switch (level) {
            case SYNTAX -> "E199";
            case STATIC -> "E299";
            case STRUCTURE -> "D399";
            case SANDBOX -> "S499";
        };
    }

    public static boolean isWellFormed(String code) {
        return code != null && FORMAT.matcher(code).matches();
    }

    /**
     * Tier digit embedded in a well-formed code.
     */
    public static int levelOf(String code) {
        var matcher = FORMAT.matcher(code);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Malformed error code: " + code);
        }
        return Integer.parseInt(matcher.group(1));
    }
}
