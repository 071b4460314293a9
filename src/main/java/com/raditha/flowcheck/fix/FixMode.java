package com.raditha.flowcheck.fix;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * What happens to a fix once the checker has accepted it.
 */
public enum FixMode {
    /** Preview the diff and keep the fix only if the user agrees. */
    INTERACTIVE("interactive"),

    /** Keep every accepted fix. */
    BATCH("batch"),

    /** Report accepted fixes and their diff; the source file stays untouched. */
    DRY_RUN("dry-run");

    private final String cliName;

    FixMode(String cliName) {
        this.cliName = cliName;
    }

    /**
     * Look up a mode by its command-line name, ignoring case.
     *
     * @throws IllegalArgumentException for null or an unknown name
     */
    public static FixMode fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("No fix mode given");
        }
        String wanted = value.toLowerCase(Locale.ROOT);
        for (FixMode mode : values()) {
            if (mode.cliName.equals(wanted)) {
                return mode;
            }
        }
        String known = Arrays.stream(values()).map(FixMode::toCliString).collect(Collectors.joining(", "));
        throw new IllegalArgumentException("Unknown fix mode '" + value + "', expected one of: " + known);
    }

    public String toCliString() {
        return cliName;
    }
}
