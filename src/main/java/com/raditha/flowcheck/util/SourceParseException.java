package com.raditha.flowcheck.util;

/**
 * A Java source that does not parse at the supported language level.
 * It stays an {@link IllegalArgumentException} because an unparsable input is a broken
 * precondition for every check.
 */
public class SourceParseException extends IllegalArgumentException {

    public SourceParseException(String message) {
        super(message);
    }
}
