package com.raditha.flowcheck.util;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;

import java.io.IOException;
import java.nio.file.Path;
import java.util.stream.Collectors;

/**
 * Parses Java sources at the Java 17 language level.
 * A fresh parser is created per call because {@link JavaParser} instances are not
 * thread safe.
 */
public class SourceParser {

    private SourceParser() {
        /* this is only a utility class */
    }

    /**
     * @throws SourceParseException if the source does not parse
     */
    public static CompilationUnit parse(String source) {
        return unwrap(newParser().parse(source), "<source>");
    }

    /**
     * Parse a file. The resulting unit records the file as its storage.
     *
     * @throws IOException              if the file cannot be read
     * @throws SourceParseException if the file does not parse
     */
    public static CompilationUnit parse(Path file) throws IOException {
        return unwrap(newParser().parse(file), file.toString());
    }

    private static JavaParser newParser() {
        ParserConfiguration configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        return new JavaParser(configuration);
    }

    private static CompilationUnit unwrap(ParseResult<CompilationUnit> result, String origin) {
        if (result.isSuccessful() && result.getResult().isPresent()) {
            return result.getResult().get();
        }
        String problems = result.getProblems().stream()
                .map(Problem::getVerboseMessage)
                .collect(Collectors.joining("; "));
        throw new SourceParseException("Cannot parse " + origin + ": " + problems);
    }
}
