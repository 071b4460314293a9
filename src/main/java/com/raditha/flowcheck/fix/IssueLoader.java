package com.raditha.flowcheck.fix;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads proposed fixes from a JSON array of {@link Issue} objects.
 */
public class IssueLoader {

    private static final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private IssueLoader() {
        /* this is only a utility class */
    }

    public static List<Issue> load(Path file) throws IOException {
        return mapper.readValue(file.toFile(), new TypeReference<List<Issue>>() {
        });
    }

    public static List<Issue> parse(String json) throws IOException {
        return mapper.readValue(json, new TypeReference<List<Issue>>() {
        });
    }
}
