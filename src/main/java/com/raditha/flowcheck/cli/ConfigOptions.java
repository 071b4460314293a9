package com.raditha.flowcheck.cli;

import com.raditha.flowcheck.config.CheckerConfig;
import com.raditha.flowcheck.config.CheckerSettings;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Checker options shared by the commands that verify code.
 * Configuration priority: CLI arguments > flowcheck.yml > preset defaults
 */
public class ConfigOptions {

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    Path configFile;

    @Option(names = "--preset", description = "Budget preset: quick, standard or thorough", paramLabel = "<name>")
    String preset;

    @Option(names = "--max-paths", description = "Maximum simple paths per function", paramLabel = "<n>")
    int maxPaths = 0; // 0 = use YAML/default

    @Option(names = "--max-steps", description = "Maximum search steps per function", paramLabel = "<n>")
    long maxSteps = 0; // 0 = use YAML/default

    @Option(names = "--detailed", description = "Include path tries in the report")
    boolean detailed = false;

    /**
     * @throws IllegalArgumentException if the options are inconsistent
     */
    void validate() {
        if (maxPaths < 0) {
            throw new IllegalArgumentException("--max-paths must be positive");
        }
        if (maxSteps < 0) {
            throw new IllegalArgumentException("--max-steps must be positive");
        }
    }

    CheckerConfig load() throws IOException {
        validate();
        return CheckerSettings.loadConfig(configFile, maxPaths, maxSteps, preset, detailed);
    }
}
