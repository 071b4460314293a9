package com.raditha.flowcheck.cli;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.raditha.flowcheck.cfg.CfgBuilder;
import com.raditha.flowcheck.cfg.DotExporter;
import com.raditha.flowcheck.equivalence.FunctionExtractor;
import com.raditha.flowcheck.util.SourceParser;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Prints the control-flow graph of functions in Graphviz DOT syntax.
 */
@Command(name = "cfg", mixinStandardHelpOptions = true,
        description = "Export control-flow graphs in DOT format")
public class CfgCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "Java source file", paramLabel = "<file>")
    Path file;

    @Option(names = "--func", description = "Only functions with this name (default: all)", paramLabel = "<name>")
    String function;

    @Option(names = {"-o", "--output"}, description = "Write the graph to this file instead of stdout",
            paramLabel = "<path>")
    Path output;

    @Override
    public Integer call() throws Exception {
        CompilationUnit cu = SourceParser.parse(file);
        Map<String, BodyDeclaration<?>> functions = new FunctionExtractor().extract(cu);
        CfgBuilder builder = new CfgBuilder();
        DotExporter exporter = new DotExporter();

        StringBuilder dot = new StringBuilder();
        for (Map.Entry<String, BodyDeclaration<?>> entry : functions.entrySet()) {
            if (function == null || function.equals(FunctionExtractor.simpleName(entry.getKey()))) {
                dot.append(exporter.export(builder.build(entry.getValue()), entry.getKey()));
            }
        }
        if (dot.length() == 0) {
            throw new IllegalArgumentException(function == null
                    ? "No functions found in " + file
                    : "Function not found: " + function);
        }

        if (output != null) {
            Files.writeString(output, dot.toString());
            spec.commandLine().getOut().println("CFG written to: " + output.toAbsolutePath());
        } else {
            PrintWriter out = spec.commandLine().getOut();
            out.print(dot);
            out.flush();
        }
        return 0;
    }
}
