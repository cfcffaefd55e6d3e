package org.foldcalc.cli.commands;

import com.typesafe.config.Config;
import org.foldcalc.calculator.Calculator;
import org.foldcalc.calculator.batch.BatchEvaluator;
import org.foldcalc.calculator.batch.LineOutcome;
import org.foldcalc.calculator.diagnostics.Diagnostic;
import org.foldcalc.cli.CommandLineInterface;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

@Command(name = "batch", description = "Evaluates every line of a file (or standard input) and prints the results in input order.")
public class BatchCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BatchCommand.class);

    @Option(names = {"-f", "--file"}, description = "The file to read. Reads standard input if omitted.")
    private File file;

    @Option(names = {"-p", "--parallelism"}, description = "Number of worker threads (default: foldcalc.batch.parallelism).")
    private Integer parallelism;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws InterruptedException {
        Config config = parent.getConfig();
        int threads = parallelism != null ? parallelism : config.getInt("foldcalc.batch.parallelism");
        if (threads < 1) {
            throw new ParameterException(spec.commandLine(), "Parallelism must be at least 1, got " + threads);
        }

        List<String> lines;
        try {
            lines = readLines();
        } catch (IOException e) {
            log.debug("Reading batch input failed", e);
            spec.commandLine().getErr().println("Cannot read input: " + e.getMessage());
            return 1;
        }
        List<LineOutcome> outcomes;
        try (BatchEvaluator evaluator = new BatchEvaluator(new Calculator(), threads)) {
            outcomes = evaluator.evaluateAll(lines);
        }

        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        int failed = 0;
        for (LineOutcome outcome : outcomes) {
            if (outcome instanceof LineOutcome.Success success) {
                out.println(success.value().render());
            } else if (outcome instanceof LineOutcome.Failure failure) {
                err.println("line " + failure.lineNumber() + ": " + Diagnostic.of(failure.line(), failure.error()));
                failed++;
            }
        }
        out.flush();
        err.flush();

        log.info("Batch finished: {} lines evaluated, {} failed", outcomes.size(), failed);
        return failed == 0 ? 0 : 1;
    }

    private List<String> readLines() throws IOException {
        if (file != null) {
            return Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
        }
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        return reader.lines().collect(Collectors.toList());
    }
}
