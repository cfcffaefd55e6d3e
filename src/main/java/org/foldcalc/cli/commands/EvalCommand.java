package org.foldcalc.cli.commands;

import com.typesafe.config.Config;
import org.foldcalc.calculator.Calculator;
import org.foldcalc.cli.CommandLineInterface;
import org.foldcalc.cli.session.CalculatorSession;
import org.foldcalc.cli.session.PrintWriterResultSink;
import org.foldcalc.cli.session.SessionStatistics;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "eval", description = "Evaluates each expression argument and prints one result per expression.")
public class EvalCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", paramLabel = "EXPRESSION", description = "Expressions such as \"2 + 3 * 4\". Quote them to keep them in one argument.")
    private List<String> expressions;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws IOException {
        Config config = parent.getConfig();
        PrintWriterResultSink sink = new PrintWriterResultSink(
                spec.commandLine().getOut(),
                spec.commandLine().getErr(),
                config.getBoolean("foldcalc.show-caret"));

        Iterator<String> remaining = expressions.iterator();
        SessionStatistics statistics = new CalculatorSession(
                new Calculator(),
                () -> remaining.hasNext() ? remaining.next() : null,
                sink).run();

        return statistics.failed() == 0 ? 0 : 1;
    }
}
